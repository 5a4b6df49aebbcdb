package dev.univer.splitledger.service;

import dev.univer.splitledger.model.ExpenseGroup;
import dev.univer.splitledger.model.GroupMember;
import dev.univer.splitledger.model.Settlement;
import dev.univer.splitledger.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class SummaryService {
    private final GroupService groupService;
    private final LedgerService ledgerService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public String renderSummary(String groupId) {
        ExpenseGroup group = groupService.requireGroup(groupId);
        List<GroupMember> members = ledgerService.getGroupMembers(groupId);
        if (members.isEmpty()) {
            return "No members in " + group.getName() + " yet.";
        }
        Map<String, String> names = members.stream()
                .collect(Collectors.toMap(GroupMember::getId, GroupMember::getName));
        Function<String, String> nameOf = id -> names.getOrDefault(id, id);

        Map<String, BigDecimal> balances = ledgerService.calculateGroupBalances(groupId);
        List<Settlement> settlements = ledgerService.getSettlementSuggestions(groupId);

        StringBuilder sb = new StringBuilder();
        sb.append("Balances for ").append(group.getName())
          .append(" (").append(group.getCurrencyCode()).append(") on ").append(LocalDate.now(clock)).append("\n");
        balances.forEach((id, bal) ->
                sb.append("• ").append(nameOf.apply(id)).append(": ").append(MoneyUtil.formatSigned(bal)).append("\n"));

        if (settlements.isEmpty()) {
            sb.append("Everyone is settled up.");
        } else {
            sb.append("Suggested transfers:\n");
            for (Settlement s : settlements) {
                sb.append("• ").append(nameOf.apply(s.fromMemberId()))
                  .append(" → ").append(nameOf.apply(s.toMemberId()))
                  .append(": ").append(MoneyUtil.money(s.amount()).toPlainString()).append("\n");
            }
        }
        return sb.toString().trim();
    }
}
