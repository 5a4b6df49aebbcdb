package dev.univer.splitledger.service;

import dev.univer.splitledger.model.Expense;
import dev.univer.splitledger.model.ExpenseSplit;
import dev.univer.splitledger.model.GroupMember;
import dev.univer.splitledger.model.Payment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays a group's history into net balances:
 * {@code paid - owed - paymentsOut + paymentsIn}. Positive means the group owes the member,
 * negative means the member owes the group. Only the given members appear in the result. Nothing is cached.
 */
@Component
@Slf4j
public class BalanceEngine {

    /**
     * @param members  the group's members, the result keeps their order
     * @param expenses the group's expenses, amounts taken from {@link Expense#getBaseAmount()}
     * @param splits   every split of those expenses
     * @param payments the group's payments
     */
    public Map<String, BigDecimal> computeBalances(List<GroupMember> members,
                                                   List<Expense> expenses,
                                                   List<ExpenseSplit> splits,
                                                   List<Payment> payments) {
        Map<String, BigDecimal> balances = new LinkedHashMap<>();
        for (GroupMember m : members) balances.put(m.getId(), BigDecimal.ZERO);

        // payer fronted the money
        for (Expense e : expenses) {
            String payer = e.getPaidByMemberId();
            if (payer != null && balances.containsKey(payer)) {
                balances.merge(payer, e.getBaseAmount(), BigDecimal::add);
            }
        }

        // each member consumed its share; rows of non-members are ignored
        for (ExpenseSplit s : splits) {
            applyIfMember(balances, s.getMemberId(), s.getAmount().negate());
        }

        // settled outside the ledger
        for (Payment p : payments) {
            applyIfMember(balances, p.getFromMemberId(), p.getAmount().negate());
            applyIfMember(balances, p.getToMemberId(), p.getAmount());
        }

        log.debug("Balances over {} expenses, {} splits, {} payments: {}",
                expenses.size(), splits.size(), payments.size(), balances);
        return balances;
    }

    private static void applyIfMember(Map<String, BigDecimal> balances, String memberId, BigDecimal delta) {
        if (memberId != null && balances.containsKey(memberId)) {
            balances.merge(memberId, delta, BigDecimal::add);
        }
    }
}
