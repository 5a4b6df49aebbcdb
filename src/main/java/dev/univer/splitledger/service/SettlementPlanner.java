package dev.univer.splitledger.service;

import dev.univer.splitledger.model.Settlement;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Greedy two-pointer debt simplification. Creditors and debtors are matched in the balance map's order;
 * each step settles the smaller of the two open amounts, so at most {@code creditors + debtors - 1}
 * transfers come out. Not the fewest transfers for every input.
 */
@Component
public class SettlementPlanner {

    public List<Settlement> suggestSettlements(Map<String, BigDecimal> balances) {
        List<Open> creditors = new ArrayList<>();
        List<Open> debtors = new ArrayList<>();
        balances.forEach((memberId, balance) -> {
            if (balance.signum() > 0) creditors.add(new Open(memberId, balance));
            else if (balance.signum() < 0) debtors.add(new Open(memberId, balance.negate()));
        });

        List<Settlement> out = new ArrayList<>();
        int c = 0;
        int d = 0;
        while (c < creditors.size() && d < debtors.size()) {
            Open creditor = creditors.get(c);
            Open debtor = debtors.get(d);

            BigDecimal amount = creditor.remaining.min(debtor.remaining);
            out.add(new Settlement(debtor.memberId, creditor.memberId, amount));

            creditor.remaining = creditor.remaining.subtract(amount);
            debtor.remaining = debtor.remaining.subtract(amount);

            if (creditor.remaining.signum() == 0) c++;
            if (debtor.remaining.signum() == 0) d++;
        }
        return out;
    }

    private static final class Open {
        final String memberId;
        BigDecimal remaining;

        Open(String memberId, BigDecimal remaining) {
            this.memberId = memberId;
            this.remaining = remaining;
        }
    }
}
