package dev.univer.splitledger.service;

import dev.univer.splitledger.model.AmountShare;
import dev.univer.splitledger.model.PercentageShare;
import dev.univer.splitledger.model.SplitShare;
import dev.univer.splitledger.util.MoneyUtil;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Turns an expense total into per-member shares.
 *
 * <p>Shares are whole cents. Each exact share is floored to cents and the cents still missing from the
 * total are handed out one by one to the members whose share lost the largest fraction, earlier members
 * first on ties. So 100 split three ways is 33.34, 33.33, 33.33 and every list adds up to the total.
 *
 * <p>Totals are not validated here; the caller checks them before anything is stored.
 */
@Component
public class SplitCalculator {
    private static final int WORK_SCALE = 10;

    public List<SplitShare> equal(BigDecimal total, List<String> memberIds) {
        if (memberIds.isEmpty()) return List.of();
        BigDecimal exact = MoneyUtil.money(total).divide(BigDecimal.valueOf(memberIds.size()), WORK_SCALE, RoundingMode.DOWN);
        List<BigDecimal> exactShares = memberIds.stream().map(id -> exact).toList();
        long[] cents = allocate(MoneyUtil.toCents(total), exactShares);

        List<SplitShare> shares = new ArrayList<>(memberIds.size());
        for (int i = 0; i < memberIds.size(); i++) {
            shares.add(new SplitShare(memberIds.get(i), MoneyUtil.fromCents(cents[i]), null));
        }
        return shares;
    }

    public List<SplitShare> byPercentage(BigDecimal total, List<PercentageShare> percentages) {
        BigDecimal money = MoneyUtil.money(total);
        List<BigDecimal> exactShares = percentages.stream()
                .map(p -> money.multiply(p.percentage()).divide(MoneyUtil.HUNDRED))
                .toList();
        long[] cents = allocate(MoneyUtil.toCents(total), exactShares);

        List<SplitShare> shares = new ArrayList<>(percentages.size());
        for (int i = 0; i < percentages.size(); i++) {
            PercentageShare p = percentages.get(i);
            shares.add(new SplitShare(p.memberId(), MoneyUtil.fromCents(cents[i]), p.percentage()));
        }
        return shares;
    }

    public List<SplitShare> byAmount(List<AmountShare> amounts) {
        return amounts.stream()
                .map(a -> new SplitShare(a.memberId(), MoneyUtil.money(a.amount()), null))
                .toList();
    }

    /** Sum of the percentages minus 100. */
    public BigDecimal percentageDiscrepancy(List<PercentageShare> percentages) {
        return MoneyUtil.sum(percentages.stream().map(PercentageShare::percentage).toList())
                .subtract(MoneyUtil.HUNDRED);
    }

    /** Sum of the amounts minus the expected total. */
    public BigDecimal amountDiscrepancy(List<AmountShare> amounts, BigDecimal total) {
        return MoneyUtil.sum(amounts.stream().map(AmountShare::amount).toList())
                .subtract(total);
    }

    private long[] allocate(long totalCents, List<BigDecimal> exactShares) {
        int n = exactShares.size();
        if (n == 0) return new long[0];
        long[] cents = new long[n];
        BigDecimal[] lost = new BigDecimal[n];
        long allocated = 0;
        for (int i = 0; i < n; i++) {
            BigDecimal exactCents = exactShares.get(i).movePointRight(MoneyUtil.SCALE);
            BigDecimal floor = exactCents.setScale(0, RoundingMode.FLOOR);
            cents[i] = floor.longValueExact();
            lost[i] = exactCents.subtract(floor);
            allocated += cents[i];
        }

        // stable sort keeps input order among equal fractions
        List<Integer> order = IntStream.range(0, n).boxed()
                .sorted(Comparator.comparing((Integer i) -> lost[i]).reversed())
                .toList();

        long leftover = totalCents - allocated;
        for (int k = 0; leftover > 0; k++) {
            cents[order.get(k % n)]++;
            leftover--;
        }
        // overshoot only happens when percentages add up to a bit more than 100
        while (leftover < 0) {
            boolean taken = false;
            for (int k = n - 1; k >= 0 && leftover < 0; k--) {
                int i = order.get(k);
                if (cents[i] > 0) {
                    cents[i]--;
                    leftover++;
                    taken = true;
                }
            }
            if (!taken) break;
        }
        return cents;
    }
}
