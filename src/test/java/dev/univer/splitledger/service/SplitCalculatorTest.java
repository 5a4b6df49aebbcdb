package dev.univer.splitledger.service;

import static org.assertj.core.api.Assertions.assertThat;

import dev.univer.splitledger.model.AmountShare;
import dev.univer.splitledger.model.PercentageShare;
import dev.univer.splitledger.model.SplitShare;
import dev.univer.splitledger.util.MoneyUtil;
import java.math.BigDecimal;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class SplitCalculatorTest {

    private final SplitCalculator calculator = new SplitCalculator();

    @Test
    void equalSplitGivesRemainderCentToFirstMember() {
        List<SplitShare> shares = calculator.equal(new BigDecimal("100"), List.of("a", "b", "c"));

        assertThat(shares).extracting(SplitShare::amount)
                .containsExactly(new BigDecimal("33.34"), new BigDecimal("33.33"), new BigDecimal("33.33"));
        assertThat(shares).extracting(SplitShare::memberId).containsExactly("a", "b", "c");
        assertThat(shares).extracting(SplitShare::percentage).containsOnlyNulls();
    }

    @Test
    void equalSplitAlwaysAddsUpToTotal() {
        List<BigDecimal> totals = List.of(new BigDecimal("0.01"), new BigDecimal("0.05"), new BigDecimal("10"),
                new BigDecimal("99.99"), new BigDecimal("1234.57"));
        for (BigDecimal total : totals) {
            for (int n = 1; n <= 7; n++) {
                List<String> members = IntStream.range(0, n).mapToObj(i -> "m" + i).toList();
                List<SplitShare> shares = calculator.equal(total, members);

                assertThat(MoneyUtil.sum(shares.stream().map(SplitShare::amount).toList()))
                        .as("%s split %d ways", total, n)
                        .isEqualByComparingTo(total);
                BigDecimal max = shares.stream().map(SplitShare::amount).max(BigDecimal::compareTo).orElseThrow();
                BigDecimal min = shares.stream().map(SplitShare::amount).min(BigDecimal::compareTo).orElseThrow();
                assertThat(max.subtract(min)).isLessThanOrEqualTo(new BigDecimal("0.01"));
            }
        }
    }

    @Test
    void percentageSplitRecordsPercentages() {
        List<SplitShare> shares = calculator.byPercentage(new BigDecimal("200"), List.of(
                new PercentageShare("a", new BigDecimal("50")),
                new PercentageShare("b", new BigDecimal("30")),
                new PercentageShare("c", new BigDecimal("20"))));

        assertThat(shares).extracting(SplitShare::amount)
                .containsExactly(new BigDecimal("100.00"), new BigDecimal("60.00"), new BigDecimal("40.00"));
        assertThat(shares).extracting(SplitShare::percentage)
                .containsExactly(new BigDecimal("50"), new BigDecimal("30"), new BigDecimal("20"));
    }

    @Test
    void percentageSplitHandsLeftoverCentToLargestFraction() {
        // exact shares 3.333, 3.333, 3.334
        List<SplitShare> shares = calculator.byPercentage(new BigDecimal("10"), List.of(
                new PercentageShare("a", new BigDecimal("33.33")),
                new PercentageShare("b", new BigDecimal("33.33")),
                new PercentageShare("c", new BigDecimal("33.34"))));

        assertThat(shares).extracting(SplitShare::amount)
                .containsExactly(new BigDecimal("3.33"), new BigDecimal("3.33"), new BigDecimal("3.34"));
    }

    @Test
    void percentageSplitWithinToleranceStillAddsUpToTotal() {
        List<SplitShare> over = calculator.byPercentage(new BigDecimal("10000"), List.of(
                new PercentageShare("a", new BigDecimal("50.005")),
                new PercentageShare("b", new BigDecimal("50.005"))));
        List<SplitShare> under = calculator.byPercentage(new BigDecimal("10000"), List.of(
                new PercentageShare("a", new BigDecimal("49.995")),
                new PercentageShare("b", new BigDecimal("49.995"))));

        assertThat(MoneyUtil.sum(over.stream().map(SplitShare::amount).toList()))
                .isEqualByComparingTo("10000");
        assertThat(MoneyUtil.sum(under.stream().map(SplitShare::amount).toList()))
                .isEqualByComparingTo("10000");
    }

    @Test
    void amountSplitKeepsAmountsAsGiven() {
        List<SplitShare> shares = calculator.byAmount(List.of(
                new AmountShare("a", new BigDecimal("20")),
                new AmountShare("b", new BigDecimal("20")),
                new AmountShare("c", new BigDecimal("10"))));

        assertThat(shares).extracting(SplitShare::amount)
                .containsExactly(new BigDecimal("20.00"), new BigDecimal("20.00"), new BigDecimal("10.00"));
    }

    @Test
    void discrepanciesAreActualMinusExpected() {
        assertThat(calculator.percentageDiscrepancy(List.of(
                new PercentageShare("a", new BigDecimal("50")),
                new PercentageShare("b", new BigDecimal("30")),
                new PercentageShare("c", new BigDecimal("21")))))
                .isEqualByComparingTo("1");
        assertThat(calculator.amountDiscrepancy(List.of(
                new AmountShare("a", new BigDecimal("20")),
                new AmountShare("b", new BigDecimal("20"))), new BigDecimal("50")))
                .isEqualByComparingTo("-10");
    }

    @Test
    void noMembersGivesNoShares() {
        assertThat(calculator.equal(new BigDecimal("10"), List.of())).isEmpty();
    }
}
