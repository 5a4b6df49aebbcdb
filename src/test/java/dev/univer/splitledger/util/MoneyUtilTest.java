package dev.univer.splitledger.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class MoneyUtilTest {

    @Test
    void moneyRoundsHalfUpToCents() {
        assertThat(MoneyUtil.money(new BigDecimal("2.345"))).isEqualTo(new BigDecimal("2.35"));
        assertThat(MoneyUtil.money(new BigDecimal("7"))).isEqualTo(new BigDecimal("7.00"));
    }

    @Test
    void centsConversion() {
        assertThat(MoneyUtil.toCents(new BigDecimal("33.34"))).isEqualTo(3334L);
        assertThat(MoneyUtil.fromCents(-1250)).isEqualTo(new BigDecimal("-12.50"));
    }

    @Test
    void sumAndTolerance() {
        BigDecimal total = MoneyUtil.sum(List.of(new BigDecimal("33.34"), new BigDecimal("33.33"), new BigDecimal("33.33")));
        assertThat(total).isEqualByComparingTo("100");
        assertThat(MoneyUtil.withinTolerance(new BigDecimal("-0.01"), new BigDecimal("0.01"))).isTrue();
        assertThat(MoneyUtil.withinTolerance(new BigDecimal("0.02"), new BigDecimal("0.01"))).isFalse();
    }

    @Test
    void currencyCodes() {
        assertThat(MoneyUtil.normalizeCurrency(" eur ")).isEqualTo("EUR");
        assertThatThrownBy(() -> MoneyUtil.normalizeCurrency("EU")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MoneyUtil.normalizeCurrency(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void signedFormat() {
        assertThat(MoneyUtil.formatSigned(new BigDecimal("60"))).isEqualTo("+60.00");
        assertThat(MoneyUtil.formatSigned(new BigDecimal("-30"))).isEqualTo("-30.00");
        assertThat(MoneyUtil.formatSigned(BigDecimal.ZERO)).isEqualTo("0.00");
    }
}
