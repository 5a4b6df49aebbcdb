package dev.univer.splitledger.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

public class MoneyUtil {
    public static final int SCALE = 2;
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");

    private MoneyUtil() {}

    /** Amount in minor units (two fractional digits), half-up. */
    public static BigDecimal money(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal sum(Collection<BigDecimal> amounts) {
        return amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static boolean withinTolerance(BigDecimal discrepancy, BigDecimal tolerance) {
        return discrepancy.abs().compareTo(tolerance) <= 0;
    }

    public static long toCents(BigDecimal amount) {
        return money(amount).movePointRight(SCALE).longValueExact();
    }

    public static BigDecimal fromCents(long cents) {
        return BigDecimal.valueOf(cents, SCALE);
    }

    /** "EUR" from " eur "; anything that is not three letters is rejected. */
    public static String normalizeCurrency(String code) {
        if (code == null) throw new IllegalArgumentException("Currency code is required");
        String norm = code.trim().toUpperCase(Locale.ROOT);
        if (!CURRENCY.matcher(norm).matches()) {
            throw new IllegalArgumentException("Invalid currency code: " + code);
        }
        return norm;
    }

    /** "+60.00", "-30.00", "0.00". */
    public static String formatSigned(BigDecimal amount) {
        BigDecimal m = money(amount);
        return (m.signum() > 0 ? "+" : "") + m.toPlainString();
    }
}
