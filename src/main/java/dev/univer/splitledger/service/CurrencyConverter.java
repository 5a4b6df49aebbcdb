package dev.univer.splitledger.service;

import java.math.BigDecimal;

public interface CurrencyConverter {
    /** Converts {@code amount} from one currency to another; the result is not rounded to minor units. */
    BigDecimal convert(BigDecimal amount, String fromCurrency, String toCurrency);
}
