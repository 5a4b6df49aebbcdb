package dev.univer.splitledger.service;

import dev.univer.splitledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts through the base currency using the configured {@code ledger.exchange-rates}.
 * A currency without a configured rate converts at 1.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateTableCurrencyConverter implements CurrencyConverter {
    private static final int WORK_SCALE = 10;

    private final LedgerProperties props;

    @Override
    public BigDecimal convert(BigDecimal amount, String fromCurrency, String toCurrency) {
        if (fromCurrency.equalsIgnoreCase(toCurrency)) return amount;
        BigDecimal inBase = amount.multiply(rate(fromCurrency));
        return inBase.divide(rate(toCurrency), WORK_SCALE, RoundingMode.HALF_EVEN);
    }

    private BigDecimal rate(String currency) {
        if (currency.equalsIgnoreCase(props.getBaseCurrency())) return BigDecimal.ONE;
        BigDecimal rate = props.getExchangeRates().get(currency.toUpperCase());
        if (rate == null || rate.signum() <= 0) {
            log.debug("No exchange rate for {}, using 1", currency);
            return BigDecimal.ONE;
        }
        return rate;
    }
}
