package dev.univer.splitledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "ledger")
@Getter @Setter
public class LedgerProperties {
    // currency of personal expenses and the reference for exchangeRates
    private String baseCurrency = "USD";

    // base-currency units for one unit of the keyed currency
    private Map<String, BigDecimal> exchangeRates = new HashMap<>();

    // allowed gap between a split's total and its target (percent points or money)
    private BigDecimal splitTolerance = new BigDecimal("0.01");
}
