package dev.univer.splitledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
