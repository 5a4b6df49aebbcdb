package dev.univer.splitledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SplitLedgerApplication {
    public static void main(String[] args) {
        SpringApplication.run(SplitLedgerApplication.class, args);
    }
}
