package dev.univer.splitledger.model;

import java.math.BigDecimal;

public record AmountShare(String memberId, BigDecimal amount) {}
