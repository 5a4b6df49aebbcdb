package dev.univer.splitledger.model;

import java.math.BigDecimal;

public record PercentageShare(String memberId, BigDecimal percentage) {}
