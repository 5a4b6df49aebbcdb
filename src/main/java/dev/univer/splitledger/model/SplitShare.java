package dev.univer.splitledger.model;

import java.math.BigDecimal;

/** One member's computed share of an expense; {@code percentage} is null unless the split was by percentage. */
public record SplitShare(String memberId, BigDecimal amount, BigDecimal percentage) {}
