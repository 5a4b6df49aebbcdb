package dev.univer.splitledger.model;

import java.math.BigDecimal;

/** Suggested transfer: {@code fromMemberId} pays {@code toMemberId}. */
public record Settlement(String fromMemberId, String toMemberId, BigDecimal amount) {}
