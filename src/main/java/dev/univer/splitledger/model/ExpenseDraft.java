package dev.univer.splitledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * User-entered expense fields. {@code groupId} and {@code paidByMemberId} are null for personal expenses;
 * a null {@code date} means today.
 */
public record ExpenseDraft(BigDecimal amount,
                           String currencyCode,
                           String category,
                           String description,
                           String notes,
                           LocalDate date,
                           String groupId,
                           String paidByMemberId) {}
