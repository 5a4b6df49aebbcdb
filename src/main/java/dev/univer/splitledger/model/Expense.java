package dev.univer.splitledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(indexes = {
        @Index(name = "idx_expense_group_date", columnList = "groupId, expense_date"),
        @Index(name = "idx_expense_paid_by", columnList = "paidByMemberId")
})
public class Expense {
    @Id
    @Column(length = 36)
    private String id;

    @Column(precision = 19, scale = 2, nullable = false)
    private BigDecimal amount;        // as entered

    @Column(length = 3, nullable = false)
    private String currencyCode;

    @Column(precision = 19, scale = 2, nullable = false)
    private BigDecimal baseAmount;    // in the settlement currency

    @Column(nullable = false)
    private String category;

    @Column(length = 512)
    private String description;

    @Column(length = 2048)
    private String notes;

    @Column(name = "expense_date", nullable = false)
    private LocalDate date;

    @Column(length = 36)
    private String groupId;           // null for personal expenses

    @Column(length = 36)
    private String paidByMemberId;

    private Instant createdAt;
    private Instant updatedAt;
}
