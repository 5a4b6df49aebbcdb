package dev.univer.splitledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(indexes = {
        @Index(name = "idx_split_expense_member", columnList = "expenseId, memberId", unique = true),
        @Index(name = "idx_split_member", columnList = "memberId")
})
public class ExpenseSplit {
    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 36, nullable = false)
    private String expenseId;

    @Column(length = 36, nullable = false)
    private String memberId;

    @Column(precision = 19, scale = 2, nullable = false)
    private BigDecimal amount;

    // only set for percentage splits
    @Column(precision = 9, scale = 4)
    private BigDecimal percentage;

    private Instant createdAt;
}
