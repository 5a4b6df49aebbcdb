package dev.univer.splitledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(indexes = {
        @Index(name = "idx_payment_group_date", columnList = "groupId, payment_date"),
        @Index(name = "idx_payment_from", columnList = "fromMemberId"),
        @Index(name = "idx_payment_to", columnList = "toMemberId")
})
public class Payment {
    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 36, nullable = false)
    private String groupId;

    @Column(length = 36, nullable = false)
    private String fromMemberId;

    @Column(length = 36, nullable = false)
    private String toMemberId;

    @Column(precision = 19, scale = 2, nullable = false)
    private BigDecimal amount;

    @Column(length = 3, nullable = false)
    private String currencyCode;

    @Column(name = "payment_date", nullable = false)
    private LocalDate date;

    @Column(length = 512)
    private String notes;

    private Instant createdAt;
}
