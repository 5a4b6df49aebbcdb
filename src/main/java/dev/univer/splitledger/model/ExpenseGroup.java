package dev.univer.splitledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(indexes = {
        @Index(name = "idx_group_created", columnList = "createdAt")
})
public class ExpenseGroup {
    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 512)
    private String description;

    // settlement currency, every balance in the group is expressed in it
    @Column(length = 3, nullable = false)
    private String currencyCode;

    private Instant createdAt;
    private Instant updatedAt;
}
