package dev.univer.splitledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(indexes = {
        @Index(name = "idx_member_group_user", columnList = "groupId, userId", unique = true)
})
public class GroupMember {
    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 36, nullable = false)
    private String groupId;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private String name;

    private String email;

    private Instant createdAt;
}
