package dev.univer.splitledger.repo;

import dev.univer.splitledger.model.Payment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PaymentRepository extends JpaRepository<Payment, String> {
    List<Payment> findAllByGroupIdOrderByDateDescCreatedAtDesc(String groupId);
    void deleteAllByGroupId(String groupId);
    void deleteAllByFromMemberIdOrToMemberId(String fromMemberId, String toMemberId);
}
