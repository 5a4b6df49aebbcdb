package dev.univer.splitledger.repo;

import dev.univer.splitledger.model.GroupMember;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface GroupMemberRepository extends JpaRepository<GroupMember, String> {
    List<GroupMember> findAllByGroupIdOrderByCreatedAtAsc(String groupId);
}
