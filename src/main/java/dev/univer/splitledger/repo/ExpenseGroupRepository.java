package dev.univer.splitledger.repo;

import dev.univer.splitledger.model.ExpenseGroup;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExpenseGroupRepository extends JpaRepository<ExpenseGroup, String> {
    List<ExpenseGroup> findAllByOrderByCreatedAtDesc();
}
