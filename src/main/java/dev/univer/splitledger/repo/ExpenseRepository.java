package dev.univer.splitledger.repo;

import dev.univer.splitledger.model.Expense;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface ExpenseRepository extends JpaRepository<Expense, String> {
    List<Expense> findAllByOrderByDateDescCreatedAtDesc();
    List<Expense> findAllByCategoryOrderByDateDesc(String category);
    List<Expense> findAllByGroupIdOrderByDateDesc(String groupId);
    List<Expense> findAllByDateBetweenOrderByDateDesc(LocalDate from, LocalDate to);
    List<Expense> findAllByPaidByMemberId(String memberId);
}
