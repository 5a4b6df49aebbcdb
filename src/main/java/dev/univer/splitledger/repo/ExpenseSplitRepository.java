package dev.univer.splitledger.repo;

import dev.univer.splitledger.model.ExpenseSplit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface ExpenseSplitRepository extends JpaRepository<ExpenseSplit, String> {
    List<ExpenseSplit> findAllByExpenseId(String expenseId);
    List<ExpenseSplit> findAllByExpenseIdIn(Collection<String> expenseIds);
    void deleteAllByExpenseId(String expenseId);
    void deleteAllByMemberId(String memberId);
}
