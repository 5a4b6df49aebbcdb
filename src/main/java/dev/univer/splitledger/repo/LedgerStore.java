package dev.univer.splitledger.repo;

import dev.univer.splitledger.model.*;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence seen by the ledger services. Implementations report rejected reads and writes as
 * {@link dev.univer.splitledger.service.LedgerException} of kind {@code STORAGE_FAILURE}.
 */
public interface LedgerStore {

    // groups
    List<ExpenseGroup> findAllGroups();
    Optional<ExpenseGroup> findGroup(String groupId);
    ExpenseGroup saveGroup(ExpenseGroup group);

    /** Deletes the group, its members with their splits, and its payments; its expenses lose group and payer. */
    void deleteGroup(String groupId);

    // members
    List<GroupMember> findMembers(String groupId);
    Optional<GroupMember> findMember(String memberId);
    GroupMember saveMember(GroupMember member);

    /** Deletes the member, its splits and every payment from or to it; expenses it paid lose their payer. */
    void deleteMember(String memberId);

    // expenses
    Optional<Expense> findExpense(String expenseId);
    List<Expense> findAllExpenses();
    List<Expense> findExpensesByCategory(String category);
    List<Expense> findExpensesByGroup(String groupId);
    List<Expense> findExpensesBetween(LocalDate from, LocalDate to);
    Expense saveExpense(Expense expense);

    /** Deletes the expense and its splits. */
    void deleteExpense(String expenseId);

    // splits
    List<ExpenseSplit> findSplits(String expenseId);
    List<ExpenseSplit> findSplitsForExpenses(Collection<String> expenseIds);

    /** Removes every split of the expense and writes {@code splits} in their place, atomically. */
    List<ExpenseSplit> replaceSplits(String expenseId, List<ExpenseSplit> splits);

    // payments
    List<Payment> findPayments(String groupId);
    Optional<Payment> findPayment(String paymentId);
    Payment savePayment(Payment payment);
    void deletePayment(String paymentId);
}
