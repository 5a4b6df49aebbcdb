package dev.univer.splitledger.repo;

import dev.univer.splitledger.model.*;
import dev.univer.splitledger.service.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaLedgerStore implements LedgerStore {
    private final ExpenseGroupRepository groupRepository;
    private final GroupMemberRepository memberRepository;
    private final ExpenseRepository expenseRepository;
    private final ExpenseSplitRepository splitRepository;
    private final PaymentRepository paymentRepository;

    // ===================== GROUPS =====================

    @Override
    public List<ExpenseGroup> findAllGroups() {
        return call("findAllGroups", groupRepository::findAllByOrderByCreatedAtDesc);
    }

    @Override
    public Optional<ExpenseGroup> findGroup(String groupId) {
        return call("findGroup", () -> groupRepository.findById(groupId));
    }

    @Override
    @Transactional
    public ExpenseGroup saveGroup(ExpenseGroup group) {
        return call("saveGroup", () -> groupRepository.saveAndFlush(group));
    }

    @Override
    @Transactional
    public void deleteGroup(String groupId) {
        run("deleteGroup", () -> {
            for (Expense e : expenseRepository.findAllByGroupIdOrderByDateDesc(groupId)) {
                e.setGroupId(null);
                e.setPaidByMemberId(null);
            }
            expenseRepository.flush();

            paymentRepository.deleteAllByGroupId(groupId);
            for (GroupMember m : memberRepository.findAllByGroupIdOrderByCreatedAtAsc(groupId)) {
                splitRepository.deleteAllByMemberId(m.getId());
                memberRepository.delete(m);
            }
            // flush so the group row goes last
            memberRepository.flush();

            groupRepository.deleteById(groupId);
            groupRepository.flush();
        });
    }

    // ===================== MEMBERS =====================

    @Override
    public List<GroupMember> findMembers(String groupId) {
        return call("findMembers", () -> memberRepository.findAllByGroupIdOrderByCreatedAtAsc(groupId));
    }

    @Override
    public Optional<GroupMember> findMember(String memberId) {
        return call("findMember", () -> memberRepository.findById(memberId));
    }

    @Override
    @Transactional
    public GroupMember saveMember(GroupMember member) {
        return call("saveMember", () -> memberRepository.saveAndFlush(member));
    }

    @Override
    @Transactional
    public void deleteMember(String memberId) {
        run("deleteMember", () -> {
            for (Expense e : expenseRepository.findAllByPaidByMemberId(memberId)) {
                e.setPaidByMemberId(null);
            }
            splitRepository.deleteAllByMemberId(memberId);
            paymentRepository.deleteAllByFromMemberIdOrToMemberId(memberId, memberId);
            splitRepository.flush();

            memberRepository.deleteById(memberId);
            memberRepository.flush();
        });
    }

    // ===================== EXPENSES =====================

    @Override
    public Optional<Expense> findExpense(String expenseId) {
        return call("findExpense", () -> expenseRepository.findById(expenseId));
    }

    @Override
    public List<Expense> findAllExpenses() {
        return call("findAllExpenses", expenseRepository::findAllByOrderByDateDescCreatedAtDesc);
    }

    @Override
    public List<Expense> findExpensesByCategory(String category) {
        return call("findExpensesByCategory", () -> expenseRepository.findAllByCategoryOrderByDateDesc(category));
    }

    @Override
    public List<Expense> findExpensesByGroup(String groupId) {
        return call("findExpensesByGroup", () -> expenseRepository.findAllByGroupIdOrderByDateDesc(groupId));
    }

    @Override
    public List<Expense> findExpensesBetween(LocalDate from, LocalDate to) {
        return call("findExpensesBetween", () -> expenseRepository.findAllByDateBetweenOrderByDateDesc(from, to));
    }

    @Override
    @Transactional
    public Expense saveExpense(Expense expense) {
        return call("saveExpense", () -> expenseRepository.saveAndFlush(expense));
    }

    @Override
    @Transactional
    public void deleteExpense(String expenseId) {
        run("deleteExpense", () -> {
            splitRepository.deleteAllByExpenseId(expenseId);
            splitRepository.flush();
            expenseRepository.deleteById(expenseId);
            expenseRepository.flush();
        });
    }

    // ===================== SPLITS =====================

    @Override
    public List<ExpenseSplit> findSplits(String expenseId) {
        return call("findSplits", () -> splitRepository.findAllByExpenseId(expenseId));
    }

    @Override
    public List<ExpenseSplit> findSplitsForExpenses(Collection<String> expenseIds) {
        if (expenseIds.isEmpty()) return List.of();
        return call("findSplitsForExpenses", () -> splitRepository.findAllByExpenseIdIn(expenseIds));
    }

    @Override
    @Transactional
    public List<ExpenseSplit> replaceSplits(String expenseId, List<ExpenseSplit> splits) {
        return call("replaceSplits", () -> {
            // 1) old rows out; flush before inserting, the (expense, member) index would reject the new rows otherwise
            splitRepository.deleteAllByExpenseId(expenseId);
            splitRepository.flush();

            // 2) new rows in
            List<ExpenseSplit> saved = splitRepository.saveAll(splits);
            splitRepository.flush();
            return saved;
        });
    }

    // ===================== PAYMENTS =====================

    @Override
    public List<Payment> findPayments(String groupId) {
        return call("findPayments", () -> paymentRepository.findAllByGroupIdOrderByDateDescCreatedAtDesc(groupId));
    }

    @Override
    public Optional<Payment> findPayment(String paymentId) {
        return call("findPayment", () -> paymentRepository.findById(paymentId));
    }

    @Override
    @Transactional
    public Payment savePayment(Payment payment) {
        return call("savePayment", () -> paymentRepository.saveAndFlush(payment));
    }

    @Override
    @Transactional
    public void deletePayment(String paymentId) {
        run("deletePayment", () -> {
            paymentRepository.deleteById(paymentId);
            paymentRepository.flush();
        });
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.warn("Store rejected {}: {}", operation, e.getMessage());
            throw LedgerException.storageFailure(operation, e);
        }
    }

    private void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
