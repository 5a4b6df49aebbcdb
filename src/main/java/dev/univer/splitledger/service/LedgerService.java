package dev.univer.splitledger.service;

import dev.univer.splitledger.config.LedgerProperties;
import dev.univer.splitledger.model.*;
import dev.univer.splitledger.repo.LedgerStore;
import dev.univer.splitledger.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

/**
 * Group ledger: splitting expenses, recording settle-up payments, and the derived balance and
 * settlement views. Balances are replayed from storage on every call.
 *
 * <p>Every validation runs before the first write, a rejected call leaves storage untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {
    private final LedgerStore store;
    private final GroupService groupService;
    private final SplitCalculator splitCalculator;
    private final BalanceEngine balanceEngine;
    private final SettlementPlanner settlementPlanner;
    private final IdGenerator idGenerator;
    private final LedgerProperties props;
    private final Clock clock;

    // ===================== SPLITS =====================

    @Transactional
    public List<ExpenseSplit> splitEqually(String expenseId, List<String> memberIds, BigDecimal totalAmount) {
        requirePositive(totalAmount, "Split total");
        Expense expense = requireExpense(expenseId);
        requireTotalOf(expense, totalAmount);
        requireParticipants(expense, memberIds);

        return replaceSplits(expense, splitCalculator.equal(totalAmount, memberIds), "equal");
    }

    @Transactional
    public List<ExpenseSplit> splitByPercentage(String expenseId, List<PercentageShare> shares, BigDecimal totalAmount) {
        requirePositive(totalAmount, "Split total");
        for (PercentageShare s : shares) {
            if (s.percentage() == null || s.percentage().signum() < 0) {
                throw rejected(LedgerException.invalidAmount("Percentage for member " + s.memberId() + " must be >= 0"));
            }
        }
        BigDecimal discrepancy = splitCalculator.percentageDiscrepancy(shares);
        if (!MoneyUtil.withinTolerance(discrepancy, props.getSplitTolerance())) {
            throw rejected(LedgerException.invalidSplit(
                    "Percentages must add up to 100, off by " + discrepancy.toPlainString(), discrepancy));
        }
        Expense expense = requireExpense(expenseId);
        requireTotalOf(expense, totalAmount);
        requireParticipants(expense, shares.stream().map(PercentageShare::memberId).toList());

        return replaceSplits(expense, splitCalculator.byPercentage(totalAmount, shares), "percentage");
    }

    /** Shares must add up to the expense's amount in the settlement currency. */
    @Transactional
    public List<ExpenseSplit> splitByAmount(String expenseId, List<AmountShare> shares) {
        for (AmountShare s : shares) {
            if (s.amount() == null || s.amount().signum() < 0) {
                throw rejected(LedgerException.invalidAmount("Amount for member " + s.memberId() + " must be >= 0"));
            }
        }
        Expense expense = requireExpense(expenseId);
        BigDecimal discrepancy = splitCalculator.amountDiscrepancy(shares, expense.getBaseAmount());
        if (!MoneyUtil.withinTolerance(discrepancy, props.getSplitTolerance())) {
            throw rejected(LedgerException.invalidSplit(
                    "Amounts must add up to " + expense.getBaseAmount().toPlainString()
                            + ", off by " + discrepancy.toPlainString(), discrepancy));
        }
        requireParticipants(expense, shares.stream().map(AmountShare::memberId).toList());

        return replaceSplits(expense, splitCalculator.byAmount(shares), "amount");
    }

    @Transactional(readOnly = true)
    public List<ExpenseSplit> getExpenseSplits(String expenseId) {
        requireExpense(expenseId);
        return store.findSplits(expenseId);
    }

    // ===================== BALANCES =====================

    @Transactional(readOnly = true)
    public List<GroupMember> getGroupMembers(String groupId) {
        return groupService.getGroupMembers(groupId);
    }

    /** Member id to signed balance, in member order. Positive: the group owes the member. */
    @Transactional(readOnly = true)
    public Map<String, BigDecimal> calculateGroupBalances(String groupId) {
        groupService.requireGroup(groupId);
        List<GroupMember> members = store.findMembers(groupId);
        List<Expense> expenses = store.findExpensesByGroup(groupId);
        List<ExpenseSplit> splits = store.findSplitsForExpenses(expenses.stream().map(Expense::getId).toList());
        List<Payment> payments = store.findPayments(groupId);
        return balanceEngine.computeBalances(members, expenses, splits, payments);
    }

    @Transactional(readOnly = true)
    public List<Settlement> getSettlementSuggestions(String groupId) {
        List<Settlement> suggestions = settlementPlanner.suggestSettlements(calculateGroupBalances(groupId));
        log.debug("Group {}: {} settlement suggestion(s)", groupId, suggestions.size());
        return suggestions;
    }

    @Transactional(readOnly = true)
    public List<Settlement> suggestSettlements(String groupId) {
        return getSettlementSuggestions(groupId);
    }

    // ===================== PAYMENTS =====================

    @Transactional(readOnly = true)
    public List<Payment> getPaymentsByGroup(String groupId) {
        groupService.requireGroup(groupId);
        return store.findPayments(groupId);
    }

    /**
     * Records money that changed hands between two members. A null currency means the group's currency;
     * any other currency is rejected since balances are kept in one currency.
     */
    @Transactional
    public Payment recordPayment(String groupId, String fromMemberId, String toMemberId, BigDecimal amount,
                                 String currencyCode, LocalDate date, String notes) {
        requirePositive(amount, "Payment amount");
        if (Objects.equals(fromMemberId, toMemberId)) {
            throw rejected(LedgerException.invalidSplit("A member cannot pay themselves: " + fromMemberId));
        }
        ExpenseGroup group = groupService.requireGroup(groupId);
        requireMemberOf(group.getId(), fromMemberId);
        requireMemberOf(group.getId(), toMemberId);

        String currency = currencyCode == null ? group.getCurrencyCode() : MoneyUtil.normalizeCurrency(currencyCode);
        if (!currency.equals(group.getCurrencyCode())) {
            throw new IllegalArgumentException("Payment currency " + currency
                    + " differs from group currency " + group.getCurrencyCode());
        }

        Payment p = Payment.builder()
                .id(idGenerator.newId())
                .groupId(groupId)
                .fromMemberId(fromMemberId)
                .toMemberId(toMemberId)
                .amount(MoneyUtil.money(amount))
                .currencyCode(currency)
                .date(date == null ? LocalDate.now(clock) : date)
                .notes((notes == null || notes.isBlank()) ? null : notes.trim())
                .createdAt(Instant.now(clock))
                .build();
        Payment saved = store.savePayment(p);
        log.info("Payment {} recorded in group {}: {} -> {} {} {}",
                saved.getId(), groupId, fromMemberId, toMemberId, saved.getAmount(), currency);
        return saved;
    }

    @Transactional
    public void deletePayment(String paymentId) {
        store.findPayment(paymentId).orElseThrow(() -> rejected(LedgerException.notFound("Payment", paymentId)));
        store.deletePayment(paymentId);
        log.info("Payment {} deleted", paymentId);
    }

    // ===================== HELPERS =====================

    private List<ExpenseSplit> replaceSplits(Expense expense, List<SplitShare> shares, String strategy) {
        Instant now = Instant.now(clock);
        List<ExpenseSplit> rows = shares.stream()
                .map(s -> ExpenseSplit.builder()
                        .id(idGenerator.newId())
                        .expenseId(expense.getId())
                        .memberId(s.memberId())
                        .amount(s.amount())
                        .percentage(s.percentage())
                        .createdAt(now)
                        .build())
                .toList();
        List<ExpenseSplit> saved = store.replaceSplits(expense.getId(), rows);
        log.info("Expense {} split ({}) among {} member(s)", expense.getId(), strategy, saved.size());
        return saved;
    }

    private Expense requireExpense(String expenseId) {
        return store.findExpense(expenseId).orElseThrow(() -> rejected(LedgerException.notFound("Expense", expenseId)));
    }

    /** Splits must cover the expense's settlement-currency amount. */
    private void requireTotalOf(Expense expense, BigDecimal totalAmount) {
        BigDecimal discrepancy = totalAmount.subtract(expense.getBaseAmount());
        if (!MoneyUtil.withinTolerance(discrepancy, props.getSplitTolerance())) {
            throw rejected(LedgerException.invalidSplit(
                    "Split total " + totalAmount.toPlainString() + " does not match expense amount "
                            + expense.getBaseAmount().toPlainString(), discrepancy));
        }
    }

    private void requireParticipants(Expense expense, List<String> memberIds) {
        if (memberIds == null || memberIds.isEmpty()) {
            throw rejected(LedgerException.invalidSplit("Select at least one member to split with"));
        }
        Set<String> seen = new HashSet<>();
        for (String id : memberIds) {
            if (id == null) throw rejected(LedgerException.invalidSplit("Member id is required"));
            if (!seen.add(id)) throw rejected(LedgerException.invalidSplit("Member listed twice: " + id));
            GroupMember m = store.findMember(id).orElseThrow(() -> rejected(LedgerException.notFound("Member", id)));
            if (expense.getGroupId() != null && !expense.getGroupId().equals(m.getGroupId())) {
                throw rejected(LedgerException.invalidSplit(
                        "Member " + id + " is not in group " + expense.getGroupId()));
            }
        }
    }

    private void requireMemberOf(String groupId, String memberId) {
        boolean inGroup = memberId != null && store.findMember(memberId)
                .map(m -> m.getGroupId().equals(groupId))
                .orElse(false);
        if (!inGroup) throw rejected(LedgerException.notFound("Member of group " + groupId, memberId));
    }

    private void requirePositive(BigDecimal amount, String what) {
        if (amount == null || amount.signum() <= 0) {
            throw rejected(LedgerException.invalidAmount(what + " must be > 0"));
        }
    }

    private LedgerException rejected(LedgerException e) {
        log.warn("Rejected [{}]: {}", e.getKind(), e.getMessage());
        return e;
    }
}
