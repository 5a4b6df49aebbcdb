package dev.univer.splitledger.service;

import dev.univer.splitledger.config.LedgerProperties;
import dev.univer.splitledger.model.Expense;
import dev.univer.splitledger.model.ExpenseDraft;
import dev.univer.splitledger.model.ExpenseGroup;
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
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expense records. The entered amount is converted into the settlement currency (the group's, or the
 * configured base currency for personal expenses) and kept as {@code baseAmount}; balances only ever
 * read the converted value.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {
    private final LedgerStore store;
    private final CurrencyConverter currencyConverter;
    private final IdGenerator idGenerator;
    private final LedgerProperties props;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<Expense> getExpenseById(String expenseId) {
        return store.findExpense(expenseId);
    }

    /** Newest first; same-day expenses by creation time, newest first. */
    @Transactional(readOnly = true)
    public List<Expense> getAllExpenses() {
        return store.findAllExpenses();
    }

    @Transactional(readOnly = true)
    public List<Expense> getExpensesByCategory(String category) {
        if (category == null || category.isBlank()) throw new IllegalArgumentException("Category is required");
        return store.findExpensesByCategory(category.trim());
    }

    @Transactional(readOnly = true)
    public List<Expense> getExpensesByGroup(String groupId) {
        return store.findExpensesByGroup(groupId);
    }

    @Transactional(readOnly = true)
    public List<Expense> getExpensesByDateRange(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) throw new IllegalArgumentException("Range start " + from + " is after end " + to);
        return store.findExpensesBetween(from, to);
    }

    @Transactional
    public Expense createExpense(ExpenseDraft draft) {
        Instant now = Instant.now(clock);
        Expense e = Expense.builder()
                .id(idGenerator.newId())
                .createdAt(now)
                .build();
        apply(e, draft, now);
        Expense saved = store.saveExpense(e);
        log.info("Expense {} created: {} {} (base {}) group={} paidBy={}",
                saved.getId(), saved.getAmount(), saved.getCurrencyCode(), saved.getBaseAmount(),
                saved.getGroupId(), saved.getPaidByMemberId());
        return saved;
    }

    /**
     * Rewrites every field from {@code draft}. Existing splits are kept, re-split if the amount changed.
     * Moving the expense to another group (or out of its group) drops its splits.
     */
    @Transactional
    public Expense updateExpense(String expenseId, ExpenseDraft draft) {
        Expense e = requireExpense(expenseId);
        String previousGroupId = e.getGroupId();
        apply(e, draft, Instant.now(clock));
        if (!Objects.equals(previousGroupId, e.getGroupId())) {
            store.replaceSplits(expenseId, List.of());
            log.info("Expense {} moved from group {} to {}, splits dropped", expenseId, previousGroupId, e.getGroupId());
        }
        Expense saved = store.saveExpense(e);
        log.info("Expense {} updated: {} {} (base {})",
                saved.getId(), saved.getAmount(), saved.getCurrencyCode(), saved.getBaseAmount());
        return saved;
    }

    @Transactional
    public void deleteExpense(String expenseId) {
        requireExpense(expenseId);
        store.deleteExpense(expenseId);
        log.info("Expense {} deleted", expenseId);
    }

    private void apply(Expense e, ExpenseDraft draft, Instant now) {
        if (draft.amount() == null || draft.amount().signum() <= 0) {
            throw rejected(LedgerException.invalidAmount("Expense amount must be > 0"));
        }
        if (draft.category() == null || draft.category().isBlank()) {
            throw new IllegalArgumentException("Category is required");
        }
        String currency = MoneyUtil.normalizeCurrency(draft.currencyCode());

        String settlementCurrency = MoneyUtil.normalizeCurrency(props.getBaseCurrency());
        if (draft.groupId() != null) {
            ExpenseGroup g = store.findGroup(draft.groupId())
                    .orElseThrow(() -> rejected(LedgerException.notFound("Group", draft.groupId())));
            settlementCurrency = g.getCurrencyCode();
            if (draft.paidByMemberId() != null) {
                boolean payerInGroup = store.findMember(draft.paidByMemberId())
                        .map(m -> m.getGroupId().equals(g.getId()))
                        .orElse(false);
                if (!payerInGroup) {
                    throw rejected(LedgerException.notFound("Member of group " + g.getId(), draft.paidByMemberId()));
                }
            }
        } else if (draft.paidByMemberId() != null) {
            throw new IllegalArgumentException("A payer can only be set on a group expense");
        }

        BigDecimal amount = MoneyUtil.money(draft.amount());
        e.setAmount(amount);
        e.setCurrencyCode(currency);
        e.setBaseAmount(MoneyUtil.money(currencyConverter.convert(amount, currency, settlementCurrency)));
        e.setCategory(draft.category().trim());
        e.setDescription(draft.description());
        e.setNotes(draft.notes());
        e.setDate(draft.date() == null ? LocalDate.now(clock) : draft.date());
        e.setGroupId(draft.groupId());
        e.setPaidByMemberId(draft.paidByMemberId());
        e.setUpdatedAt(now);
    }

    private Expense requireExpense(String expenseId) {
        return store.findExpense(expenseId).orElseThrow(() -> rejected(LedgerException.notFound("Expense", expenseId)));
    }

    private LedgerException rejected(LedgerException e) {
        log.warn("Rejected [{}]: {}", e.getKind(), e.getMessage());
        return e;
    }
}
