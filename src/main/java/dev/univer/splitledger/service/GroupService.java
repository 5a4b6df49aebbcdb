package dev.univer.splitledger.service;

import dev.univer.splitledger.model.ExpenseGroup;
import dev.univer.splitledger.model.GroupMember;
import dev.univer.splitledger.model.GroupUpdate;
import dev.univer.splitledger.repo.LedgerStore;
import dev.univer.splitledger.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class GroupService {
    private final LedgerStore store;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<ExpenseGroup> getAllGroups() {
        return store.findAllGroups();
    }

    @Transactional(readOnly = true)
    public Optional<ExpenseGroup> getGroupById(String groupId) {
        return store.findGroup(groupId);
    }

    @Transactional(readOnly = true)
    public ExpenseGroup requireGroup(String groupId) {
        return store.findGroup(groupId).orElseThrow(() -> rejected(LedgerException.notFound("Group", groupId)));
    }

    @Transactional
    public ExpenseGroup createGroup(String name, String currencyCode, String description) {
        Instant now = Instant.now(clock);
        ExpenseGroup g = ExpenseGroup.builder()
                .id(idGenerator.newId())
                .name(requireName(name))
                .description(blankToNull(description))
                .currencyCode(MoneyUtil.normalizeCurrency(currencyCode))
                .createdAt(now)
                .updatedAt(now)
                .build();
        ExpenseGroup saved = store.saveGroup(g);
        log.info("Group {} '{}' created ({})", saved.getId(), saved.getName(), saved.getCurrencyCode());
        return saved;
    }

    @Transactional
    public ExpenseGroup updateGroup(String groupId, GroupUpdate update) {
        ExpenseGroup g = requireGroup(groupId);
        if (update.name() != null) g.setName(requireName(update.name()));
        if (update.description() != null) g.setDescription(blankToNull(update.description()));
        if (update.currencyCode() != null) g.setCurrencyCode(MoneyUtil.normalizeCurrency(update.currencyCode()));
        g.setUpdatedAt(Instant.now(clock));
        return store.saveGroup(g);
    }

    @Transactional
    public void deleteGroup(String groupId) {
        requireGroup(groupId);
        store.deleteGroup(groupId);
        log.info("Group {} deleted", groupId);
    }

    // ===================== MEMBERS =====================

    @Transactional(readOnly = true)
    public List<GroupMember> getGroupMembers(String groupId) {
        requireGroup(groupId);
        return store.findMembers(groupId);
    }

    @Transactional(readOnly = true)
    public GroupMember requireMember(String memberId) {
        return store.findMember(memberId).orElseThrow(() -> rejected(LedgerException.notFound("Member", memberId)));
    }

    @Transactional
    public GroupMember addMember(String groupId, String userId, String name, String email) {
        requireGroup(groupId);
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException("User id is required");

        GroupMember m = GroupMember.builder()
                .id(idGenerator.newId())
                .groupId(groupId)
                .userId(userId.trim())
                .name(requireName(name))
                .email(blankToNull(email))
                .createdAt(Instant.now(clock))
                .build();
        GroupMember saved = store.saveMember(m);
        log.info("Member {} '{}' joined group {}", saved.getId(), saved.getName(), groupId);
        return saved;
    }

    @Transactional
    public void removeMember(String memberId) {
        GroupMember m = requireMember(memberId);
        store.deleteMember(memberId);
        log.info("Member {} removed from group {}", memberId, m.getGroupId());
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Name must not be blank");
        return name.trim();
    }

    private LedgerException rejected(LedgerException e) {
        log.warn("Rejected [{}]: {}", e.getKind(), e.getMessage());
        return e;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
