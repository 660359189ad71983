package com.flagship.general_ledger.account;

import com.flagship.general_ledger.audit.AuditLogSink;
import com.flagship.general_ledger.audit.AuditRecord;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The chart of accounts.
 *
 * Accounts referenced by a posted line keep their code, type and normal
 * balance forever, and an account referenced by any line is never deleted,
 * so historical balances always recompute the same way.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    static final String ENTITY_TYPE = "Account";

    private final AccountRepository accountRepository;
    private final AuditLogSink auditLogSink;

    @Transactional
    public Account createAccount(String code, String name, String description,
                                 AccountType accountType, NormalBalance normalBalance, UUID parentId) {
        Account account = Account.create(code, name, description, accountType, normalBalance, parentId);

        if (accountRepository.existsByCode(code)) {
            throw new InvalidStateException("Account code already exists: " + code);
        }
        if (parentId != null && !accountRepository.existsById(parentId)) {
            throw NotFoundException.of("Parent account", parentId);
        }

        Account saved = accountRepository.saveAndFlush(AccountEntity.fromDomain(account)).toDomain();

        auditLogSink.record(AuditRecord.of("ACCOUNT_CREATED", ENTITY_TYPE, saved.getId(), null,
            AuditRecord.values(
                "code", saved.getCode(),
                "name", saved.getName(),
                "accountType", saved.getAccountType(),
                "normalBalance", saved.getNormalBalance(),
                "parentId", saved.getParentId())));

        log.info("Account created: code={}, type={}, normalBalance={}",
            saved.getCode(), saved.getAccountType(), saved.getNormalBalance());
        return saved;
    }

    @Transactional(readOnly = true)
    public Account getAccount(UUID accountId) {
        return accountRepository.findById(accountId)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, accountId));
    }

    @Transactional(readOnly = true)
    public Account getAccountByCode(String code) {
        return accountRepository.findByCode(code)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, code));
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(AccountType accountType) {
        List<AccountEntity> entities = accountType == null
            ? accountRepository.findAllByOrderByCodeAsc()
            : accountRepository.findByAccountTypeOrderByCodeAsc(accountType);
        return entities.stream().map(AccountEntity::toDomain).toList();
    }

    /**
     * Loads the given accounts keyed by ID.
     *
     * @throws NotFoundException if any ID is unknown
     */
    @Transactional(readOnly = true)
    public Map<UUID, Account> getAccounts(Collection<UUID> accountIds) {
        Map<UUID, Account> accounts = accountRepository.findAllById(accountIds).stream()
            .map(AccountEntity::toDomain)
            .collect(Collectors.toMap(Account::getId, Function.identity()));

        for (UUID accountId : accountIds) {
            if (!accounts.containsKey(accountId)) {
                throw NotFoundException.of(ENTITY_TYPE, accountId);
            }
        }
        return accounts;
    }

    @Transactional
    public Account updateAccount(UUID accountId, String name, String description, AccountType accountType,
                                 NormalBalance normalBalance, UUID parentId, AccountStatus status) {
        AccountEntity entity = accountRepository.findById(accountId)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, accountId));
        Account current = entity.toDomain();

        if (parentId != null && !accountRepository.existsById(parentId)) {
            throw NotFoundException.of("Parent account", parentId);
        }
        if (parentId != null && isAncestorOrSelf(accountId, parentId)) {
            throw new ValidationException(String.format(
                "Account %s cannot be placed under one of its own descendants", current.getCode()));
        }

        Account updated = current.withDetails(name, description, parentId);

        if (current.hasStructuralChange(accountType, normalBalance)) {
            if (accountRepository.isReferencedByPostedLine(accountId)) {
                throw new InvalidStateException(String.format(
                    "Account %s is referenced by posted journal lines; type and normal balance are fixed",
                    current.getCode()));
            }
            updated = updated.withStructure(accountType, normalBalance);
        }

        if (status != null && status != current.getStatus()) {
            updated = updated.withStatus(status);
        }

        entity.updateFromDomain(updated);
        Account saved = accountRepository.saveAndFlush(entity).toDomain();

        auditLogSink.record(AuditRecord.of("ACCOUNT_UPDATED", ENTITY_TYPE, accountId,
            snapshot(current), snapshot(saved)));

        log.info("Account updated: code={}", saved.getCode());
        return saved;
    }

    private boolean isAncestorOrSelf(UUID accountId, UUID candidateParentId) {
        Set<UUID> visited = new HashSet<>();
        UUID cursor = candidateParentId;
        while (cursor != null && visited.add(cursor)) {
            if (cursor.equals(accountId)) {
                return true;
            }
            cursor = accountRepository.findById(cursor)
                .map(AccountEntity::getParentId)
                .orElse(null);
        }
        return false;
    }

    @Transactional
    public void deleteAccount(UUID accountId) {
        AccountEntity entity = accountRepository.findById(accountId)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, accountId));

        if (accountRepository.isReferencedByJournalLine(accountId)) {
            throw new InvalidStateException(
                "Account " + entity.getCode() + " is referenced by journal lines and cannot be deleted");
        }
        if (accountRepository.existsByParentId(accountId)) {
            throw new InvalidStateException(
                "Account " + entity.getCode() + " has child accounts and cannot be deleted");
        }

        Account removed = entity.toDomain();
        accountRepository.delete(entity);
        accountRepository.flush();

        auditLogSink.record(AuditRecord.of("ACCOUNT_DELETED", ENTITY_TYPE, accountId, snapshot(removed), null));
        log.info("Account deleted: code={}", removed.getCode());
    }

    /**
     * Rejects lines against inactive accounts.
     */
    public static void requireActive(Account account) {
        if (!account.isActive()) {
            throw new ValidationException("Account " + account.getCode() + " is inactive");
        }
    }

    private static Map<String, Object> snapshot(Account account) {
        return AuditRecord.values(
            "name", account.getName(),
            "description", account.getDescription(),
            "accountType", account.getAccountType(),
            "normalBalance", account.getNormalBalance(),
            "parentId", account.getParentId(),
            "status", account.getStatus());
    }
}
