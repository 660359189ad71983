package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountService;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.audit.AuditLogSink;
import com.flagship.general_ledger.audit.AuditRecord;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class BankAccountService {

    static final String ENTITY_TYPE = "BankAccount";

    private final BankAccountRepository bankAccountRepository;
    private final AccountService accountService;
    private final AuditLogSink auditLogSink;

    /**
     * @throws ValidationException if the linked GL account is not an ASSET
     * @throws InvalidStateException if the bank name and number are already registered
     */
    @Transactional
    public BankAccount createBankAccount(UUID linkedAccountId, String bankName, String accountNumber, String currency) {
        BankAccount bankAccount = BankAccount.create(linkedAccountId, bankName, accountNumber, currency);

        Account linked = accountService.getAccount(linkedAccountId);
        if (linked.getAccountType() != AccountType.ASSET) {
            throw new ValidationException(String.format(
                "Bank accounts must link to an ASSET account; %s is %s", linked.getCode(), linked.getAccountType()));
        }
        if (bankAccountRepository.existsByBankNameAndAccountNumber(bankAccount.getBankName(), bankAccount.getAccountNumber())) {
            throw new InvalidStateException(String.format(
                "Bank account already registered: %s %s", bankAccount.getBankName(), bankAccount.getAccountNumber()));
        }

        BankAccount saved = bankAccountRepository.saveAndFlush(BankAccountEntity.fromDomain(bankAccount)).toDomain();

        auditLogSink.record(AuditRecord.of("BANK_ACCOUNT_CREATED", ENTITY_TYPE, saved.getId(), null,
            AuditRecord.values(
                "linkedAccountId", saved.getLinkedAccountId(),
                "bankName", saved.getBankName(),
                "accountNumber", saved.getAccountNumber(),
                "currency", saved.getCurrency())));

        log.info("Bank account created: bank={}, number={}, glAccount={}",
            saved.getBankName(), saved.getAccountNumber(), linked.getCode());
        return saved;
    }

    @Transactional(readOnly = true)
    public BankAccount getBankAccount(UUID bankAccountId) {
        return bankAccountRepository.findById(bankAccountId)
            .map(BankAccountEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, bankAccountId));
    }

    @Transactional(readOnly = true)
    public List<BankAccount> listBankAccounts() {
        return bankAccountRepository.findAllByOrderByBankNameAscAccountNumberAsc().stream()
            .map(BankAccountEntity::toDomain)
            .toList();
    }

    @Transactional
    public BankAccount changeStatus(UUID bankAccountId, BankAccountStatus status) {
        BankAccountEntity entity = bankAccountRepository.findById(bankAccountId)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, bankAccountId));
        BankAccount current = entity.toDomain();
        BankAccount updated = current.withStatus(status);

        entity.updateFromDomain(updated);
        BankAccount saved = bankAccountRepository.saveAndFlush(entity).toDomain();

        auditLogSink.record(AuditRecord.of("BANK_ACCOUNT_STATUS_CHANGED", ENTITY_TYPE, bankAccountId,
            AuditRecord.values("status", current.getStatus()),
            AuditRecord.values("status", saved.getStatus())));

        log.info("Bank account {} status changed: {} -> {}", saved.getAccountNumber(), current.getStatus(), saved.getStatus());
        return saved;
    }

    /**
     * Called when a reconciliation is approved. Joins the caller's transaction.
     */
    @Transactional
    public BankAccount recordReconciled(UUID bankAccountId, int fiscalYear, int fiscalMonth, long balance) {
        BankAccountEntity entity = bankAccountRepository.findById(bankAccountId)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, bankAccountId));
        entity.updateFromDomain(entity.toDomain().recordReconciled(fiscalYear, fiscalMonth, balance));
        return bankAccountRepository.saveAndFlush(entity).toDomain();
    }
}
