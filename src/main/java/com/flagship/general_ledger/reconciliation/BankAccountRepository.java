package com.flagship.general_ledger.reconciliation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BankAccountRepository extends JpaRepository<BankAccountEntity, UUID> {

    boolean existsByBankNameAndAccountNumber(String bankName, String accountNumber);

    List<BankAccountEntity> findAllByOrderByBankNameAscAccountNumberAsc();
}
