package com.flagship.general_ledger.account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    Optional<AccountEntity> findByCode(String code);

    boolean existsByCode(String code);

    List<AccountEntity> findAllByOrderByCodeAsc();

    List<AccountEntity> findByAccountTypeOrderByCodeAsc(AccountType accountType);

    boolean existsByParentId(UUID parentId);

    /**
     * True if any journal line, in any status, references the account.
     */
    @Query(value = "SELECT EXISTS (SELECT 1 FROM journal_lines WHERE account_id = :accountId)",
           nativeQuery = true)
    boolean isReferencedByJournalLine(@Param("accountId") UUID accountId);

    /**
     * True if a line of a POSTED or VOIDED entry references the account.
     * Voided entries count: their lines are kept for history.
     */
    @Query(value = """
        SELECT EXISTS (
            SELECT 1 FROM journal_lines l
            JOIN journal_entries e ON e.id = l.entry_id
            WHERE l.account_id = :accountId AND e.status <> 'DRAFT')
        """, nativeQuery = true)
    boolean isReferencedByPostedLine(@Param("accountId") UUID accountId);
}
