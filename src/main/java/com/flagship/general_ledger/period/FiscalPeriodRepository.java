package com.flagship.general_ledger.period;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FiscalPeriodRepository extends JpaRepository<FiscalPeriodEntity, UUID> {

    Optional<FiscalPeriodEntity> findByFiscalYearAndFiscalMonth(int fiscalYear, int fiscalMonth);

    boolean existsByFiscalYearAndFiscalMonth(int fiscalYear, int fiscalMonth);

    List<FiscalPeriodEntity> findAllByOrderByFiscalYearAscFiscalMonthAsc();

    List<FiscalPeriodEntity> findByFiscalYearOrderByFiscalMonthAsc(int fiscalYear);

    /**
     * Shared row lock (SELECT ... FOR SHARE). Held by posting and voiding so a
     * concurrent close, which takes the exclusive lock, waits for them to commit
     * and sees their lines, or makes them wait and then see CLOSED.
     */
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT p FROM FiscalPeriodEntity p WHERE p.fiscalYear = :year AND p.fiscalMonth = :month")
    Optional<FiscalPeriodEntity> findForShare(@Param("year") int fiscalYear, @Param("month") int fiscalMonth);

    /**
     * Exclusive row lock (SELECT ... FOR UPDATE) held for the whole close, reopen or lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM FiscalPeriodEntity p WHERE p.id = :id")
    Optional<FiscalPeriodEntity> findByIdForUpdate(@Param("id") UUID id);
}
