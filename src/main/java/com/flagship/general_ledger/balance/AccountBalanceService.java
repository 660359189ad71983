package com.flagship.general_ledger.balance;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountService;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.account.NormalBalance;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.period.FiscalPeriod;
import com.flagship.general_ledger.period.FiscalPeriodEntity;
import com.flagship.general_ledger.period.FiscalPeriodRepository;
import com.flagship.general_ledger.period.FiscalPeriodStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Derives account balances per period from posted journal lines.
 *
 * Balances are recomputed from scratch on demand and written as whole rows;
 * nothing is ever adjusted incrementally, so recalculating twice without new
 * postings yields identical rows. Reads never trigger a calculation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountBalanceService {

    private final AccountBalanceRepository balanceRepository;
    private final AccountService accountService;
    private final FiscalPeriodRepository periodRepository;
    private final LedgerMetrics metrics;

    /**
     * Recomputes and stores balances of every account for the period.
     *
     * @throws NotFoundException if the period does not exist
     * @throws InvalidStateException if the period is LOCKED
     */
    @Transactional
    public RecalculationResult recalculate(int fiscalYear, int fiscalMonth) {
        long startTime = System.currentTimeMillis();
        FiscalPeriod period = requirePeriod(fiscalYear, fiscalMonth);

        if (period.getStatus() == FiscalPeriodStatus.LOCKED) {
            throw new InvalidStateException("Period " + period.label() + " is LOCKED; its balances are final");
        }

        List<Account> accounts = accountService.listAccounts(null);
        BalanceCalculator.Result calculation = compute(period, accounts);

        balanceRepository.upsertAll(calculation.getBalances());

        RecalculationResult result = new RecalculationResult(
            fiscalYear, fiscalMonth, accounts.size(),
            calculation.getTotalDebits(), calculation.getTotalCredits());

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordRecalculation(result.isBalanced(), result.getAccountsProcessed());
        metrics.recordLatency("recalculate", duration);

        if (result.isBalanced()) {
            log.info("Balances recalculated: period={}, accounts={}, debits={}, credits={}, duration={}ms",
                period.label(), accounts.size(), result.getTotalDebits(), result.getTotalCredits(), duration);
        } else {
            log.warn("Balances recalculated but period is unbalanced: period={}, debits={}, credits={}",
                period.label(), result.getTotalDebits(), result.getTotalCredits());
        }
        return result;
    }

    /**
     * Trial balance for the period. CLOSED and LOCKED periods are reported from
     * stored balances; OPEN periods are computed live without writing.
     */
    @Transactional(readOnly = true)
    public TrialBalance trialBalance(int fiscalYear, int fiscalMonth) {
        FiscalPeriod period = requirePeriod(fiscalYear, fiscalMonth);
        List<Account> accounts = accountService.listAccounts(null);

        List<AccountBalance> balances;
        TrialBalance.Source source;

        List<AccountBalance> stored = period.getStatus() != FiscalPeriodStatus.OPEN
            ? balanceRepository.findByPeriod(fiscalYear, fiscalMonth)
            : List.of();

        if (!stored.isEmpty()) {
            balances = stored;
            source = TrialBalance.Source.CALCULATED;
        } else {
            balances = compute(period, accounts).getBalances();
            source = TrialBalance.Source.LIVE;
        }

        return buildTrialBalance(period, accounts, balances, source);
    }

    /**
     * @throws NotFoundException if balances were never calculated for the account and period
     */
    @Transactional(readOnly = true)
    public AccountBalance getAccountBalance(UUID accountId, int fiscalYear, int fiscalMonth) {
        FiscalPeriod.validateYearMonth(fiscalYear, fiscalMonth);
        return balanceRepository.find(accountId, fiscalYear, fiscalMonth)
            .orElseThrow(() -> new NotFoundException(String.format(
                "No calculated balance for account %s in %d-%02d", accountId, fiscalYear, fiscalMonth)));
    }

    @Transactional(readOnly = true)
    public List<AccountBalance> listPeriodBalances(int fiscalYear, int fiscalMonth) {
        FiscalPeriod.validateYearMonth(fiscalYear, fiscalMonth);
        return balanceRepository.findByPeriod(fiscalYear, fiscalMonth);
    }

    /**
     * Cumulative posted balance of an account through a date, signed on its normal side.
     */
    @Transactional(readOnly = true)
    public long bookBalanceAsOf(UUID accountId, LocalDate asOf) {
        Account account = accountService.getAccount(accountId);
        long net = balanceRepository.netPostedThrough(accountId, asOf);
        return account.getNormalBalance() == NormalBalance.DEBIT ? net : Math.negateExact(net);
    }

    private BalanceCalculator.Result compute(FiscalPeriod period, List<Account> accounts) {
        YearMonth previous = period.yearMonth().minusMonths(1);
        Map<UUID, Long> openings = balanceRepository.findClosingBalances(previous.getYear(), previous.getMonthValue());

        if (openings.isEmpty() && periodRepository.existsByFiscalYearAndFiscalMonth(
                previous.getYear(), previous.getMonthValue())) {
            log.warn("Previous period {} has no calculated balances; opening balances for {} default to 0",
                previous, period.label());
        }

        Map<UUID, AccountLineTotals> lineTotals =
            balanceRepository.sumPostedLines(period.getFiscalYear(), period.getFiscalMonth());

        try {
            return BalanceCalculator.calculate(period.getFiscalYear(), period.getFiscalMonth(),
                accounts, lineTotals, openings, Instant.now());
        } catch (ArithmeticException e) {
            throw new ValidationException("Balance overflow in period " + period.label(), e);
        }
    }

    private TrialBalance buildTrialBalance(FiscalPeriod period, List<Account> accounts,
                                           List<AccountBalance> balances, TrialBalance.Source source) {
        Map<UUID, AccountBalance> byAccount = balances.stream()
            .collect(Collectors.toMap(AccountBalance::getAccountId, Function.identity()));

        List<TrialBalance.Row> rows = new ArrayList<>();
        Map<AccountType, long[]> sums = new EnumMap<>(AccountType.class);
        long totalDebits = 0;
        long totalCredits = 0;

        for (Account account : accounts) {
            AccountBalance balance = byAccount.get(account.getId());
            if (balance == null) {
                continue;
            }
            TrialBalance.Row row = new TrialBalance.Row(
                account.getId(), account.getCode(), account.getName(),
                account.getAccountType(), account.getNormalBalance(),
                balance.getOpeningBalance(), balance.getDebitTotal(), balance.getCreditTotal(),
                balance.getClosingBalance());
            rows.add(row);

            long[] sum = sums.computeIfAbsent(account.getAccountType(), t -> new long[4]);
            sum[0] += row.getDebitTotal();
            sum[1] += row.getCreditTotal();
            sum[2] += row.getDebitBalance();
            sum[3] += row.getCreditBalance();

            totalDebits = Math.addExact(totalDebits, balance.getDebitTotal());
            totalCredits = Math.addExact(totalCredits, balance.getCreditTotal());
        }

        Map<AccountType, TrialBalance.Subtotal> subtotals = new EnumMap<>(AccountType.class);
        sums.forEach((type, sum) -> subtotals.put(type, new TrialBalance.Subtotal(sum[0], sum[1], sum[2], sum[3])));

        return new TrialBalance(period.getFiscalYear(), period.getFiscalMonth(), period.getStatus(),
            source, rows, subtotals, totalDebits, totalCredits);
    }

    private FiscalPeriod requirePeriod(int fiscalYear, int fiscalMonth) {
        FiscalPeriod.validateYearMonth(fiscalYear, fiscalMonth);
        return periodRepository.findByFiscalYearAndFiscalMonth(fiscalYear, fiscalMonth)
            .map(FiscalPeriodEntity::toDomain)
            .orElseThrow(() -> new NotFoundException(
                String.format("Fiscal period not found: %d-%02d", fiscalYear, fiscalMonth)));
    }
}
