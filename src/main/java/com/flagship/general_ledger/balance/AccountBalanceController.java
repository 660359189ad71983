package com.flagship.general_ledger.balance;

import com.flagship.general_ledger.balance.dto.AccountBalanceResponse;
import com.flagship.general_ledger.balance.dto.CalculateBalancesRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AccountBalanceController {

    private final AccountBalanceService balanceService;

    @PostMapping("/account-balances/calculate")
    public RecalculationResult calculate(@Valid @RequestBody CalculateBalancesRequest request) {
        log.info("Received balance calculation request: period={}-{}",
            request.getFiscalYear(), request.getFiscalMonth());
        return balanceService.recalculate(request.getFiscalYear(), request.getFiscalMonth());
    }

    @GetMapping("/account-balances")
    public List<AccountBalanceResponse> listBalances(@RequestParam("fiscal_year") int fiscalYear,
                                                     @RequestParam("fiscal_month") int fiscalMonth) {
        return balanceService.listPeriodBalances(fiscalYear, fiscalMonth).stream()
            .map(AccountBalanceResponse::from)
            .toList();
    }

    @GetMapping("/account-balances/{accountId}")
    public AccountBalanceResponse getBalance(@PathVariable("accountId") UUID accountId,
                                             @RequestParam("fiscal_year") int fiscalYear,
                                             @RequestParam("fiscal_month") int fiscalMonth) {
        return AccountBalanceResponse.from(balanceService.getAccountBalance(accountId, fiscalYear, fiscalMonth));
    }

    @GetMapping("/reports/trial-balance")
    public TrialBalance trialBalance(@RequestParam("fiscal_year") int fiscalYear,
                                     @RequestParam("fiscal_month") int fiscalMonth) {
        return balanceService.trialBalance(fiscalYear, fiscalMonth);
    }
}
