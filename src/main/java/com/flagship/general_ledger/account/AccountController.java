package com.flagship.general_ledger.account;

import com.flagship.general_ledger.account.dto.AccountResponse;
import com.flagship.general_ledger.account.dto.CreateAccountRequest;
import com.flagship.general_ledger.account.dto.UpdateAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        log.info("Received account creation request: code={}, type={}", request.getCode(), request.getAccountType());

        Account account = accountService.createAccount(
            request.getCode(),
            request.getName(),
            request.getDescription(),
            request.getAccountType(),
            request.getNormalBalance(),
            request.getParentId());

        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping
    public List<AccountResponse> listAccounts(
            @RequestParam(value = "account_type", required = false) AccountType accountType) {
        return accountService.listAccounts(accountType).stream()
            .map(AccountResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public AccountResponse getAccount(@PathVariable("id") UUID id) {
        return AccountResponse.from(accountService.getAccount(id));
    }

    @GetMapping("/by-code/{code}")
    public AccountResponse getAccountByCode(@PathVariable("code") String code) {
        return AccountResponse.from(accountService.getAccountByCode(code));
    }

    @PatchMapping("/{id}")
    public AccountResponse updateAccount(@PathVariable("id") UUID id,
                                         @Valid @RequestBody UpdateAccountRequest request) {
        Account account = accountService.updateAccount(
            id,
            request.getName(),
            request.getDescription(),
            request.getAccountType(),
            request.getNormalBalance(),
            request.getParentId(),
            request.getStatus());
        return AccountResponse.from(account);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAccount(@PathVariable("id") UUID id) {
        accountService.deleteAccount(id);
        return ResponseEntity.noContent().build();
    }
}
