package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.reconciliation.dto.BankAccountResponse;
import com.flagship.general_ledger.reconciliation.dto.ChangeBankAccountStatusRequest;
import com.flagship.general_ledger.reconciliation.dto.CreateBankAccountRequest;
import com.flagship.general_ledger.reconciliation.dto.ReconciliationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/bank-accounts")
@RequiredArgsConstructor
public class BankAccountController {

    private final BankAccountService bankAccountService;
    private final ReconciliationService reconciliationService;

    @PostMapping
    public ResponseEntity<BankAccountResponse> createBankAccount(@Valid @RequestBody CreateBankAccountRequest request) {
        BankAccount bankAccount = bankAccountService.createBankAccount(
            request.getLinkedAccountId(),
            request.getBankName(),
            request.getAccountNumber(),
            request.getCurrency());
        return ResponseEntity.status(HttpStatus.CREATED).body(BankAccountResponse.from(bankAccount));
    }

    @GetMapping
    public List<BankAccountResponse> listBankAccounts() {
        return bankAccountService.listBankAccounts().stream()
            .map(BankAccountResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public BankAccountResponse getBankAccount(@PathVariable("id") UUID id) {
        return BankAccountResponse.from(bankAccountService.getBankAccount(id));
    }

    @PostMapping("/{id}/status")
    public BankAccountResponse changeStatus(@PathVariable("id") UUID id,
                                            @Valid @RequestBody ChangeBankAccountStatusRequest request) {
        return BankAccountResponse.from(bankAccountService.changeStatus(id, request.getStatus()));
    }

    /**
     * Reconciliation headers for the account, without transactions or items.
     */
    @GetMapping("/{id}/reconciliations")
    public List<ReconciliationResponse> listReconciliations(@PathVariable("id") UUID id) {
        return reconciliationService.listForBankAccount(id).stream()
            .map(r -> ReconciliationResponse.from(r, List.of(), List.of()))
            .toList();
    }
}
