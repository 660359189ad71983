package com.flagship.general_ledger.period;

import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.period.dto.CreateFiscalPeriodRequest;
import com.flagship.general_ledger.period.dto.FiscalPeriodResponse;
import com.flagship.general_ledger.period.dto.PeriodTransitionRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
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
@RequestMapping("/api/fiscal-periods")
@RequiredArgsConstructor
@Slf4j
public class FiscalPeriodController {

    private final FiscalPeriodService periodService;

    @PostMapping
    public ResponseEntity<FiscalPeriodResponse> createPeriod(@Valid @RequestBody CreateFiscalPeriodRequest request) {
        FiscalPeriod period = periodService.createPeriod(request.getFiscalYear(), request.getFiscalMonth());
        return ResponseEntity.status(HttpStatus.CREATED).body(FiscalPeriodResponse.from(period));
    }

    @GetMapping
    public List<FiscalPeriodResponse> listPeriods(
            @RequestParam(value = "fiscal_year", required = false) Integer fiscalYear) {
        return periodService.listPeriods(fiscalYear).stream()
            .map(FiscalPeriodResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public FiscalPeriodResponse getPeriod(@PathVariable("id") UUID id) {
        return FiscalPeriodResponse.from(periodService.getPeriod(id));
    }

    @GetMapping("/{id}/close-checklist")
    public CloseChecklist closeChecklist(@PathVariable("id") UUID id) {
        return periodService.closeChecklist(id);
    }

    @PostMapping("/{id}/close")
    public FiscalPeriodResponse closePeriod(@PathVariable("id") UUID id,
                                            @Valid @RequestBody PeriodTransitionRequest request) {
        MDC.put(CorrelationContext.PERIOD_ID_MDC_KEY, id.toString());
        try {
            log.info("Received period close request: by={}", request.getPerformedBy());
            return FiscalPeriodResponse.from(periodService.closePeriod(id, request.getPerformedBy()));
        } finally {
            MDC.remove(CorrelationContext.PERIOD_ID_MDC_KEY);
        }
    }

    @PostMapping("/{id}/reopen")
    public FiscalPeriodResponse reopenPeriod(@PathVariable("id") UUID id,
                                             @Valid @RequestBody PeriodTransitionRequest request) {
        MDC.put(CorrelationContext.PERIOD_ID_MDC_KEY, id.toString());
        try {
            return FiscalPeriodResponse.from(
                periodService.reopenPeriod(id, request.getReason(), request.getPerformedBy()));
        } finally {
            MDC.remove(CorrelationContext.PERIOD_ID_MDC_KEY);
        }
    }

    @PostMapping("/{id}/lock")
    public FiscalPeriodResponse lockPeriod(@PathVariable("id") UUID id,
                                           @Valid @RequestBody PeriodTransitionRequest request) {
        MDC.put(CorrelationContext.PERIOD_ID_MDC_KEY, id.toString());
        try {
            return FiscalPeriodResponse.from(periodService.lockPeriod(id, request.getPerformedBy()));
        } finally {
            MDC.remove(CorrelationContext.PERIOD_ID_MDC_KEY);
        }
    }
}
