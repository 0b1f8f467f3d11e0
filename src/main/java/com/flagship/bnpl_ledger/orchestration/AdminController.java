package com.flagship.bnpl_ledger.orchestration;

import com.flagship.bnpl_ledger.credit.CreditLedgerService;
import com.flagship.bnpl_ledger.credit.dto.CustomerResponse;
import com.flagship.bnpl_ledger.credit.dto.CustomerStatusRequest;
import com.flagship.bnpl_ledger.credit.dto.LimitDecisionRequest;
import com.flagship.bnpl_ledger.credit.dto.LimitHistoryResponse;
import com.flagship.bnpl_ledger.reporting.LedgerReportingService;
import com.flagship.bnpl_ledger.reporting.dto.InstallmentViewResponse;
import com.flagship.bnpl_ledger.reporting.dto.PlatformRevenueResponse;
import com.flagship.bnpl_ledger.settlement.dto.CompleteSettlementRequest;
import com.flagship.bnpl_ledger.settlement.dto.FailSettlementRequest;
import com.flagship.bnpl_ledger.settlement.dto.MerchantResponse;
import com.flagship.bnpl_ledger.settlement.dto.MerchantStatusRequest;
import com.flagship.bnpl_ledger.settlement.dto.SettlementResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Back-office operations: limit reviews, account status, withdrawal payouts and platform reports.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final LedgerOperations ledgerOperations;
    private final CreditLedgerService creditLedgerService;
    private final LedgerReportingService reportingService;

    @GetMapping("/limit-requests")
    public ResponseEntity<List<LimitHistoryResponse>> pendingLimitRequests() {
        return ResponseEntity.ok(creditLedgerService.pendingLimitRequests().stream()
            .map(LimitHistoryResponse::from)
            .toList());
    }

    @PostMapping("/limit-requests/{id}/approve")
    public ResponseEntity<LimitHistoryResponse> approveLimitIncrease(
            @PathVariable("id") UUID id,
            @Valid @RequestBody LimitDecisionRequest request) {
        log.info("Limit request {} approved by {}", id, request.getAdmin());
        return ResponseEntity.ok(LimitHistoryResponse.from(
            ledgerOperations.approveLimitIncrease(id, request.getAdmin(), request.getNote())));
    }

    @PostMapping("/limit-requests/{id}/reject")
    public ResponseEntity<LimitHistoryResponse> rejectLimitIncrease(
            @PathVariable("id") UUID id,
            @Valid @RequestBody LimitDecisionRequest request) {
        log.info("Limit request {} rejected by {}", id, request.getAdmin());
        return ResponseEntity.ok(LimitHistoryResponse.from(
            ledgerOperations.rejectLimitIncrease(id, request.getAdmin(), request.getNote())));
    }

    @PutMapping("/customers/{id}/status")
    public ResponseEntity<CustomerResponse> changeCustomerStatus(
            @PathVariable("id") UUID id,
            @Valid @RequestBody CustomerStatusRequest request) {
        return ResponseEntity.ok(CustomerResponse.from(ledgerOperations.changeCustomerStatus(id, request.getStatus())));
    }

    @PutMapping("/merchants/{id}/status")
    public ResponseEntity<MerchantResponse> changeMerchantStatus(
            @PathVariable("id") UUID id,
            @Valid @RequestBody MerchantStatusRequest request) {
        return ResponseEntity.ok(MerchantResponse.from(ledgerOperations.changeMerchantStatus(id, request.getStatus())));
    }

    @PostMapping("/settlements/{id}/process")
    public ResponseEntity<SettlementResponse> processSettlement(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(SettlementResponse.from(ledgerOperations.markSettlementProcessing(id)));
    }

    @PostMapping("/settlements/{id}/complete")
    public ResponseEntity<SettlementResponse> completeSettlement(
            @PathVariable("id") UUID id,
            @Valid @RequestBody CompleteSettlementRequest request) {
        return ResponseEntity.ok(SettlementResponse.from(
            ledgerOperations.completeSettlement(id, request.getBankReference())));
    }

    @PostMapping("/settlements/{id}/fail")
    public ResponseEntity<SettlementResponse> failSettlement(
            @PathVariable("id") UUID id,
            @Valid @RequestBody FailSettlementRequest request) {
        return ResponseEntity.ok(SettlementResponse.from(ledgerOperations.failSettlement(id, request.getReason())));
    }

    @GetMapping("/revenue")
    public ResponseEntity<PlatformRevenueResponse> platformRevenue(
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(PlatformRevenueResponse.from(reportingService.platformRevenue(from, to)));
    }

    @GetMapping("/installments/overdue")
    public ResponseEntity<List<InstallmentViewResponse>> overdueInstallments() {
        return ResponseEntity.ok(reportingService.overdueInstallments(null).stream()
            .map(InstallmentViewResponse::from)
            .toList());
    }
}
