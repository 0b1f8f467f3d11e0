package com.flagship.bnpl_ledger.settlement;

import com.flagship.bnpl_ledger.orchestration.LedgerOperations;
import com.flagship.bnpl_ledger.purchase.PurchaseRequestService;
import com.flagship.bnpl_ledger.purchase.PurchaseRequestStatus;
import com.flagship.bnpl_ledger.purchase.dto.PurchaseRequestResponse;
import com.flagship.bnpl_ledger.reporting.LedgerReportingService;
import com.flagship.bnpl_ledger.reporting.dto.MerchantStatsResponse;
import com.flagship.bnpl_ledger.settlement.dto.BankDetailsPayload;
import com.flagship.bnpl_ledger.settlement.dto.MerchantResponse;
import com.flagship.bnpl_ledger.settlement.dto.RegisterMerchantRequest;
import com.flagship.bnpl_ledger.settlement.dto.SettlementResponse;
import com.flagship.bnpl_ledger.settlement.dto.WithdrawalRequest;
import com.flagship.bnpl_ledger.transaction.TransactionService;
import com.flagship.bnpl_ledger.transaction.TransactionStatus;
import com.flagship.bnpl_ledger.transaction.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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
@RequestMapping("/api/merchants")
@RequiredArgsConstructor
@Slf4j
public class MerchantController {

    private final LedgerOperations ledgerOperations;
    private final MerchantService merchantService;
    private final SettlementService settlementService;
    private final PurchaseRequestService purchaseRequestService;
    private final TransactionService transactionService;
    private final LedgerReportingService reportingService;

    @PostMapping
    public ResponseEntity<MerchantResponse> registerMerchant(@Valid @RequestBody RegisterMerchantRequest request) {
        Merchant merchant = ledgerOperations.registerMerchant(request.getBusinessName(),
            BankDetailsPayload.toDomainOrNull(request.getBankDetails()));
        return ResponseEntity.status(HttpStatus.CREATED).body(MerchantResponse.from(merchant));
    }

    @GetMapping("/{id}")
    public ResponseEntity<MerchantResponse> getMerchant(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(MerchantResponse.from(merchantService.getMerchant(id)));
    }

    @GetMapping("/{id}/purchase-requests")
    public ResponseEntity<List<PurchaseRequestResponse>> purchaseRequests(
            @PathVariable("id") UUID id,
            @RequestParam(name = "status", required = false) PurchaseRequestStatus status) {
        merchantService.getMerchant(id);
        return ResponseEntity.ok(purchaseRequestService.requestsForMerchant(id, status).stream()
            .map(PurchaseRequestResponse::from)
            .toList());
    }

    @GetMapping("/{id}/transactions")
    public ResponseEntity<List<TransactionResponse>> transactions(
            @PathVariable("id") UUID id,
            @RequestParam(name = "status", required = false) TransactionStatus status) {
        merchantService.getMerchant(id);
        return ResponseEntity.ok(transactionService.transactionsForMerchant(id, status).stream()
            .map(TransactionResponse::from)
            .toList());
    }

    @GetMapping("/{id}/settlements")
    public ResponseEntity<List<SettlementResponse>> settlements(
            @PathVariable("id") UUID id,
            @RequestParam(name = "type", required = false) SettlementType type) {
        merchantService.getMerchant(id);
        return ResponseEntity.ok(settlementService.settlementsForMerchant(id, type).stream()
            .map(SettlementResponse::from)
            .toList());
    }

    @GetMapping("/{id}/stats")
    public ResponseEntity<MerchantStatsResponse> stats(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(MerchantStatsResponse.from(id, reportingService.merchantStats(id)));
    }

    @PostMapping("/{id}/withdrawals")
    public ResponseEntity<SettlementResponse> requestWithdrawal(
            @PathVariable("id") UUID id,
            @Valid @RequestBody WithdrawalRequest request) {
        log.info("Withdrawal requested: merchantId={}, amount={}", id, request.getAmount());
        Settlement withdrawal = ledgerOperations.requestWithdrawal(id, request.getAmount(),
            BankDetailsPayload.toDomainOrNull(request.getBankDetails()));
        return ResponseEntity.status(HttpStatus.CREATED).body(SettlementResponse.from(withdrawal));
    }
}
