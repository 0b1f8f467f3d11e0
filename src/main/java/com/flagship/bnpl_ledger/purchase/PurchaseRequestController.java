package com.flagship.bnpl_ledger.purchase;

import com.flagship.bnpl_ledger.orchestration.AcceptanceResult;
import com.flagship.bnpl_ledger.orchestration.LedgerOperations;
import com.flagship.bnpl_ledger.orchestration.dto.AcceptanceResponse;
import com.flagship.bnpl_ledger.purchase.dto.AcceptPurchaseRequest;
import com.flagship.bnpl_ledger.purchase.dto.CancelPurchaseRequest;
import com.flagship.bnpl_ledger.purchase.dto.PurchaseRequestResponse;
import com.flagship.bnpl_ledger.purchase.dto.RejectPurchaseRequest;
import com.flagship.bnpl_ledger.purchase.dto.SendPurchaseRequest;
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
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Purchase request lifecycle. The merchant sends and may cancel; the customer accepts with a
 * plan or rejects.
 */
@RestController
@RequestMapping("/api/purchase-requests")
@RequiredArgsConstructor
@Slf4j
public class PurchaseRequestController {

    private final LedgerOperations ledgerOperations;
    private final PurchaseRequestService purchaseRequestService;

    @PostMapping
    public ResponseEntity<PurchaseRequestResponse> sendPurchaseRequest(@Valid @RequestBody SendPurchaseRequest request) {
        log.info("Purchase request received: merchantId={}, customerId={}, quantity={}, unitPrice={}",
            request.getMerchantId(), request.getCustomerId(), request.getQuantity(), request.getUnitPrice());
        PurchaseRequest sent = ledgerOperations.sendPurchaseRequest(request.getMerchantId(), request.getCustomerId(),
            request.getProductName(), request.getProductDescription(), request.getQuantity(), request.getUnitPrice());
        return ResponseEntity.status(HttpStatus.CREATED).body(PurchaseRequestResponse.from(sent));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PurchaseRequestResponse> getPurchaseRequest(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(PurchaseRequestResponse.from(purchaseRequestService.getPurchaseRequest(id)));
    }

    @PostMapping("/{id}/accept")
    public ResponseEntity<AcceptanceResponse> acceptPurchase(
            @PathVariable("id") UUID id,
            @Valid @RequestBody AcceptPurchaseRequest request) {
        log.info("Accepting purchase request {} with {} installments", id, request.getPlanType());
        AcceptanceResult result = ledgerOperations.acceptPurchase(id, request.getCustomerId(), request.getPlanType());
        return ResponseEntity.status(HttpStatus.CREATED).body(AcceptanceResponse.from(result));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<PurchaseRequestResponse> rejectPurchase(
            @PathVariable("id") UUID id,
            @Valid @RequestBody RejectPurchaseRequest request) {
        PurchaseRequest rejected = ledgerOperations.rejectPurchase(id, request.getCustomerId(), request.getReason());
        return ResponseEntity.ok(PurchaseRequestResponse.from(rejected));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<PurchaseRequestResponse> cancelPurchase(
            @PathVariable("id") UUID id,
            @Valid @RequestBody CancelPurchaseRequest request) {
        PurchaseRequest cancelled = ledgerOperations.cancelPurchase(id, request.getMerchantId());
        return ResponseEntity.ok(PurchaseRequestResponse.from(cancelled));
    }
}
