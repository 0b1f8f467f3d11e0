package com.flagship.bnpl_ledger.credit;

import com.flagship.bnpl_ledger.config.LedgerProperties;
import com.flagship.bnpl_ledger.credit.dto.CustomerResponse;
import com.flagship.bnpl_ledger.credit.dto.LimitHistoryResponse;
import com.flagship.bnpl_ledger.credit.dto.LimitIncreaseRequest;
import com.flagship.bnpl_ledger.credit.dto.RegisterCustomerRequest;
import com.flagship.bnpl_ledger.orchestration.LedgerOperations;
import com.flagship.bnpl_ledger.payment.PaymentService;
import com.flagship.bnpl_ledger.payment.dto.PaymentResponse;
import com.flagship.bnpl_ledger.purchase.PurchaseRequestService;
import com.flagship.bnpl_ledger.purchase.PurchaseRequestStatus;
import com.flagship.bnpl_ledger.purchase.dto.PurchaseRequestResponse;
import com.flagship.bnpl_ledger.reporting.LedgerReportingService;
import com.flagship.bnpl_ledger.reporting.dto.InstallmentViewResponse;
import com.flagship.bnpl_ledger.reporting.dto.OnTimeRateResponse;
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

/**
 * Customer-facing endpoints: registration, credit limit, and everything a customer owes.
 */
@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
@Slf4j
public class CustomerController {

    private final LedgerOperations ledgerOperations;
    private final CreditLedgerService creditLedgerService;
    private final TransactionService transactionService;
    private final PaymentService paymentService;
    private final PurchaseRequestService purchaseRequestService;
    private final LedgerReportingService reportingService;
    private final LedgerProperties properties;

    @PostMapping
    public ResponseEntity<CustomerResponse> registerCustomer(
            @Valid @RequestBody(required = false) RegisterCustomerRequest request) {
        Customer customer = ledgerOperations.registerCustomer(request != null ? request.getCreditLimit() : null);
        return ResponseEntity.status(HttpStatus.CREATED).body(CustomerResponse.from(customer));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CustomerResponse> getCustomer(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(CustomerResponse.from(creditLedgerService.getCustomer(id)));
    }

    @PostMapping("/{id}/limit-increase")
    public ResponseEntity<LimitHistoryResponse> requestLimitIncrease(
            @PathVariable("id") UUID id,
            @Valid @RequestBody LimitIncreaseRequest request) {
        log.info("Limit increase requested: customerId={}, newLimit={}", id, request.getNewLimit());
        CustomerLimitHistory history = ledgerOperations.requestLimitIncrease(id, request.getNewLimit(), request.getReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(LimitHistoryResponse.from(history));
    }

    @GetMapping("/{id}/limit-history")
    public ResponseEntity<List<LimitHistoryResponse>> limitHistory(@PathVariable("id") UUID id) {
        creditLedgerService.getCustomer(id);
        return ResponseEntity.ok(creditLedgerService.limitHistory(id).stream()
            .map(LimitHistoryResponse::from)
            .toList());
    }

    @GetMapping("/{id}/transactions")
    public ResponseEntity<List<TransactionResponse>> transactions(
            @PathVariable("id") UUID id,
            @RequestParam(name = "status", required = false) TransactionStatus status) {
        creditLedgerService.getCustomer(id);
        return ResponseEntity.ok(transactionService.transactionsForCustomer(id, status).stream()
            .map(TransactionResponse::from)
            .toList());
    }

    @GetMapping("/{id}/payments")
    public ResponseEntity<List<PaymentResponse>> payments(@PathVariable("id") UUID id) {
        creditLedgerService.getCustomer(id);
        return ResponseEntity.ok(paymentService.paymentsForCustomer(id).stream()
            .map(PaymentResponse::from)
            .toList());
    }

    @GetMapping("/{id}/purchase-requests")
    public ResponseEntity<List<PurchaseRequestResponse>> purchaseRequests(
            @PathVariable("id") UUID id,
            @RequestParam(name = "status", required = false) PurchaseRequestStatus status) {
        creditLedgerService.getCustomer(id);
        return ResponseEntity.ok(purchaseRequestService.requestsForCustomer(id, status).stream()
            .map(PurchaseRequestResponse::from)
            .toList());
    }

    @GetMapping("/{id}/installments/upcoming")
    public ResponseEntity<List<InstallmentViewResponse>> upcomingInstallments(
            @PathVariable("id") UUID id,
            @RequestParam(name = "days", required = false) Integer days) {
        creditLedgerService.getCustomer(id);
        int window = days != null ? days : properties.getUpcomingWindowDays();
        return ResponseEntity.ok(reportingService.upcomingInstallments(id, window).stream()
            .map(InstallmentViewResponse::from)
            .toList());
    }

    @GetMapping("/{id}/installments/overdue")
    public ResponseEntity<List<InstallmentViewResponse>> overdueInstallments(@PathVariable("id") UUID id) {
        creditLedgerService.getCustomer(id);
        return ResponseEntity.ok(reportingService.overdueInstallments(id).stream()
            .map(InstallmentViewResponse::from)
            .toList());
    }

    @GetMapping("/{id}/on-time-rate")
    public ResponseEntity<OnTimeRateResponse> onTimeRate(@PathVariable("id") UUID id) {
        creditLedgerService.getCustomer(id);
        return ResponseEntity.ok(new OnTimeRateResponse(id, reportingService.onTimePaymentRate(id)));
    }
}
