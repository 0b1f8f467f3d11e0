package com.flagship.bnpl_ledger.transaction;

import com.flagship.bnpl_ledger.installment.RepaymentPlanService;
import com.flagship.bnpl_ledger.orchestration.LedgerOperations;
import com.flagship.bnpl_ledger.payment.PaymentResult;
import com.flagship.bnpl_ledger.payment.PaymentService;
import com.flagship.bnpl_ledger.payment.dto.MakePaymentRequest;
import com.flagship.bnpl_ledger.payment.dto.PaymentResponse;
import com.flagship.bnpl_ledger.transaction.dto.ScheduleResponse;
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
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Transactions, their repayment schedule and installment payments.
 *
 * Payments accept an optional {@code Idempotency-Key} header. Repeating a payment with the same
 * key returns the original payment with 200 instead of 201 and moves no money.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final LedgerOperations ledgerOperations;
    private final TransactionService transactionService;
    private final RepaymentPlanService planService;
    private final PaymentService paymentService;

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(TransactionResponse.from(transactionService.getTransaction(id)));
    }

    @GetMapping("/{id}/schedule")
    public ResponseEntity<ScheduleResponse> getSchedule(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(ScheduleResponse.from(planService.getPlan(id)));
    }

    @GetMapping("/{id}/payments")
    public ResponseEntity<List<PaymentResponse>> payments(@PathVariable("id") UUID id) {
        transactionService.getTransaction(id);
        return ResponseEntity.ok(paymentService.paymentsForTransaction(id).stream()
            .map(PaymentResponse::from)
            .toList());
    }

    @PostMapping("/{id}/payments")
    public ResponseEntity<PaymentResponse> makePayment(
            @PathVariable("id") UUID id,
            @Valid @RequestBody MakePaymentRequest request,
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        log.info("Payment received: transactionId={}, amount={}, method={}, idempotencyKey={}",
            id, request.getAmount(), request.getPaymentMethod(), idempotencyKey);

        PaymentResult result = ledgerOperations.makePayment(id, request.getCustomerId(), request.getAmount(),
            request.getPaymentMethod(), idempotencyKey);

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(PaymentResponse.from(result));
    }
}
