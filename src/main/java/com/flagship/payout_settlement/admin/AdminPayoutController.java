package com.flagship.payout_settlement.admin;

import com.flagship.payout_settlement.earnings.EarningsSummary;
import com.flagship.payout_settlement.payment.Payment;
import com.flagship.payout_settlement.payment.PaymentFilter;
import com.flagship.payout_settlement.payment.PaymentStatus;
import com.flagship.payout_settlement.payment.RecordPaymentCommand;
import com.flagship.payout_settlement.payment.dto.BulkSettlementResponse;
import com.flagship.payout_settlement.payment.dto.PaymentResponse;
import com.flagship.payout_settlement.payment.dto.RecordPaymentRequest;
import com.flagship.payout_settlement.payment.dto.RefundRequest;
import com.flagship.payout_settlement.payment.dto.ResolveDisputeRequest;
import com.flagship.payout_settlement.payment.dto.SettleAllRequest;
import com.flagship.payout_settlement.payment.dto.SettlementOutcomeResponse;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Admin payment operations.
 *
 * Single settlement returns 200 for COMPLETED and ALREADY_COMPLETED; failures
 * are persisted first and then surface as 422 (insufficient funds, below
 * minimum) or 502 (other rail failures). Bulk settlement always returns 200
 * with per-item results.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminPayoutController {

    static final String ADMIN_ID_HEADER = "X-Admin-Id";

    private final AdminPayoutService adminPayoutService;

    @PostMapping("/payments")
    public ResponseEntity<PaymentResponse> recordPayment(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @Valid @RequestBody RecordPaymentRequest request) {
        log.info("Admin {} recording payment: creator={}, company={}, gross={}",
            adminId, request.getCreatorId(), request.getCompanyId(), request.getGrossAmount());

        Payment payment = adminPayoutService.recordPayment(RecordPaymentCommand.builder()
            .creatorId(request.getCreatorId())
            .companyId(request.getCompanyId())
            .offerId(request.getOfferId())
            .grossAmount(request.getGrossAmount())
            .platformFeeRate(request.getPlatformFeeRate())
            .description(request.getDescription())
            .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }

    @GetMapping("/payments")
    public ResponseEntity<List<PaymentResponse>> listPayments(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestParam(value = "status", required = false) Set<PaymentStatus> statuses,
            @RequestParam(value = "creator_id", required = false) UUID creatorId,
            @RequestParam(value = "company_id", required = false) UUID companyId,
            @RequestParam(value = "search", required = false) String search) {
        PaymentFilter filter = PaymentFilter.builder()
            .statuses(statuses)
            .creatorId(creatorId)
            .companyId(companyId)
            .search(search)
            .build();
        return ResponseEntity.ok(toResponses(adminPayoutService.listPayments(filter)));
    }

    @GetMapping("/payments/disputed")
    public ResponseEntity<List<PaymentResponse>> listDisputed(@RequestHeader(ADMIN_ID_HEADER) UUID adminId) {
        return ResponseEntity.ok(toResponses(adminPayoutService.listDisputed()));
    }

    @GetMapping("/payments/{id}")
    public ResponseEntity<PaymentResponse> getPayment(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @PathVariable("id") UUID paymentId) {
        return ResponseEntity.ok(PaymentResponse.from(adminPayoutService.getPayment(paymentId)));
    }

    @GetMapping("/earnings")
    public ResponseEntity<EarningsSummary> getEarnings(@RequestHeader(ADMIN_ID_HEADER) UUID adminId) {
        return ResponseEntity.ok(adminPayoutService.getPlatformEarnings());
    }

    @PostMapping("/payments/{id}/approve")
    public ResponseEntity<PaymentResponse> approve(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @PathVariable("id") UUID paymentId) {
        log.info("Admin {} approving payment {}", adminId, paymentId);
        return ResponseEntity.ok(PaymentResponse.from(adminPayoutService.approve(paymentId)));
    }

    @PostMapping("/payments/{id}/settle")
    public ResponseEntity<SettlementOutcomeResponse> settle(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @PathVariable("id") UUID paymentId) {
        log.info("Admin {} settling payment {}", adminId, paymentId);
        return ResponseEntity.ok(SettlementOutcomeResponse.from(adminPayoutService.settle(paymentId)));
    }

    @PostMapping("/payments/settle-all")
    public ResponseEntity<BulkSettlementResponse> settleAll(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestBody(required = false) SettleAllRequest request) {
        PaymentFilter filter = request != null ? request.toFilter() : PaymentFilter.all();
        log.info("Admin {} settling all processing payments", adminId);
        return ResponseEntity.ok(BulkSettlementResponse.from(adminPayoutService.settleAll(filter)));
    }

    @PostMapping("/payments/{id}/retry")
    public ResponseEntity<PaymentResponse> retry(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @PathVariable("id") UUID paymentId) {
        log.info("Admin {} retrying payment {}", adminId, paymentId);
        return ResponseEntity.ok(PaymentResponse.from(adminPayoutService.retry(paymentId)));
    }

    @PostMapping("/payments/{id}/refund")
    public ResponseEntity<PaymentResponse> refund(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @PathVariable("id") UUID paymentId,
            @Valid @RequestBody(required = false) RefundRequest request) {
        String reason = request != null ? request.getReason() : null;
        log.info("Admin {} refunding payment {}", adminId, paymentId);
        return ResponseEntity.ok(PaymentResponse.from(adminPayoutService.refund(paymentId, reason)));
    }

    @PostMapping("/payments/{id}/resolve-dispute")
    public ResponseEntity<PaymentResponse> resolveDispute(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @PathVariable("id") UUID paymentId,
            @Valid @RequestBody ResolveDisputeRequest request) {
        log.info("Admin {} resolving dispute on payment {} with {}", adminId, paymentId, request.getResolution());
        return ResponseEntity.ok(PaymentResponse.from(
            adminPayoutService.resolveDispute(paymentId, request.getResolution(), request.getNotes())));
    }

    private static List<PaymentResponse> toResponses(List<Payment> payments) {
        return payments.stream().map(PaymentResponse::from).toList();
    }
}
