package com.flagship.payout_settlement.company;

import com.flagship.payout_settlement.earnings.EarningsSummary;
import com.flagship.payout_settlement.payment.PaymentFilter;
import com.flagship.payout_settlement.payment.PaymentStatus;
import com.flagship.payout_settlement.payment.dto.DisputeRequest;
import com.flagship.payout_settlement.payment.dto.PaymentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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

@RestController
@RequestMapping("/api/company")
@RequiredArgsConstructor
public class CompanyPayoutController {

    static final String COMPANY_ID_HEADER = "X-Company-Id";

    private final CompanyPayoutService companyPayoutService;

    @GetMapping("/payments")
    public ResponseEntity<List<PaymentResponse>> listPayments(
            @RequestHeader(COMPANY_ID_HEADER) UUID companyId,
            @RequestParam(value = "status", required = false) Set<PaymentStatus> statuses,
            @RequestParam(value = "offer_id", required = false) UUID offerId,
            @RequestParam(value = "search", required = false) String search) {
        PaymentFilter filter = PaymentFilter.builder()
            .statuses(statuses)
            .offerId(offerId)
            .search(search)
            .build();
        return ResponseEntity.ok(companyPayoutService.listPayments(companyId, filter).stream()
            .map(PaymentResponse::from)
            .toList());
    }

    @GetMapping("/earnings")
    public ResponseEntity<EarningsSummary> getEarnings(@RequestHeader(COMPANY_ID_HEADER) UUID companyId) {
        return ResponseEntity.ok(companyPayoutService.getEarningsSummary(companyId));
    }

    @PostMapping("/payments/{id}/approve")
    public ResponseEntity<PaymentResponse> approve(
            @RequestHeader(COMPANY_ID_HEADER) UUID companyId,
            @PathVariable("id") UUID paymentId) {
        return ResponseEntity.ok(PaymentResponse.from(companyPayoutService.approve(companyId, paymentId)));
    }

    @PostMapping("/payments/{id}/dispute")
    public ResponseEntity<PaymentResponse> dispute(
            @RequestHeader(COMPANY_ID_HEADER) UUID companyId,
            @PathVariable("id") UUID paymentId,
            @Valid @RequestBody DisputeRequest request) {
        return ResponseEntity.ok(PaymentResponse.from(
            companyPayoutService.dispute(companyId, paymentId, request.getReason())));
    }
}
