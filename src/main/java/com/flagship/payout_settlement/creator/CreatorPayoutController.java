package com.flagship.payout_settlement.creator;

import com.flagship.payout_settlement.earnings.EarningsSummary;
import com.flagship.payout_settlement.payment.PaymentFilter;
import com.flagship.payout_settlement.payment.PaymentStatus;
import com.flagship.payout_settlement.payment.dto.PaymentResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Creator payout views. The caller's identity arrives in {@value #CREATOR_ID_HEADER},
 * set by the gateway after authentication.
 */
@RestController
@RequestMapping("/api/creator")
@RequiredArgsConstructor
public class CreatorPayoutController {

    static final String CREATOR_ID_HEADER = "X-Creator-Id";

    private final CreatorPayoutService creatorPayoutService;

    @GetMapping("/payments")
    public ResponseEntity<List<PaymentResponse>> listPayments(
            @RequestHeader(CREATOR_ID_HEADER) UUID creatorId,
            @RequestParam(value = "status", required = false) Set<PaymentStatus> statuses,
            @RequestParam(value = "search", required = false) String search) {
        PaymentFilter filter = PaymentFilter.builder()
            .statuses(statuses)
            .search(search)
            .build();
        return ResponseEntity.ok(creatorPayoutService.listPayments(creatorId, filter).stream()
            .map(PaymentResponse::from)
            .toList());
    }

    @GetMapping("/earnings")
    public ResponseEntity<EarningsSummary> getEarnings(@RequestHeader(CREATOR_ID_HEADER) UUID creatorId) {
        return ResponseEntity.ok(creatorPayoutService.getEarningsSummary(creatorId));
    }
}
