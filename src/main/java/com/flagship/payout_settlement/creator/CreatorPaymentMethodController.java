package com.flagship.payout_settlement.creator;

import com.flagship.payout_settlement.method.dto.AttachExternalAccountRequest;
import com.flagship.payout_settlement.method.dto.PaymentMethodResponse;
import com.flagship.payout_settlement.method.dto.RegisterPaymentMethodRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

import static com.flagship.payout_settlement.creator.CreatorPayoutController.CREATOR_ID_HEADER;

@RestController
@RequestMapping("/api/creator/payment-methods")
@RequiredArgsConstructor
@Slf4j
public class CreatorPaymentMethodController {

    private final CreatorPayoutService creatorPayoutService;

    @PostMapping
    public ResponseEntity<PaymentMethodResponse> register(
            @RequestHeader(CREATOR_ID_HEADER) UUID creatorId,
            @Valid @RequestBody RegisterPaymentMethodRequest request) {
        log.info("Registering {} payout method for creator {}", request.getType(), creatorId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(PaymentMethodResponse.from(creatorPayoutService.registerPaymentMethod(creatorId, request)));
    }

    @GetMapping
    public ResponseEntity<List<PaymentMethodResponse>> list(@RequestHeader(CREATOR_ID_HEADER) UUID creatorId) {
        return ResponseEntity.ok(creatorPayoutService.listPaymentMethods(creatorId).stream()
            .map(PaymentMethodResponse::from)
            .toList());
    }

    @PostMapping("/{id}/default")
    public ResponseEntity<PaymentMethodResponse> setDefault(
            @RequestHeader(CREATOR_ID_HEADER) UUID creatorId,
            @PathVariable("id") UUID methodId) {
        return ResponseEntity.ok(PaymentMethodResponse.from(
            creatorPayoutService.setDefaultPaymentMethod(creatorId, methodId)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @RequestHeader(CREATOR_ID_HEADER) UUID creatorId,
            @PathVariable("id") UUID methodId) {
        creatorPayoutService.deletePaymentMethod(creatorId, methodId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Callback once the creator finishes payout-account onboarding with the rail provider.
     */
    @PostMapping("/{id}/external-account")
    public ResponseEntity<PaymentMethodResponse> attachExternalAccount(
            @RequestHeader(CREATOR_ID_HEADER) UUID creatorId,
            @PathVariable("id") UUID methodId,
            @Valid @RequestBody AttachExternalAccountRequest request) {
        return ResponseEntity.ok(PaymentMethodResponse.from(
            creatorPayoutService.attachExternalAccount(creatorId, methodId, request.getExternalAccountId())));
    }
}
