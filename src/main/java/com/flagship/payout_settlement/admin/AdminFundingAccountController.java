package com.flagship.payout_settlement.admin;

import com.flagship.payout_settlement.funding.FundingAccountService;
import com.flagship.payout_settlement.funding.dto.CreateFundingAccountRequest;
import com.flagship.payout_settlement.funding.dto.FundingAccountResponse;
import com.flagship.payout_settlement.funding.dto.UpdateFundingAccountStatusRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

import static com.flagship.payout_settlement.admin.AdminPayoutController.ADMIN_ID_HEADER;

@RestController
@RequestMapping("/api/admin/funding-accounts")
@RequiredArgsConstructor
public class AdminFundingAccountController {

    private final FundingAccountService fundingAccounts;

    @PostMapping
    public ResponseEntity<FundingAccountResponse> create(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @Valid @RequestBody CreateFundingAccountRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(FundingAccountResponse.from(fundingAccounts.create(request)));
    }

    @GetMapping
    public ResponseEntity<List<FundingAccountResponse>> list(@RequestHeader(ADMIN_ID_HEADER) UUID adminId) {
        return ResponseEntity.ok(fundingAccounts.list().stream().map(FundingAccountResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<FundingAccountResponse> get(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(FundingAccountResponse.from(fundingAccounts.get(id)));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<FundingAccountResponse> updateStatus(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateFundingAccountStatusRequest request) {
        return ResponseEntity.ok(FundingAccountResponse.from(fundingAccounts.updateStatus(id, request.getStatus())));
    }

    @PostMapping("/{id}/primary")
    public ResponseEntity<FundingAccountResponse> setPrimary(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(FundingAccountResponse.from(fundingAccounts.setPrimary(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @PathVariable("id") UUID id) {
        fundingAccounts.delete(id);
        return ResponseEntity.noContent().build();
    }
}
