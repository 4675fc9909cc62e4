package com.flagship.payout_settlement.admin;

import com.flagship.payout_settlement.settings.PlatformSettingKey;
import com.flagship.payout_settlement.settings.PlatformSettingsStore;
import com.flagship.payout_settlement.settings.dto.PlatformSettingResponse;
import com.flagship.payout_settlement.settings.dto.UpdateSettingRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

import static com.flagship.payout_settlement.admin.AdminPayoutController.ADMIN_ID_HEADER;

@RestController
@RequestMapping("/api/admin/settings")
@RequiredArgsConstructor
public class AdminSettingsController {

    private final PlatformSettingsStore settings;

    @GetMapping
    public ResponseEntity<List<PlatformSettingResponse>> list(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @RequestParam(value = "category", required = false) String category) {
        return ResponseEntity.ok(settings.list(category).stream()
            .map(PlatformSettingResponse::from)
            .toList());
    }

    @GetMapping("/{key}")
    public ResponseEntity<PlatformSettingResponse> get(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @PathVariable("key") String key) {
        return ResponseEntity.ok(PlatformSettingResponse.from(settings.get(PlatformSettingKey.fromKey(key))));
    }

    @PutMapping("/{key}")
    public ResponseEntity<PlatformSettingResponse> update(
            @RequestHeader(ADMIN_ID_HEADER) UUID adminId,
            @PathVariable("key") String key,
            @Valid @RequestBody UpdateSettingRequest request) {
        return ResponseEntity.ok(PlatformSettingResponse.from(settings.set(key, request.getValue(), adminId)));
    }
}
