package com.flagship.payout_settlement.settings;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Typed access to admin-editable platform settings.
 *
 * Values are read at call time, so a change takes effect on the next settlement.
 * A stored value that no longer parses is logged and the key's default is used.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlatformSettingsStore {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final PlatformSettingRepository repository;

    /**
     * Default platform fee as a fraction (4% is 0.04).
     */
    public BigDecimal getPlatformFeeRate() {
        return decimal(PlatformSettingKey.PLATFORM_FEE_PERCENTAGE).divide(HUNDRED, 4, RoundingMode.HALF_UP);
    }

    /**
     * Reserve held back from the funding balance, as a fraction.
     */
    public BigDecimal getReserveRate() {
        return decimal(PlatformSettingKey.PAYOUT_RESERVE_PERCENTAGE).divide(HUNDRED, 4, RoundingMode.HALF_UP);
    }

    public BigDecimal getMinimumOperatingBalance() {
        return decimal(PlatformSettingKey.MINIMUM_OPERATING_BALANCE);
    }

    public boolean isAutoDisburseEnabled() {
        return Boolean.parseBoolean(raw(PlatformSettingKey.PAYMENT_AUTO_DISBURSE));
    }

    public SettlementSchedule getSettlementSchedule() {
        String value = raw(PlatformSettingKey.PAYMENT_SETTLEMENT_SCHEDULE);
        try {
            return SettlementSchedule.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid settlement schedule '{}', using default", value);
            return SettlementSchedule.valueOf(
                PlatformSettingKey.PAYMENT_SETTLEMENT_SCHEDULE.getDefaultValue().toUpperCase(Locale.ROOT));
        }
    }

    public Optional<String> getEscalationEmail() {
        String value = raw(PlatformSettingKey.PAYMENT_ESCALATION_EMAIL);
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    @Transactional(readOnly = true)
    public PlatformSetting get(PlatformSettingKey key) {
        return repository.findById(key.getKey())
            .map(PlatformSetting::from)
            .orElseGet(() -> PlatformSetting.defaultFor(key));
    }

    /**
     * All known settings, stored or defaulted, optionally limited to one category.
     */
    @Transactional(readOnly = true)
    public List<PlatformSetting> list(String category) {
        return Arrays.stream(PlatformSettingKey.values())
            .filter(key -> category == null || key.getCategory().equals(category))
            .map(this::get)
            .toList();
    }

    @Transactional
    public PlatformSetting set(String key, String value, UUID adminId) {
        PlatformSettingKey settingKey = PlatformSettingKey.fromKey(key);
        String normalised = settingKey.normalise(value);

        PlatformSettingEntity entity = repository.findById(settingKey.getKey())
            .orElseGet(() -> PlatformSettingEntity.create(settingKey, normalised, adminId));
        entity.update(normalised, adminId);
        PlatformSetting saved = PlatformSetting.from(repository.save(entity));

        log.info("Platform setting updated: key={}, value={}, adminId={}", settingKey.getKey(), normalised, adminId);
        return saved;
    }

    private BigDecimal decimal(PlatformSettingKey key) {
        String value = raw(key);
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' stored for {}, using default {}", value, key.getKey(), key.getDefaultValue());
            return new BigDecimal(key.getDefaultValue());
        }
    }

    private String raw(PlatformSettingKey key) {
        return repository.findById(key.getKey())
            .map(PlatformSettingEntity::getValue)
            .orElse(key.getDefaultValue());
    }
}
