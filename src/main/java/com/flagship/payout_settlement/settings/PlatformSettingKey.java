package com.flagship.payout_settlement.settings;

import com.flagship.payout_settlement.payment.exception.ValidationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Known platform settings, with their storage key, value type and default.
 */
@Getter
@RequiredArgsConstructor
public enum PlatformSettingKey {
    PLATFORM_FEE_PERCENTAGE("platform_fee_percentage", ValueType.FEE_PERCENTAGE, "4",
        "fees", "Default platform fee charged on gross earnings (percent)"),
    PAYOUT_RESERVE_PERCENTAGE("payout_reserve_percentage", ValueType.PERCENTAGE, "0",
        "payments", "Share of the funding balance held back from payouts (percent)"),
    MINIMUM_OPERATING_BALANCE("minimum_operating_balance", ValueType.MONEY, "0.00",
        "payments", "Balance that must remain in the funding account after payouts"),
    PAYMENT_SETTLEMENT_SCHEDULE("payment_settlement_schedule", ValueType.SCHEDULE, "weekly",
        "payments", "Automatic disbursement schedule: daily, weekly or monthly"),
    PAYMENT_AUTO_DISBURSE("payment_auto_disburse", ValueType.BOOLEAN, "false",
        "payments", "Settle approved payments automatically on schedule"),
    PAYMENT_NOTIFICATION_EMAIL("payment_notification_email", ValueType.EMAIL, "",
        "notifications", "Address notified of payout activity"),
    PAYMENT_ESCALATION_EMAIL("payment_escalation_email", ValueType.EMAIL, "",
        "notifications", "Address notified of failed or blocked payouts");

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final BigDecimal MAX_FEE_PERCENT = new BigDecimal("50");

    private final String key;
    private final ValueType type;
    private final String defaultValue;
    private final String category;
    private final String description;

    public enum ValueType {
        PERCENTAGE, FEE_PERCENTAGE, MONEY, BOOLEAN, SCHEDULE, EMAIL
    }

    public static PlatformSettingKey fromKey(String key) {
        return Arrays.stream(values())
            .filter(k -> k.key.equals(key))
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unknown platform setting: " + key));
    }

    /**
     * Validates and normalises a raw value for this key.
     *
     * @return the value to store
     * @throws ValidationException if the value is not valid for this key
     */
    public String normalise(String raw) {
        if (raw == null) {
            throw new ValidationException("Value for " + key + " is required");
        }
        String value = raw.trim();
        return switch (type) {
            case PERCENTAGE -> decimalInRange(value, HUNDRED).toPlainString();
            case FEE_PERCENTAGE -> decimalInRange(value, MAX_FEE_PERCENT).toPlainString();
            case MONEY -> decimalInRange(value, null).setScale(2, RoundingMode.HALF_UP).toPlainString();
            case BOOLEAN -> {
                if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
                    throw new ValidationException(key + " must be true or false");
                }
                yield value.toLowerCase(Locale.ROOT);
            }
            case SCHEDULE -> {
                try {
                    yield SettlementSchedule.valueOf(value.toUpperCase(Locale.ROOT)).name().toLowerCase(Locale.ROOT);
                } catch (IllegalArgumentException e) {
                    throw new ValidationException(key + " must be one of daily, weekly, monthly");
                }
            }
            case EMAIL -> {
                if (!value.isEmpty() && !EMAIL.matcher(value).matches()) {
                    throw new ValidationException(key + " must be a valid email address");
                }
                yield value;
            }
        };
    }

    private BigDecimal decimalInRange(String value, BigDecimal max) {
        BigDecimal number;
        try {
            number = new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(key + " must be a number, got '" + value + "'");
        }
        if (number.signum() < 0) {
            throw new ValidationException(key + " cannot be negative");
        }
        if (max != null && number.compareTo(max) > 0) {
            throw new ValidationException(key + " cannot exceed " + max);
        }
        return number;
    }
}
