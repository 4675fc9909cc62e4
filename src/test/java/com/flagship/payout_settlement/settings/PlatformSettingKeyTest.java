package com.flagship.payout_settlement.settings;

import com.flagship.payout_settlement.payment.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class PlatformSettingKeyTest {

    @Test
    @DisplayName("Money values are stored with two decimals")
    void moneyScale() {
        assertEquals("250.00", PlatformSettingKey.MINIMUM_OPERATING_BALANCE.normalise("250"));
        assertEquals("0.13", PlatformSettingKey.MINIMUM_OPERATING_BALANCE.normalise("0.125"));
    }

    @Test
    @DisplayName("Fee percentage is capped at 50, reserve at 100")
    void percentageRanges() {
        assertEquals("50", PlatformSettingKey.PLATFORM_FEE_PERCENTAGE.normalise("50"));
        assertThrows(ValidationException.class, () -> PlatformSettingKey.PLATFORM_FEE_PERCENTAGE.normalise("50.01"));
        assertEquals("100", PlatformSettingKey.PAYOUT_RESERVE_PERCENTAGE.normalise("100"));
        assertThrows(ValidationException.class, () -> PlatformSettingKey.PAYOUT_RESERVE_PERCENTAGE.normalise("101"));
        assertThrows(ValidationException.class, () -> PlatformSettingKey.PAYOUT_RESERVE_PERCENTAGE.normalise("abc"));
    }

    @Test
    @DisplayName("Booleans and emails are checked; an empty email clears the contact")
    void booleansAndEmails() {
        assertEquals("true", PlatformSettingKey.PAYMENT_AUTO_DISBURSE.normalise("TRUE"));
        assertEquals("", PlatformSettingKey.PAYMENT_ESCALATION_EMAIL.normalise(""));
        assertEquals("ops@example.com", PlatformSettingKey.PAYMENT_ESCALATION_EMAIL.normalise(" ops@example.com "));
        assertThrows(ValidationException.class, () -> PlatformSettingKey.PAYMENT_NOTIFICATION_EMAIL.normalise("not-an-email"));
        assertThrows(ValidationException.class, () -> PlatformSettingKey.PAYMENT_AUTO_DISBURSE.normalise(null));
    }

    @Test
    @DisplayName("Lookup by storage key")
    void fromKey() {
        assertEquals(PlatformSettingKey.PAYMENT_AUTO_DISBURSE, PlatformSettingKey.fromKey("payment_auto_disburse"));
        assertThrows(ValidationException.class, () -> PlatformSettingKey.fromKey("PAYMENT_AUTO_DISBURSE"));
    }

    @Test
    @DisplayName("Schedules: daily always, weekly on Mondays, monthly on the first")
    void scheduleDueDates() {
        LocalDate monday = LocalDate.of(2026, 10, 19);
        LocalDate tuesday = LocalDate.of(2026, 10, 20);
        LocalDate firstOfMonth = LocalDate.of(2026, 11, 1);

        assertTrue(SettlementSchedule.DAILY.isDue(tuesday));
        assertTrue(SettlementSchedule.WEEKLY.isDue(monday));
        assertFalse(SettlementSchedule.WEEKLY.isDue(tuesday));
        assertTrue(SettlementSchedule.MONTHLY.isDue(firstOfMonth));
        assertFalse(SettlementSchedule.MONTHLY.isDue(monday));
    }
}
