package com.flagship.payout_settlement.settings;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * How often automatic disbursement runs.
 */
public enum SettlementSchedule {
    DAILY,
    /** Mondays. */
    WEEKLY,
    /** First day of the month. */
    MONTHLY;

    public boolean isDue(LocalDate date) {
        return switch (this) {
            case DAILY -> true;
            case WEEKLY -> date.getDayOfWeek() == DayOfWeek.MONDAY;
            case MONTHLY -> date.getDayOfMonth() == 1;
        };
    }
}
