package com.flagship.payout_settlement.notification;

public enum RecipientRole {
    CREATOR,
    COMPANY,
    ADMIN
}
