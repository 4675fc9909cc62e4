package com.flagship.payout_settlement.notification;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Message sent on the escalations topic.
 */
@Value
public class Escalation {
    UUID escalationId;
    RecipientRole recipientRole;
    UUID recipientId;
    EscalationType type;
    UUID paymentId;
    Map<String, String> details;
    Instant occurredAt;
}
