package com.flagship.payout_settlement.notification;

import java.util.Map;
import java.util.UUID;

/**
 * Fire-and-forget notifications to the people who must act on a payout.
 *
 * Implementations must never throw: a failed notification is logged and
 * must not affect the settlement or dispute that triggered it.
 */
public interface EscalationDispatcher {

    /**
     * @param recipientRole who should act
     * @param recipientId the creator or company ID, null for the admin team
     */
    void notify(RecipientRole recipientRole, UUID recipientId, EscalationType type,
                UUID paymentId, Map<String, String> details);
}
