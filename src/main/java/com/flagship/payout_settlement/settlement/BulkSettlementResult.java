package com.flagship.payout_settlement.settlement;

import lombok.Value;

import java.util.List;

/**
 * Per-item outcomes of a bulk settlement run. Conflicts count as failures.
 */
@Value
public class BulkSettlementResult {
    List<SettlementOutcome> outcomes;
    int succeeded;
    int failed;
    int total;

    public static BulkSettlementResult of(List<SettlementOutcome> outcomes) {
        int succeeded = (int) outcomes.stream().filter(SettlementOutcome::isSuccess).count();
        return new BulkSettlementResult(List.copyOf(outcomes), succeeded, outcomes.size() - succeeded, outcomes.size());
    }
}
