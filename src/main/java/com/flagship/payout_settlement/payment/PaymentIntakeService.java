package com.flagship.payout_settlement.payment;

import com.flagship.payout_settlement.fee.FeeBreakdown;
import com.flagship.payout_settlement.fee.FeeCalculator;
import com.flagship.payout_settlement.payment.exception.ValidationException;
import com.flagship.payout_settlement.settings.PlatformSettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Creates pending payment records for eligible conversions.
 *
 * Fees are computed here, once, and never recomputed afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentIntakeService {

    private final FeeCalculator feeCalculator;
    private final PlatformSettingsStore settings;
    private final PaymentTransitionService transitions;

    public Payment record(RecordPaymentCommand command) {
        if (command.getCreatorId() == null || command.getCompanyId() == null) {
            throw new ValidationException("Creator and company are required");
        }

        BigDecimal rate = command.getPlatformFeeRate() != null
            ? command.getPlatformFeeRate()
            : settings.getPlatformFeeRate();
        FeeBreakdown fees = feeCalculator.calculate(command.getGrossAmount(), rate);

        if (fees.isRequiresReview()) {
            log.warn("Payment for creator {} flagged for review: fees {} exceed gross {}",
                command.getCreatorId(), fees.getTotalFees(), fees.getGrossAmount());
        }

        Payment payment = Payment.create(
            UUID.randomUUID(),
            command.getCreatorId(),
            command.getCompanyId(),
            command.getOfferId(),
            fees,
            command.getDescription()
        );

        Payment saved = transitions.record(payment);
        log.info("Recorded payment {}: gross={}, platformFee={}, processingFee={}, net={}",
            saved.getId(), fees.getGrossAmount(), fees.getPlatformFeeAmount(),
            fees.getProcessingFeeAmount(), fees.getNetAmount());
        return saved;
    }
}
