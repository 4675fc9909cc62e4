package com.flagship.payout_settlement.fee;

import com.flagship.payout_settlement.payment.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class FeeCalculatorTest {

    private final FeeCalculator calculator = new FeeCalculator();

    @Test
    @DisplayName("Default rate: $100.00 gross pays $4.00 platform, $3.00 processing, $93.00 net")
    void defaultRateOnRoundAmount() {
        FeeBreakdown fees = calculator.calculate(new BigDecimal("100.00"));

        assertEquals(new BigDecimal("4.00"), fees.getPlatformFeeAmount());
        assertEquals(new BigDecimal("3.00"), fees.getProcessingFeeAmount());
        assertEquals(new BigDecimal("93.00"), fees.getNetAmount());
        assertEquals(new BigDecimal("7.00"), fees.getTotalFees());
        assertFalse(fees.isRequiresReview());
    }

    @Test
    @DisplayName("Each fee is rounded half-up to the cent")
    void roundsEachFeeHalfUp() {
        FeeBreakdown fees = calculator.calculate(new BigDecimal("0.50"));

        // 0.02 platform, 0.015 processing rounds to 0.02
        assertEquals(new BigDecimal("0.02"), fees.getPlatformFeeAmount());
        assertEquals(new BigDecimal("0.02"), fees.getProcessingFeeAmount());
        assertEquals(new BigDecimal("0.46"), fees.getNetAmount());
    }

    @Test
    @DisplayName("A per-company rate replaces the default platform rate")
    void customRate() {
        FeeBreakdown fees = calculator.calculate(new BigDecimal("250.00"), new BigDecimal("0.10"));

        assertEquals(new BigDecimal("25.00"), fees.getPlatformFeeAmount());
        assertEquals(new BigDecimal("7.50"), fees.getProcessingFeeAmount());
        assertEquals(new BigDecimal("217.50"), fees.getNetAmount());
        assertEquals(new BigDecimal("0.10"), fees.getPlatformFeeRate());
    }

    @Test
    @DisplayName("A null rate falls back to 4%")
    void nullRateUsesDefault() {
        FeeBreakdown fees = calculator.calculate(new BigDecimal("50.00"), null);

        assertEquals(FeeCalculator.DEFAULT_PLATFORM_FEE_RATE, fees.getPlatformFeeRate());
        assertEquals(new BigDecimal("2.00"), fees.getPlatformFeeAmount());
    }

    @Test
    @DisplayName("Zero rate charges only processing")
    void zeroRate() {
        FeeBreakdown fees = calculator.calculate(new BigDecimal("10.00"), BigDecimal.ZERO);

        assertEquals(0, fees.getPlatformFeeAmount().signum());
        assertEquals(new BigDecimal("9.70"), fees.getNetAmount());
    }

    @ParameterizedTest
    @ValueSource(strings = {"0.00", "0.01", "0.33", "1.00", "19.99", "333.33", "1234.56", "99999.99"})
    @DisplayName("Net equals gross minus both fees, and is never negative")
    void netIsGrossMinusFees(String gross) {
        FeeBreakdown fees = calculator.calculate(new BigDecimal(gross), new BigDecimal("0.35"));

        BigDecimal expected = fees.getGrossAmount()
            .subtract(fees.getPlatformFeeAmount())
            .subtract(fees.getProcessingFeeAmount());
        assertTrue(expected.subtract(fees.getNetAmount()).abs().compareTo(new BigDecimal("0.01")) <= 0);
        assertTrue(fees.getNetAmount().signum() >= 0);
        assertEquals(2, fees.getNetAmount().scale());
    }

    @Test
    @DisplayName("Negative or missing gross is rejected")
    void rejectsInvalidGross() {
        assertThrows(ValidationException.class, () -> calculator.calculate(new BigDecimal("-0.01")));
        assertThrows(ValidationException.class, () -> calculator.calculate(null));
    }

    @Test
    @DisplayName("Rates outside 0-100% are rejected")
    void rejectsRateOutOfRange() {
        assertThrows(ValidationException.class,
            () -> calculator.calculate(new BigDecimal("100.00"), new BigDecimal("1.01")));
        assertThrows(ValidationException.class,
            () -> calculator.calculate(new BigDecimal("100.00"), new BigDecimal("-0.01")));
        assertDoesNotThrow(() -> FeeCalculator.validateRate(BigDecimal.ONE));
    }

    @Test
    @DisplayName("Fees above gross clamp net to zero and flag the breakdown for review")
    void clampsNetWhenFeesExceedGross() {
        FeeBreakdown fees = calculator.calculate(new BigDecimal("100.00"), new BigDecimal("0.98"));

        assertEquals(new BigDecimal("98.00"), fees.getPlatformFeeAmount());
        assertEquals(new BigDecimal("3.00"), fees.getProcessingFeeAmount());
        assertEquals(new BigDecimal("0.00"), fees.getNetAmount());
        assertTrue(fees.isRequiresReview());
    }

    @Test
    @DisplayName("Fees exactly equal to gross leave zero net without a review flag")
    void feesEqualToGrossDoNotClamp() {
        FeeBreakdown fees = calculator.calculate(new BigDecimal("100.00"), new BigDecimal("0.97"));

        assertEquals(new BigDecimal("0.00"), fees.getNetAmount());
        assertFalse(fees.isRequiresReview());
    }
}
