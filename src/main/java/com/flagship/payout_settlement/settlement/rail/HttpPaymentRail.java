package com.flagship.payout_settlement.settlement.rail;

import com.flagship.payout_settlement.config.SettlementProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Payment rail reached over HTTP.
 *
 * POST {base-url}/payouts with an Idempotency-Key header, GET {base-url}/balance.
 * Error classification:
 * - HTTP 402 or code "insufficient_funds" is INSUFFICIENT_FUNDS
 * - code "amount_too_small" is BELOW_MINIMUM_AMOUNT
 * - anything else, including timeouts, is OTHER
 */
@Component
@ConditionalOnProperty(name = "settlement.rail.sandbox", havingValue = "false")
@Slf4j
public class HttpPaymentRail implements PaymentRail {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RestTemplate restTemplate;
    private final SettlementProperties.Rail config;

    public HttpPaymentRail(@Qualifier("railRestTemplate") RestTemplate restTemplate,
                           SettlementProperties properties) {
        this.restTemplate = restTemplate;
        this.config = properties.getRail();
    }

    @Override
    @SuppressWarnings("unchecked")
    public RailResult attempt(RailRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.add(IDEMPOTENCY_KEY_HEADER, request.getIdempotencyKey());
        if (config.getApiKey() != null) {
            headers.setBearerAuth(config.getApiKey());
        }

        Map<String, Object> body = new HashMap<>();
        body.put("reference", request.getPaymentId().toString());
        body.put("amount", request.getAmount());
        body.put("method", request.getMethod().name().toLowerCase(Locale.ROOT));
        body.put("destination", request.getDestination());

        try {
            Map<String, Object> response = restTemplate.postForObject(
                config.getBaseUrl() + "/payouts", new HttpEntity<>(body, headers), Map.class);

            if (response == null || response.get("transaction_id") == null) {
                log.error("Invalid response from payment rail: {}", response);
                return RailResult.failure(RailResult.Status.OTHER, "Payment rail returned no transaction id");
            }
            return RailResult.success(String.valueOf(response.get("transaction_id")));

        } catch (HttpClientErrorException e) {
            String code = errorCode(e);
            log.warn("Payment rail rejected payout: status={}, code={}", e.getStatusCode(), code);
            if (e.getStatusCode().value() == HttpStatus.PAYMENT_REQUIRED.value() || "insufficient_funds".equals(code)) {
                return RailResult.failure(RailResult.Status.INSUFFICIENT_FUNDS,
                    "Insufficient funds in the platform funding account");
            }
            if ("amount_too_small".equals(code)) {
                return RailResult.failure(RailResult.Status.BELOW_MINIMUM_AMOUNT,
                    "Amount is below the rail's minimum payout");
            }
            return RailResult.failure(RailResult.Status.OTHER, "Payment rail rejected payout: " + e.getStatusText());
        } catch (ResourceAccessException e) {
            log.error("Timeout or connection error reaching payment rail: {}", e.getMessage());
            return RailResult.failure(RailResult.Status.OTHER, "Payment rail timed out or is unreachable");
        } catch (RestClientException e) {
            log.error("Error calling payment rail: {}", e.getMessage());
            return RailResult.failure(RailResult.Status.OTHER, "Payment rail error: " + e.getMessage());
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<BigDecimal> availableBalance() {
        try {
            Map<String, Object> response = restTemplate.getForObject(config.getBaseUrl() + "/balance", Map.class);
            if (response == null || response.get("available") == null) {
                return Optional.empty();
            }
            return Optional.of(new BigDecimal(String.valueOf(response.get("available"))));
        } catch (RestClientException | NumberFormatException e) {
            log.warn("Could not read funding balance from payment rail: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String errorCode(HttpClientErrorException e) {
        String body = e.getResponseBodyAsString();
        if (body.contains("insufficient_funds")) {
            return "insufficient_funds";
        }
        if (body.contains("amount_too_small")) {
            return "amount_too_small";
        }
        return null;
    }
}
