package com.orderdesk.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.orderdesk.exception.TransientIoException;
import com.orderdesk.market.Decimals;
import com.orderdesk.market.MarketPayloadParser;
import com.orderdesk.market.PositionBook;
import com.orderdesk.oms.RiskLimits;
import com.orderdesk.safety.IsoTimestamps;
import com.orderdesk.staleness.FieldSnapshot;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link TradingClient} over the execution gateway's HTTP API.
 *
 * <p>Idempotent reads are retried and guarded by the {@code tradingApi} circuit breaker.
 * Order submission is not retried here: the trader re-confirms, and the reused intent ID
 * lets the gateway deduplicate.
 *
 * <p>A missing or non-finite number, or a missing server
 * timestamp, produces an unusable snapshot rather than a default.
 */
@Component
public class HttpTradingClient implements TradingClient {

    private static final Logger log = LoggerFactory.getLogger(HttpTradingClient.class);

    static final String POSITIONS_PATH = "/api/v1/positions";
    static final String ACCOUNT_PATH = "/api/v1/account";
    static final String RISK_LIMITS_PATH = "/api/v1/risk/limits";
    static final String RECENT_FILLS_PATH = "/api/v1/orders/recent-fills";
    static final String ORDERS_PATH = "/api/v1/orders";

    /** Account timestamp fields in order of preference. */
    private static final String[] ACCOUNT_TIMESTAMP_FIELDS = {"timestamp", "last_equity_change", "updated_at", "as_of"};

    private final RestClient restClient;
    private final MarketPayloadParser payloadParser;

    public HttpTradingClient(
            @Qualifier("tradingApiRestClient") RestClient restClient, MarketPayloadParser payloadParser) {
        this.restClient = restClient;
        this.payloadParser = payloadParser;
    }

    @Override
    @CircuitBreaker(name = "tradingApi")
    @Retry(name = "tradingApi")
    public FieldSnapshot<PositionBook> fetchPositions(TraderIdentity identity) {
        JsonNode body = get(POSITIONS_PATH, identity);
        if (body == null || !body.isObject()) {
            log.warn("Positions response is not an object");
            return FieldSnapshot.empty();
        }
        return payloadParser.parsePositions(body);
    }

    @Override
    @CircuitBreaker(name = "tradingApi")
    @Retry(name = "tradingApi")
    public FieldSnapshot<BigDecimal> fetchBuyingPower(TraderIdentity identity) {
        JsonNode body = get(ACCOUNT_PATH, identity);
        if (body == null || !body.isObject()) {
            log.warn("Account response is not an object");
            return FieldSnapshot.empty();
        }
        Optional<BigDecimal> buyingPower = Decimals.parse(first(body, "buying_power", "buyingPower"));
        if (buyingPower.isEmpty()) {
            log.warn("Account response has missing or invalid buying_power: {}", body.get("buying_power"));
        }
        Instant observedAt = firstTimestamp(body, ACCOUNT_TIMESTAMP_FIELDS);
        if (observedAt == null) {
            log.warn("Account response has no server timestamp, buying power unusable");
        }
        return FieldSnapshot.of(buyingPower.orElse(null), observedAt);
    }

    @Override
    @CircuitBreaker(name = "tradingApi")
    @Retry(name = "tradingApi")
    public FieldSnapshot<RiskLimits> fetchRiskLimits(TraderIdentity identity) {
        JsonNode body = get(RISK_LIMITS_PATH, identity);
        if (body == null || !body.isObject()) {
            log.warn("Risk limits response is not an object");
            return FieldSnapshot.empty();
        }
        Instant observedAt = firstTimestamp(body, "timestamp", "updated_at");
        return FieldSnapshot.of(parseRiskLimits(body).orElse(null), observedAt);
    }

    @Override
    @CircuitBreaker(name = "tradingApi")
    @Retry(name = "tradingApi")
    public List<FillRecord> fetchRecentFills(TraderIdentity identity, int limit) {
        JsonNode body = get(RECENT_FILLS_PATH + "?limit=" + limit, identity);
        List<FillRecord> fills = new ArrayList<>();
        JsonNode rows = body != null ? body.get("fills") : null;
        if (rows == null || !rows.isArray()) {
            log.warn("Recent fills response has no fills array");
            return fills;
        }
        for (JsonNode row : rows) {
            Optional<BigDecimal> qty = Decimals.parse(row.get("qty"));
            Optional<BigDecimal> price = Decimals.parse(first(row, "price", "filled_avg_price"));
            if (!row.hasNonNull("symbol") || qty.isEmpty() || price.isEmpty()) {
                log.debug("Skipping malformed fill row: {}", row);
                continue;
            }
            fills.add(new FillRecord(
                    row.get("symbol").asText(),
                    row.path("side").asText(null),
                    qty.get(),
                    price.get(),
                    firstTimestamp(row, "filled_at", "timestamp"),
                    row.path("client_order_id").asText(null)));
        }
        return fills;
    }

    @Override
    @CircuitBreaker(name = "tradingApi")
    public SubmissionResponse submitOrder(TraderIdentity identity, OrderRequest request) {
        try {
            JsonNode body = restClient.post()
                    .uri(ORDERS_PATH)
                    .headers(headers -> applyIdentity(headers, identity))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request.toPayload())
                    .retrieve()
                    .body(JsonNode.class);
            if (body == null) {
                return new SubmissionResponse(null, request.clientOrderId(), "Empty response from gateway");
            }
            return new SubmissionResponse(
                    body.path("status").asText(null),
                    body.path("client_order_id").asText(request.clientOrderId()),
                    body.path("message").asText(null));
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().is4xxClientError()) {
                log.warn("Order {} rejected by gateway: {}", request.clientOrderId(), e.getStatusCode());
                return new SubmissionResponse("rejected", request.clientOrderId(), rejectionMessage(e));
            }
            throw new TransientIoException("Order submission failed: " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new TransientIoException("Order submission failed: " + e.getMessage(), e);
        }
    }

    // ========================================================================
    // Internal
    // ========================================================================

    private JsonNode get(String path, TraderIdentity identity) {
        try {
            return restClient.get()
                    .uri(path)
                    .headers(headers -> applyIdentity(headers, identity))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new TransientIoException("GET " + path + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Both per-symbol limits are required. A present but unparsable {@code max_total_exposure}
     * makes the whole snapshot unusable; an absent one means no exposure limit.
     */
    static Optional<RiskLimits> parseRiskLimits(JsonNode body) {
        Optional<BigDecimal> maxPosition = Decimals.parsePositive(first(body, "max_position_per_symbol", "maxPositionPerSymbol"));
        Optional<BigDecimal> maxNotional = Decimals.parsePositive(first(body, "max_notional_per_order", "maxNotionalPerOrder"));
        if (maxPosition.isEmpty() || maxNotional.isEmpty()) {
            log.warn("Risk limits response missing required limits");
            return Optional.empty();
        }
        JsonNode exposureNode = first(body, "max_total_exposure", "maxTotalExposure");
        BigDecimal maxTotalExposure = null;
        if (exposureNode != null) {
            Optional<BigDecimal> exposure = Decimals.parsePositive(exposureNode);
            if (exposure.isEmpty()) {
                log.warn("Invalid max_total_exposure {}, risk limits unusable", exposureNode);
                return Optional.empty();
            }
            maxTotalExposure = exposure.get();
        }
        return Optional.of(RiskLimits.builder()
                .maxPositionPerSymbol(maxPosition.get())
                .maxNotionalPerOrder(maxNotional.get())
                .maxTotalExposure(maxTotalExposure)
                .build());
    }

    private static void applyIdentity(HttpHeaders headers, TraderIdentity identity) {
        headers.set("X-User-Id", identity.userId());
        if (identity.role() != null) {
            headers.set("X-User-Role", identity.role());
        }
    }

    private static String rejectionMessage(RestClientResponseException e) {
        String body = e.getResponseBodyAsString();
        return body.isBlank() ? e.getStatusText() : body;
    }

    private static JsonNode first(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static Instant firstTimestamp(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual()) {
                Optional<Instant> parsed = IsoTimestamps.parse(value.asText());
                if (parsed.isPresent()) {
                    return parsed.get();
                }
            }
        }
        return null;
    }
}
