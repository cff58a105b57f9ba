package com.orderdesk.market;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderdesk.safety.IsoTimestamps;
import com.orderdesk.staleness.FieldSnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses bus and REST market payloads into typed values at the boundary.
 *
 * <p>Malformed input never throws. It yields an empty result or a snapshot without an
 * observation time, which every downstream freshness check treats as unusable.
 */
@Component
public class MarketPayloadParser {

    private static final Logger log = LoggerFactory.getLogger(MarketPayloadParser.class);

    private final ObjectMapper objectMapper;

    public MarketPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> readObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Unparsable bus payload: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    // ========================================================================
    // Price ticks
    // ========================================================================

    /**
     * Empty when the payload is not an object or carries no valid symbol. A tick with a bad
     * price is still returned (with null price and timestamp) so consumers can mark it stale.
     */
    public Optional<PriceTick> parsePriceTick(String raw) {
        Optional<JsonNode> root = readObject(raw);
        if (root.isEmpty()) {
            log.warn("Invalid price update payload");
            return Optional.empty();
        }
        JsonNode node = root.get();
        JsonNode symbolNode = node.get("symbol");
        Optional<String> symbol = symbolNode != null && symbolNode.isTextual()
                ? SymbolValidator.tryNormalize(symbolNode.asText())
                : Optional.empty();
        if (symbol.isEmpty()) {
            log.warn("Price update missing or invalid symbol: {}", symbolNode);
            return Optional.empty();
        }

        BigDecimal price = Decimals.parsePositive(node.get("price")).orElse(null);
        if (price == null) {
            log.warn("Invalid or non-finite price {} for {}", node.get("price"), symbol.get());
        }
        Instant timestamp = price == null ? null : IsoTimestamps.parse(text(node, "timestamp")).orElse(null);
        return Optional.of(new PriceTick(symbol.get(), price, timestamp, text(node, "eventType"), node));
    }

    // ========================================================================
    // Positions
    // ========================================================================

    public FieldSnapshot<PositionBook> parsePositions(String raw) {
        return readObject(raw).map(this::parsePositions).orElseGet(() -> {
            log.warn("Invalid position update payload, leaving positions stale");
            return FieldSnapshot.empty();
        });
    }

    /**
     * Reads {@code {positions: [...], timestamp}}. Any row with an invalid symbol or quantity
     * makes the whole book unusable. Without a top-level timestamp the newest row
     * {@code updatedAt} is used; without either the book has no observation time.
     */
    public FieldSnapshot<PositionBook> parsePositions(JsonNode root) {
        JsonNode positions = root.get("positions");
        if (positions == null || !positions.isArray()) {
            log.warn("Positions payload has no positions array");
            return FieldSnapshot.empty();
        }

        List<PositionEntry> entries = new ArrayList<>();
        Instant newestRow = null;
        for (JsonNode row : positions) {
            Optional<PositionEntry> entry = parsePositionRow(row);
            if (entry.isEmpty()) {
                return FieldSnapshot.empty();
            }
            entries.add(entry.get());
            Instant updatedAt = entry.get().updatedAt();
            if (updatedAt != null && (newestRow == null || updatedAt.isAfter(newestRow))) {
                newestRow = updatedAt;
            }
        }

        Instant observedAt;
        String timestamp = text(root, "timestamp");
        if (timestamp != null) {
            observedAt = IsoTimestamps.parse(timestamp).orElse(null);
            if (observedAt == null) {
                log.warn("Invalid timestamp in positions payload, leaving data stale");
            }
        } else {
            observedAt = newestRow;
            if (observedAt == null) {
                log.warn("Positions payload missing timestamp, leaving data stale");
            }
        }
        return FieldSnapshot.of(new PositionBook(entries), observedAt);
    }

    private Optional<PositionEntry> parsePositionRow(JsonNode row) {
        if (row == null || !row.isObject()) {
            log.warn("Position row is not an object");
            return Optional.empty();
        }
        Optional<String> symbol = SymbolValidator.tryNormalize(text(row, "symbol"));
        if (symbol.isEmpty()) {
            log.warn("Position row has invalid symbol: {}", row.get("symbol"));
            return Optional.empty();
        }
        Optional<BigDecimal> qty = Decimals.parse(first(row, "qty", "quantity"));
        if (qty.isEmpty()) {
            log.warn("Invalid qty in position row for {}: {}", symbol.get(), first(row, "qty", "quantity"));
            return Optional.empty();
        }
        BigDecimal currentPrice = Decimals.parse(first(row, "currentPrice", "current_price")).orElse(null);
        Instant updatedAt = IsoTimestamps.parse(textOf(first(row, "updatedAt", "updated_at"))).orElse(null);
        return Optional.of(new PositionEntry(symbol.get(), qty.get(), currentPrice, updatedAt));
    }

    // ========================================================================
    // Connection state
    // ========================================================================

    public ConnectionState parseConnectionState(String raw) {
        Optional<JsonNode> root = readObject(raw);
        if (root.isEmpty()) {
            log.warn("Invalid connection payload, treating as read-only");
            return ConnectionState.UNKNOWN;
        }
        ConnectionState state = ConnectionState.fromWire(text(root.get(), "state"));
        if (state == ConnectionState.UNKNOWN) {
            log.warn("Malformed connection state {}, treating as read-only", root.get().get("state"));
        }
        return state;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    static JsonNode first(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    static String text(JsonNode node, String field) {
        return textOf(node.get(field));
    }

    static String textOf(JsonNode value) {
        if (value == null || value.isNull() || !value.isTextual()) {
            return null;
        }
        return value.asText();
    }
}
