package com.orderdesk.unit.market;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderdesk.market.ConnectionState;
import com.orderdesk.market.MarketPayloadParser;
import com.orderdesk.market.PositionBook;
import com.orderdesk.market.PriceTick;
import com.orderdesk.staleness.FieldSnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Unit tests for MarketPayloadParser covering price ticks, position books and connection
 * state payloads, with emphasis on malformed input degrading to stale rather than throwing.
 */
class MarketPayloadParserTest {

    private final MarketPayloadParser parser = new MarketPayloadParser(new ObjectMapper());

    // ==============================
    // PRICE TICKS
    // ==============================

    @Nested
    @DisplayName("Price ticks")
    class PriceTicks {

        @Test
        @DisplayName("Well-formed tick is usable with normalized symbol")
        void wellFormedTick() {
            Optional<PriceTick> tick = parser.parsePriceTick(
                    "{\"symbol\":\"aapl\",\"price\":\"187.25\",\"timestamp\":\"2025-03-14T15:00:00Z\","
                            + "\"eventType\":\"trade\"}");

            assertThat(tick).isPresent();
            assertThat(tick.get().symbol()).isEqualTo("AAPL");
            assertThat(tick.get().price()).isEqualByComparingTo("187.25");
            assertThat(tick.get().timestamp()).isEqualTo(Instant.parse("2025-03-14T15:00:00Z"));
            assertThat(tick.get().eventType()).isEqualTo("trade");
            assertThat(tick.get().isUsable()).isTrue();
        }

        @Test
        @DisplayName("Numeric price is accepted")
        void numericPrice() {
            Optional<PriceTick> tick =
                    parser.parsePriceTick("{\"symbol\":\"MSFT\",\"price\":412.5,\"timestamp\":\"2025-03-14T15:00:00Z\"}");

            assertThat(tick.get().price()).isEqualByComparingTo("412.5");
        }

        @ParameterizedTest
        @ValueSource(strings = {"\"NaN\"", "\"Infinity\"", "-5", "0", "\"abc\"", "null"})
        @DisplayName("Invalid price yields an unusable tick without a timestamp")
        void invalidPriceIsUnusable(String price) {
            Optional<PriceTick> tick = parser.parsePriceTick(
                    "{\"symbol\":\"AAPL\",\"price\":" + price + ",\"timestamp\":\"2025-03-14T15:00:00Z\"}");

            assertThat(tick).isPresent();
            assertThat(tick.get().price()).isNull();
            assertThat(tick.get().timestamp()).isNull();
            assertThat(tick.get().isUsable()).isFalse();
        }

        @Test
        @DisplayName("Missing timestamp leaves the price but makes the tick unusable")
        void missingTimestamp() {
            Optional<PriceTick> tick = parser.parsePriceTick("{\"symbol\":\"AAPL\",\"price\":\"187.25\"}");

            assertThat(tick.get().price()).isNotNull();
            assertThat(tick.get().isUsable()).isFalse();
        }

        @ParameterizedTest
        @ValueSource(strings = {"not json", "[]", "{\"price\":\"1\"}", "{\"symbol\":\"BAD SYMBOL\",\"price\":\"1\"}",
                "{\"symbol\":12,\"price\":\"1\"}"})
        @DisplayName("Payload without a valid symbol is dropped")
        void droppedWithoutSymbol(String raw) {
            assertThat(parser.parsePriceTick(raw)).isEmpty();
        }
    }

    // ==============================
    // POSITIONS
    // ==============================

    @Nested
    @DisplayName("Positions")
    class Positions {

        @Test
        @DisplayName("Book with top-level timestamp parses every row")
        void wellFormedBook() {
            FieldSnapshot<PositionBook> snapshot = parser.parsePositions(
                    "{\"positions\":[{\"symbol\":\"AAPL\",\"qty\":\"100\",\"current_price\":\"150\"},"
                            + "{\"symbol\":\"TSLA\",\"qty\":-20,\"currentPrice\":\"200\"}],"
                            + "\"timestamp\":\"2025-03-14T15:00:00Z\"}");

            assertThat(snapshot.hasValue()).isTrue();
            assertThat(snapshot.observedAt()).isEqualTo(Instant.parse("2025-03-14T15:00:00Z"));
            PositionBook book = snapshot.value();
            assertThat(book.quantityOf("AAPL")).isEqualByComparingTo("100");
            assertThat(book.quantityOf("TSLA")).isEqualByComparingTo("-20");
            assertThat(book.totalExposure()).hasValueSatisfying(total ->
                    assertThat(total).isEqualByComparingTo("19000"));
        }

        @Test
        @DisplayName("Without a top-level timestamp the newest row timestamp is used")
        void newestRowTimestamp() {
            FieldSnapshot<PositionBook> snapshot = parser.parsePositions(
                    "{\"positions\":["
                            + "{\"symbol\":\"AAPL\",\"qty\":\"1\",\"updatedAt\":\"2025-03-14T14:00:00Z\"},"
                            + "{\"symbol\":\"MSFT\",\"qty\":\"1\",\"updated_at\":\"2025-03-14T14:30:00Z\"}]}");

            assertThat(snapshot.observedAt()).isEqualTo(Instant.parse("2025-03-14T14:30:00Z"));
        }

        @Test
        @DisplayName("Book without any timestamp has no observation time")
        void noTimestampIsStale() {
            FieldSnapshot<PositionBook> snapshot =
                    parser.parsePositions("{\"positions\":[{\"symbol\":\"AAPL\",\"qty\":\"1\"}]}");

            assertThat(snapshot.hasValue()).isTrue();
            assertThat(snapshot.observedAt()).isNull();
        }

        @Test
        @DisplayName("Invalid top-level timestamp is not replaced by row timestamps")
        void invalidTopLevelTimestamp() {
            FieldSnapshot<PositionBook> snapshot = parser.parsePositions(
                    "{\"positions\":[{\"symbol\":\"AAPL\",\"qty\":\"1\",\"updatedAt\":\"2025-03-14T14:00:00Z\"}],"
                            + "\"timestamp\":\"soon\"}");

            assertThat(snapshot.observedAt()).isNull();
        }

        @Test
        @DisplayName("One bad row makes the whole book unusable")
        void badRowRejectsBook() {
            FieldSnapshot<PositionBook> snapshot = parser.parsePositions(
                    "{\"positions\":[{\"symbol\":\"AAPL\",\"qty\":\"1\"},{\"symbol\":\"MSFT\",\"qty\":\"lots\"}],"
                            + "\"timestamp\":\"2025-03-14T15:00:00Z\"}");

            assertThat(snapshot.hasValue()).isFalse();
        }

        @Test
        @DisplayName("Empty positions array is a valid flat book")
        void emptyBook() {
            FieldSnapshot<PositionBook> snapshot =
                    parser.parsePositions("{\"positions\":[],\"timestamp\":\"2025-03-14T15:00:00Z\"}");

            assertThat(snapshot.hasValue()).isTrue();
            assertThat(snapshot.value().entries()).isEmpty();
            assertThat(snapshot.value().totalExposure()).contains(BigDecimal.ZERO);
        }

        @Test
        @DisplayName("Non-object payload yields an empty snapshot")
        void garbage() {
            assertThat(parser.parsePositions("oops").hasValue()).isFalse();
            assertThat(parser.parsePositions("{\"positions\":{}}").hasValue()).isFalse();
        }
    }

    // ==============================
    // CONNECTION STATE
    // ==============================

    @Nested
    @DisplayName("Connection state")
    class Connection {

        @Test
        @DisplayName("Known states are parsed case-insensitively")
        void knownStates() {
            assertThat(parser.parseConnectionState("{\"state\":\"connected\"}")).isEqualTo(ConnectionState.CONNECTED);
            assertThat(parser.parseConnectionState("{\"state\":\"DEGRADED\"}")).isEqualTo(ConnectionState.DEGRADED);
        }

        @Test
        @DisplayName("Unknown or malformed state is read-only")
        void unknownIsReadOnly() {
            ConnectionState state = parser.parseConnectionState("{\"state\":\"FLAPPING\"}");

            assertThat(state).isEqualTo(ConnectionState.UNKNOWN);
            assertThat(state.isReadWrite()).isFalse();
            assertThat(parser.parseConnectionState("[]")).isEqualTo(ConnectionState.UNKNOWN);
        }
    }
}
