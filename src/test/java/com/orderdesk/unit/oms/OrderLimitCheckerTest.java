package com.orderdesk.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.orderdesk.market.PositionBook;
import com.orderdesk.market.PositionEntry;
import com.orderdesk.oms.ExposureCalculator;
import com.orderdesk.oms.OrderBlock;
import com.orderdesk.oms.OrderForm;
import com.orderdesk.oms.OrderLimitChecker;
import com.orderdesk.oms.OrderSide;
import com.orderdesk.oms.OrderType;
import com.orderdesk.oms.RiskLimits;
import com.orderdesk.oms.TimeInForce;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for OrderLimitChecker and ExposureCalculator: per-symbol position, per-order
 * notional and portfolio exposure limits.
 */
class OrderLimitCheckerTest {

    private static final BigDecimal PRICE = new BigDecimal("100");

    private static OrderForm form(OrderSide side, String qty) {
        return OrderForm.builder()
                .symbol("AAPL")
                .side(side)
                .quantity(new BigDecimal(qty))
                .orderType(OrderType.MARKET)
                .timeInForce(TimeInForce.DAY)
                .build();
    }

    private static RiskLimits limits(String maxPosition, String maxNotional, String maxExposure) {
        return RiskLimits.builder()
                .maxPositionPerSymbol(new BigDecimal(maxPosition))
                .maxNotionalPerOrder(new BigDecimal(maxNotional))
                .maxTotalExposure(maxExposure == null ? null : new BigDecimal(maxExposure))
                .build();
    }

    private static PositionBook book(PositionEntry... entries) {
        return new PositionBook(List.of(entries));
    }

    private static PositionEntry row(String symbol, String qty, String price) {
        return new PositionEntry(symbol, new BigDecimal(qty), price == null ? null : new BigDecimal(price), null);
    }

    // ==============================
    // POSITION LIMIT
    // ==============================

    @Nested
    @DisplayName("Position limit")
    class PositionLimit {

        @Test
        @DisplayName("Buy that lands exactly on the limit passes")
        void atLimitPasses() {
            Optional<OrderBlock> block = OrderLimitChecker.check(
                    form(OrderSide.BUY, "100"), book(row("AAPL", "400", "100")), limits("500", "1000000", null), PRICE);

            assertThat(block).isEmpty();
        }

        @Test
        @DisplayName("Buy that would exceed the limit is blocked")
        void overLimitBlocked() {
            Optional<OrderBlock> block = OrderLimitChecker.check(
                    form(OrderSide.BUY, "101"), book(row("AAPL", "400", "100")), limits("500", "1000000", null), PRICE);

            assertThat(block).isPresent();
            assertThat(block.get().getCode()).isEqualTo("POSITION_LIMIT_EXCEEDED");
            assertThat(block.get().getMessage()).isEqualTo("Order exceeds position limit (500 shares)");
        }

        @Test
        @DisplayName("Short position is limited by its absolute size")
        void shortPositionLimited() {
            Optional<OrderBlock> block = OrderLimitChecker.check(
                    form(OrderSide.SELL, "200"), book(row("AAPL", "-400", "100")), limits("500", "1000000", null), PRICE);

            assertThat(block).map(OrderBlock::getCode).contains("POSITION_LIMIT_EXCEEDED");
        }

        @Test
        @DisplayName("Sell that reduces a long position passes")
        void reducingSellPasses() {
            Optional<OrderBlock> block = OrderLimitChecker.check(
                    form(OrderSide.SELL, "300"), book(row("AAPL", "600", "100")), limits("500", "1000000", null), PRICE);

            assertThat(block).isEmpty();
        }
    }

    // ==============================
    // NOTIONAL LIMIT
    // ==============================

    @Nested
    @DisplayName("Notional limit")
    class NotionalLimit {

        @Test
        @DisplayName("Order above max notional is blocked with a formatted limit")
        void overNotional() {
            Optional<OrderBlock> block = OrderLimitChecker.check(
                    form(OrderSide.BUY, "300"), PositionBook.empty(), limits("1000", "25000", null), PRICE);

            assertThat(block).isPresent();
            assertThat(block.get().getCode()).isEqualTo("NOTIONAL_LIMIT_EXCEEDED");
            assertThat(block.get().getMessage()).isEqualTo("Order exceeds max notional ($25,000)");
        }
    }

    // ==============================
    // EXPOSURE LIMIT
    // ==============================

    @Nested
    @DisplayName("Exposure limit")
    class ExposureLimit {

        @Test
        @DisplayName("Projected exposure matches a from-scratch sum of the updated book")
        void projectionMatchesRecomputedBook() {
            PositionBook current = book(row("AAPL", "50", "100"), row("MSFT", "-20", "400"));
            BigDecimal proposed = ExposureCalculator.proposedPosition(new BigDecimal("50"), OrderSide.SELL, new BigDecimal("80"));

            BigDecimal projected = ExposureCalculator.projectedExposure(
                    current.totalExposure().orElseThrow(),
                    current.symbolNotional("AAPL").orElseThrow(),
                    proposed,
                    PRICE);

            BigDecimal recomputed = current.withPosition("AAPL", proposed, PRICE).totalExposure().orElseThrow();
            assertThat(projected).isEqualByComparingTo(recomputed);
            assertThat(projected).isEqualByComparingTo("11000");
        }

        @Test
        @DisplayName("Order that pushes exposure over the limit is blocked")
        void overExposure() {
            Optional<OrderBlock> block = OrderLimitChecker.check(
                    form(OrderSide.BUY, "100"),
                    book(row("MSFT", "100", "450")),
                    limits("1000", "1000000", "50000"),
                    PRICE);

            assertThat(block).isPresent();
            assertThat(block.get().getCode()).isEqualTo("EXPOSURE_LIMIT_EXCEEDED");
            assertThat(block.get().getMessage()).isEqualTo("Order exceeds total exposure limit ($50,000)");
        }

        @Test
        @DisplayName("Closing part of a position lowers exposure and passes")
        void reducingExposurePasses() {
            Optional<OrderBlock> block = OrderLimitChecker.check(
                    form(OrderSide.SELL, "100"),
                    book(row("AAPL", "600", "100")),
                    limits("1000", "1000000", "55000"),
                    PRICE);

            assertThat(block).isEmpty();
        }

        @Test
        @DisplayName("Row without a price makes exposure unverifiable")
        void missingPriceBlocks() {
            Optional<OrderBlock> block = OrderLimitChecker.check(
                    form(OrderSide.BUY, "1"),
                    book(row("MSFT", "10", null)),
                    limits("1000", "1000000", "50000"),
                    PRICE);

            assertThat(block).map(OrderBlock::getCode).contains("EXPOSURE_UNVERIFIED");
        }

        @Test
        @DisplayName("No configured exposure limit skips the exposure check")
        void noExposureLimit() {
            Optional<OrderBlock> block = OrderLimitChecker.check(
                    form(OrderSide.BUY, "1"), book(row("MSFT", "10", null)), limits("1000", "1000000", null), PRICE);

            assertThat(block).isEmpty();
        }
    }
}
