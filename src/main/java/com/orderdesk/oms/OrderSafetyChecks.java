package com.orderdesk.oms;

import com.orderdesk.market.PositionBook;
import com.orderdesk.safety.SafetyState;
import com.orderdesk.safety.SafetyStatus;
import com.orderdesk.staleness.DataField;
import com.orderdesk.staleness.StalenessPolicy;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * The order-entry check sequence, in one place.
 *
 * <p>{@link #evaluate} is run at preview (cached inputs) and again at confirm (fresh
 * inputs). {@link #finalCheck} runs immediately before the order is sent. Any missing,
 * stale or unverifiable input blocks; nothing is defaulted.
 *
 * <p>Order of checks:
 * <ol>
 *   <li>safety state loaded</li>
 *   <li>connection read-write</li>
 *   <li>kill switch SAFE</li>
 *   <li>circuit breaker SAFE</li>
 *   <li>ticket fields and per-type prices</li>
 *   <li>position, price and buying power fresh</li>
 *   <li>risk limits present and fresh</li>
 *   <li>effective price available</li>
 *   <li>position, notional and exposure limits</li>
 *   <li>opening notional within buying power</li>
 * </ol>
 */
public class OrderSafetyChecks {

    private final StalenessPolicy stalenessPolicy;

    public OrderSafetyChecks(StalenessPolicy stalenessPolicy) {
        this.stalenessPolicy = stalenessPolicy;
    }

    public OrderCheckResult evaluate(OrderCheckInput input, Instant now) {
        // Step 1-4: trading gates
        Optional<OrderBlock> gate = checkGates(
                input.isSafetyInitialized(), input.isConnectionReadWrite(), input.getKillSwitch(), input.getCircuitBreaker());
        if (gate.isPresent()) {
            return OrderCheckResult.blocked(gate.get());
        }

        // Step 5: ticket
        OrderForm form = input.getForm();
        Optional<OrderBlock> invalid = OrderFormValidator.validate(form);
        if (invalid.isPresent()) {
            return OrderCheckResult.blocked(invalid.get());
        }

        // Step 6: data freshness
        if (!stalenessPolicy.isUsable(DataField.POSITION, input.getPositions(), now)) {
            return blocked("POSITION_STALE", "Position data stale");
        }
        if (!stalenessPolicy.isUsable(DataField.PRICE, input.getLastPrice(), now)) {
            return blocked("PRICE_STALE", "Price data stale");
        }
        if (!stalenessPolicy.isUsable(DataField.BUYING_POWER, input.getBuyingPower(), now)) {
            return blocked("BUYING_POWER_STALE", "Buying power data stale");
        }

        // Step 7: risk limits
        if (input.getRiskLimits() == null || !input.getRiskLimits().hasValue()) {
            return blocked("RISK_LIMITS_UNAVAILABLE", "Risk limits unavailable");
        }
        if (!stalenessPolicy.isFresh(DataField.RISK_LIMITS, input.getRiskLimits(), now)) {
            return blocked("RISK_LIMITS_STALE", "Risk limits stale");
        }

        // Step 8: effective price
        Optional<BigDecimal> effectivePrice =
                EffectivePriceCalculator.effectivePrice(form, input.getLastPrice().value());
        if (effectivePrice.isEmpty()) {
            return blocked("PRICE_UNAVAILABLE", "Cannot determine order price");
        }

        // Step 9: limits
        PositionBook positions = input.getPositions().value();
        Optional<OrderBlock> limitBlock =
                OrderLimitChecker.check(form, positions, input.getRiskLimits().value(), effectivePrice.get());
        if (limitBlock.isPresent()) {
            return OrderCheckResult.blocked(limitBlock.get());
        }

        // Step 10: buying power, charged only for shares that open or add to a position
        BigDecimal notional = form.quantity().multiply(effectivePrice.get());
        BigDecimal openingNotional = ExposureCalculator.openingQuantity(
                        positions.quantityOf(form.symbol()), form.side(), form.quantity())
                .multiply(effectivePrice.get());
        BigDecimal buyingPower = input.getBuyingPower().value();
        if (openingNotional.compareTo(buyingPower) > 0) {
            return blocked("INSUFFICIENT_BUYING_POWER", "Order value exceeds available buying power");
        }
        return OrderCheckResult.passed(effectivePrice.get(), BuyingPowerImpact.of(notional, buyingPower));
    }

    /** Kill switch, circuit breaker and connection, checked right before dispatch. */
    public Optional<OrderBlock> finalCheck(SafetyState killSwitch, SafetyState circuitBreaker, boolean connectionReadWrite) {
        Optional<OrderBlock> safety = checkSwitch(killSwitch);
        if (safety.isPresent()) {
            return safety;
        }
        safety = checkSwitch(circuitBreaker);
        if (safety.isPresent()) {
            return safety;
        }
        if (!connectionReadWrite) {
            return Optional.of(OrderBlock.safety("CONNECTION_LOST", "Connection lost"));
        }
        return Optional.empty();
    }

    private Optional<OrderBlock> checkGates(
            boolean safetyInitialized, boolean connectionReadWrite, SafetyState killSwitch, SafetyState circuitBreaker) {
        if (!safetyInitialized) {
            return Optional.of(OrderBlock.safety("SAFETY_STATE_LOADING", "Safety state loading..."));
        }
        if (!connectionReadWrite) {
            return Optional.of(OrderBlock.safety("CONNECTION_UNAVAILABLE", "Connection unavailable"));
        }
        Optional<OrderBlock> safety = checkSwitch(killSwitch);
        if (safety.isPresent()) {
            return safety;
        }
        return checkSwitch(circuitBreaker);
    }

    static Optional<OrderBlock> checkSwitch(SafetyState state) {
        if (state == null) {
            return Optional.of(OrderBlock.safety("SAFETY_STATE_LOADING", "Safety state loading..."));
        }
        if (state.getStatus() == SafetyStatus.SAFE) {
            return Optional.empty();
        }
        String code = state.isVerified()
                ? state.getSafetySwitch().blockedCode()
                : state.getSafetySwitch().unverifiedCode();
        return Optional.of(OrderBlock.safety(code, state.describe()));
    }

    private static OrderCheckResult blocked(String code, String message) {
        return OrderCheckResult.blocked(OrderBlock.validation(code, message));
    }
}
