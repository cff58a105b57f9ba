package com.orderdesk.oms;

import com.orderdesk.market.PositionBook;
import com.orderdesk.market.PriceTick;
import com.orderdesk.staleness.FieldSnapshot;
import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Latest observed safety-relevant data for one session. Written by bus handlers and refresh
 * tasks, read by the preview check. Every value carries its server observation time.
 */
public class TradingDataCache {

    private final AtomicReference<FieldSnapshot<PositionBook>> positions =
            new AtomicReference<>(FieldSnapshot.empty());
    private final AtomicReference<PriceTick> lastTick = new AtomicReference<>();
    private final AtomicReference<FieldSnapshot<BigDecimal>> buyingPower =
            new AtomicReference<>(FieldSnapshot.empty());
    private final AtomicReference<FieldSnapshot<RiskLimits>> riskLimits =
            new AtomicReference<>(FieldSnapshot.empty());

    public void updatePositions(FieldSnapshot<PositionBook> snapshot) {
        positions.set(snapshot);
    }

    public FieldSnapshot<PositionBook> positions() {
        return positions.get();
    }

    public void updatePrice(PriceTick tick) {
        lastTick.set(tick);
    }

    public void clearPrice() {
        lastTick.set(null);
    }

    /** Last price for {@code symbol}, empty if the latest tick is for another symbol or unusable. */
    public FieldSnapshot<BigDecimal> priceFor(String symbol) {
        PriceTick tick = lastTick.get();
        if (tick == null || symbol == null || !tick.symbol().equals(symbol)) {
            return FieldSnapshot.empty();
        }
        return FieldSnapshot.of(tick.price(), tick.timestamp());
    }

    public void updateBuyingPower(FieldSnapshot<BigDecimal> snapshot) {
        buyingPower.set(snapshot);
    }

    public FieldSnapshot<BigDecimal> buyingPower() {
        return buyingPower.get();
    }

    public void updateRiskLimits(FieldSnapshot<RiskLimits> snapshot) {
        riskLimits.set(snapshot);
    }

    public FieldSnapshot<RiskLimits> riskLimits() {
        return riskLimits.get();
    }
}
