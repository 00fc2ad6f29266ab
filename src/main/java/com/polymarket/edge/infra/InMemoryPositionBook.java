package com.polymarket.edge.infra;

import com.polymarket.edge.domain.Position;
import com.polymarket.edge.domain.Side;
import com.polymarket.edge.domain.TradeResult;
import com.polymarket.edge.domain.event.StrategyEvent;
import com.polymarket.edge.domain.event.StrategyEventType;
import com.polymarket.edge.gateway.MarketDataSource;
import com.polymarket.edge.risk.PositionSource;
import com.polymarket.edge.risk.RiskManager;
import com.polymarket.edge.risk.StopLossConfig;
import com.polymarket.edge.risk.TakeProfitConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Net position per outcome token, built from executed fills. Opposite-side fills close
 * the position first (realizing P&L into the risk manager's daily figure) and only the
 * remainder opens a new one. Prices are marked to the live mid on every read.
 */
@Slf4j
public class InMemoryPositionBook implements PositionSource {

    private final Map<String, Position> byToken = new LinkedHashMap<>();
    private final MarketDataSource marketData;
    private final RiskManager riskManager;
    private final double defaultStopLossPercent;
    private final double defaultTakeProfitPercent;
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryPositionBook(MarketDataSource marketData, RiskManager riskManager, double defaultStopLossPercent,
            double defaultTakeProfitPercent) {
        this.marketData = marketData;
        this.riskManager = riskManager;
        this.defaultStopLossPercent = defaultStopLossPercent;
        this.defaultTakeProfitPercent = defaultTakeProfitPercent;
    }

    @EventListener
    public void onStrategyEvent(StrategyEvent event) {
        if (event.getType() == StrategyEventType.TRADE_EXECUTED && event.getPayload() instanceof TradeResult) {
            ((TradeResult) event.getPayload()).getFills().forEach(this::recordFill);
        }
    }

    public synchronized void recordFill(TradeResult.Fill fill) {
        Position current = byToken.get(fill.getTokenId());
        if (current == null) {
            open(fill.getMarketId(), fill.getTokenId(), fill.getSide(), fill.getSize(), fill.getPrice());
            return;
        }

        if (current.getSide() == fill.getSide()) {
            BigDecimal size = current.getSize().add(fill.getSize());
            BigDecimal cost = current.getEntryValue().add(fill.getSize().multiply(fill.getPrice()));
            current.setAvgEntryPrice(cost.divide(size, 6, RoundingMode.HALF_UP));
            current.setSize(size);
            current.setCurrentPrice(fill.getPrice());
            return;
        }

        BigDecimal closing = current.getSize().min(fill.getSize());
        BigDecimal move = fill.getPrice().subtract(current.getAvgEntryPrice());
        BigDecimal realized = (current.isLong() ? move : move.negate()).multiply(closing);
        current.setRealizedPnl(current.realizedPnlOrZero().add(realized));
        current.setSize(current.getSize().subtract(closing));
        current.setCurrentPrice(fill.getPrice());
        riskManager.updateDailyPnL(realized);
        log.info("[PositionBook] Closed {} of {} at {}, realized {}", closing, current.getId(), fill.getPrice(),
                realized);

        if (!current.isOpen()) {
            byToken.remove(fill.getTokenId());
            riskManager.removePositionRiskSettings(current.getId());
        }
        BigDecimal remainder = fill.getSize().subtract(closing);
        if (remainder.signum() > 0) {
            open(fill.getMarketId(), fill.getTokenId(), fill.getSide(), remainder, fill.getPrice());
        }
    }

    private void open(String marketId, String tokenId, Side side, BigDecimal size, BigDecimal price) {
        Position position = Position.builder()
                .id("pos_" + sequence.incrementAndGet())
                .marketId(marketId)
                .tokenId(tokenId)
                .side(side)
                .size(size)
                .avgEntryPrice(price)
                .currentPrice(price)
                .build();
        byToken.put(tokenId, position);
        if (defaultStopLossPercent > 0) {
            riskManager.setStopLoss(position.getId(), StopLossConfig.createPercentage(defaultStopLossPercent));
        }
        if (defaultTakeProfitPercent > 0) {
            riskManager.setTakeProfit(position.getId(), TakeProfitConfig.createPercentage(defaultTakeProfitPercent));
        }
        log.info("[PositionBook] Opened {} {} {} @ {}", position.getId(), side, size, price);
    }

    /** Copies with {@code currentPrice} refreshed from the market where available. */
    @Override
    public List<Position> getOpenPositions() {
        List<Position> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(byToken.values());
        }
        List<Position> result = new ArrayList<>(snapshot.size());
        for (Position position : snapshot) {
            Optional<BigDecimal> mid = Optional.empty();
            try {
                mid = marketData.getMidPrice(position.getTokenId());
            } catch (RuntimeException e) {
                log.warn("[PositionBook] Could not mark {}: {}", position.getId(), e.getMessage());
            }
            synchronized (this) {
                mid.ifPresent(position::setCurrentPrice);
                result.add(position.toBuilder().build());
            }
        }
        return result;
    }

    public synchronized Optional<Position> getByToken(String tokenId) {
        return Optional.ofNullable(byToken.get(tokenId)).map(p -> p.toBuilder().build());
    }

    public synchronized int size() {
        return byToken.size();
    }
}
