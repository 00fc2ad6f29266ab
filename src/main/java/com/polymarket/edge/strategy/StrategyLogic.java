package com.polymarket.edge.strategy;

import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.TradeResult;
import com.polymarket.edge.sizing.SizingRequest;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * What a concrete strategy supplies: detection ({@link #scan()}) and execution
 * ({@link #execute(Opportunity)}). Everything else has a default that
 * {@link StrategyRunner} relies on.
 * <p>
 * {@code execute} reports venue rejections through {@link TradeResult#failure(String)}
 * and owns the EXECUTING / EXECUTED / FAILED transitions of the opportunity.
 */
public interface StrategyLogic {

    String name();

    String type();

    StrategyParams params();

    List<Opportunity> scan();

    TradeResult execute(Opportunity opportunity);

    /**
     * Called right before execution; override to re-check live prices. {@code now} comes
     * from the runner's clock.
     */
    default boolean validateOpportunity(Opportunity opportunity, Instant now) {
        return opportunity.isValidAt(now);
    }

    /** Valid at {@code now} and profitable only, best expected profit first. Ties keep scan order. */
    default List<Opportunity> filterOpportunities(List<Opportunity> opportunities, Instant now) {
        return opportunities.stream()
                .filter(o -> o.isValidAt(now) && o.getExpectedProfit().signum() > 0)
                .sorted(Comparator.comparing(Opportunity::getExpectedProfit).reversed())
                .collect(Collectors.toList());
    }

    /**
     * Sizer input for one opportunity. Odds are left at 0 so the sizer derives them
     * from the unit price.
     */
    default SizingRequest sizingRequest(Opportunity opportunity) {
        StrategyParams p = params();
        return SizingRequest.builder()
                .capital(p.getDecimal(StrategyParams.AVAILABLE_CAPITAL, BigDecimal.valueOf(100)))
                .winProbability(opportunity.getConfidence())
                .odds(0)
                .price(opportunity.getUnitPrice())
                .maxFraction(p.getDouble(StrategyParams.MAX_POSITION_FRACTION, 0.25))
                .minSize(p.getDouble(StrategyParams.MIN_POSITION_SIZE, 1))
                .build();
    }

    /**
     * Rejects a parameter set before it replaces the live one. {@code candidate} is the
     * current params with the pending update applied.
     *
     * @throws IllegalArgumentException when the combination is not usable
     */
    default void checkParams(StrategyParams candidate) {
    }

    default void onStart() {
    }

    default void onStop() {
    }
}
