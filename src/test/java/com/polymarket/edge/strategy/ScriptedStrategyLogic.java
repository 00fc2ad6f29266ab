package com.polymarket.edge.strategy;

import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.TradeResult;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Strategy logic driven by the test: returns whatever the supplier yields and executes
 * by recording the id, unless told to fail.
 */
class ScriptedStrategyLogic implements StrategyLogic {

    private final String name;
    private final StrategyParams params = new StrategyParams();
    final List<String> executed = new CopyOnWriteArrayList<>();
    final Set<String> throwOn = new HashSet<>();
    final Set<String> rejectOn = new HashSet<>();
    final Set<String> invalid = new HashSet<>();
    Supplier<List<Opportunity>> scanner = List::of;

    ScriptedStrategyLogic(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String type() {
        return "test";
    }

    @Override
    public StrategyParams params() {
        return params;
    }

    @Override
    public List<Opportunity> scan() {
        return scanner.get();
    }

    @Override
    public TradeResult execute(Opportunity opportunity) {
        if (throwOn.contains(opportunity.getId())) {
            throw new IllegalStateException("venue down for " + opportunity.getId());
        }
        if (rejectOn.contains(opportunity.getId())) {
            opportunity.markFailed();
            return TradeResult.failure("rejected");
        }
        opportunity.markExecuted();
        executed.add(opportunity.getId());
        return TradeResult.success(List.of(), opportunity.getExpectedProfit());
    }

    @Override
    public boolean validateOpportunity(Opportunity opportunity, Instant now) {
        return !invalid.contains(opportunity.getId()) && StrategyLogic.super.validateOpportunity(opportunity, now);
    }

    @Override
    public void checkParams(StrategyParams candidate) {
        if (candidate.getDouble("threshold", 0) < 0) {
            throw new IllegalArgumentException("threshold must be >= 0");
        }
    }

    /** Cross-market opportunities with strictly decreasing profit, so filtering keeps the order. */
    static List<Opportunity> opportunities(int count) {
        List<Opportunity> list = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            list.add(Opportunity.crossMarket("m" + i, "yes" + i, "no" + i, new BigDecimal("0.45"),
                    new BigDecimal("0.50"), BigDecimal.valueOf(100L * (count - i)), Duration.ofMinutes(1)));
        }
        return list;
    }
}
