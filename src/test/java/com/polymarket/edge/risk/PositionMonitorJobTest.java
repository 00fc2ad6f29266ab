package com.polymarket.edge.risk;

import com.polymarket.edge.domain.Position;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

class PositionMonitorJobTest {

    @Test
    void testEvaluatesOpenPositions() {
        RiskManager riskManager = spy(new RiskManager());
        PositionSource source = mock(PositionSource.class);
        Position position = RiskManagerTest.position("p1", "m1", "100", "0.50", "0.55");
        when(source.getOpenPositions()).thenReturn(List.of(position));

        new PositionMonitorJob(riskManager, source).monitor();

        verify(riskManager).evaluateAllPositions(List.of(position));
        assertTrue(riskManager.getLastMetrics().isPresent());
        assertEquals(1, riskManager.getLastMetrics().get().getPositionCount());
    }

    @Test
    void testSkipsWhenFlat() {
        RiskManager riskManager = mock(RiskManager.class);
        PositionSource source = mock(PositionSource.class);
        when(source.getOpenPositions()).thenReturn(List.of());

        new PositionMonitorJob(riskManager, source).monitor();

        verify(riskManager, never()).evaluateAllPositions(anyCollection());
    }

    @Test
    void testSourceFailureIsContained() {
        RiskManager riskManager = mock(RiskManager.class);
        PositionSource source = mock(PositionSource.class);
        when(source.getOpenPositions()).thenThrow(new IllegalStateException("book unavailable"));

        assertDoesNotThrow(() -> new PositionMonitorJob(riskManager, source).monitor());
    }
}
