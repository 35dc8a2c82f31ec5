package com.trust.network.metrics;

import com.trust.network.selection.OptimizationProblem;
import com.trust.network.selection.SelectionMethod;
import com.trust.network.solver.SolverStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordSelectionDuration(OptimizationProblem.SENTINEL, SelectionMethod.EXACT, Duration.ofMillis(5));
                noOp.recordObjective(OptimizationProblem.MAINTENANCE, SelectionMethod.APPROXIMATE, 12.5);
                noOp.incrementFallback(OptimizationProblem.SENTINEL, SolverStatus.TIMEOUT);
                noOp.incrementSkippedRecords(3);
                noOp.recordNetworkSize(10, 20);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record selection duration per problem and method")
        void recordSelectionDuration() {
            metrics.recordSelectionDuration(OptimizationProblem.SENTINEL, SelectionMethod.GREEDY, Duration.ofMillis(150));
            metrics.recordSelectionDuration(OptimizationProblem.SENTINEL, SelectionMethod.GREEDY, Duration.ofMillis(250));
            metrics.recordSelectionDuration(OptimizationProblem.MAINTENANCE, SelectionMethod.EXACT, Duration.ofMillis(10));

            Timer timer = registry.find("optimizer.selection.duration")
                    .tag("problem", "SENTINEL")
                    .tag("method", "GREEDY")
                    .timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should record objective values as a distribution summary")
        void recordObjective() {
            metrics.recordObjective(OptimizationProblem.SENTINEL, SelectionMethod.EXACT, 6);
            metrics.recordObjective(OptimizationProblem.SENTINEL, SelectionMethod.EXACT, 8);

            DistributionSummary summary = registry.find("optimizer.selection.objective")
                    .tag("problem", "SENTINEL")
                    .tag("method", "EXACT")
                    .summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(14.0, summary.totalAmount(), 0.001);
        }

        @Test
        @DisplayName("Should count fallbacks per problem and reason")
        void incrementFallback() {
            metrics.incrementFallback(OptimizationProblem.MAINTENANCE, SolverStatus.TIMEOUT);
            metrics.incrementFallback(OptimizationProblem.MAINTENANCE, SolverStatus.TIMEOUT);
            metrics.incrementFallback(OptimizationProblem.SENTINEL, SolverStatus.UNAVAILABLE);

            Counter timeouts = registry.find("optimizer.solver.fallback")
                    .tag("problem", "MAINTENANCE")
                    .tag("reason", "TIMEOUT")
                    .counter();
            Counter unavailable = registry.find("optimizer.solver.fallback")
                    .tag("problem", "SENTINEL")
                    .tag("reason", "UNAVAILABLE")
                    .counter();

            assertNotNull(timeouts);
            assertEquals(2.0, timeouts.count());
            assertNotNull(unavailable);
            assertEquals(1.0, unavailable.count());
        }

        @Test
        @DisplayName("Should add skipped records and ignore zero counts")
        void incrementSkippedRecords() {
            metrics.incrementSkippedRecords(4);
            metrics.incrementSkippedRecords(0);

            Counter counter = registry.find("optimizer.records.skipped").counter();

            assertNotNull(counter);
            assertEquals(4.0, counter.count());
        }

        @Test
        @DisplayName("Should record network size")
        void recordNetworkSize() {
            metrics.recordNetworkSize(3783, 24186);

            DistributionSummary nodes = registry.find("optimizer.network.nodes").summary();
            DistributionSummary edges = registry.find("optimizer.network.edges").summary();

            assertNotNull(nodes);
            assertNotNull(edges);
            assertEquals(3783.0, nodes.totalAmount(), 0.001);
            assertEquals(24186.0, edges.totalAmount(), 0.001);
        }
    }
}
