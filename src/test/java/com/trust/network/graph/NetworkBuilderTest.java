package com.trust.network.graph;

import com.trust.network.core.model.EndorsementRecord;
import com.trust.network.core.model.IdentityMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NetworkBuilderTest {

    private final NetworkBuilder builder = new NetworkBuilder();

    @Nested
    @DisplayName("Malformed records")
    class MalformedRecords {

        @Test
        @DisplayName("Malformed records should be skipped and counted, never fatal")
        void skipsAndCounts() {
            List<EndorsementRecord> records = List.of(
                    new EndorsementRecord(1, "1", "2", "5", "100"),
                    new EndorsementRecord(2, "1", null, "5", "100"),
                    new EndorsementRecord(3, "x", "2", "5", "100"),
                    new EndorsementRecord(4, "1", "3", "11", "100"),
                    new EndorsementRecord(5, "1", "3", "4", "yesterday"),
                    new EndorsementRecord(6, "4", "4", "2", "100"),
                    new EndorsementRecord(7, "2", "3", "-10", "200"));

            NetworkSnapshot snapshot = builder.build(records);
            BuildReport report = snapshot.buildReport();

            assertEquals(7, report.totalRecords());
            assertEquals(2, report.acceptedEdges());
            assertEquals(5, report.skippedCount());
            assertEquals(List.of(2L, 3L, 4L, 5L, 6L),
                    report.skipped().stream().map(BuildReport.SkippedRecord::lineNumber).toList());
            assertTrue(report.skipped().get(0).reason().contains("missing target_id"));
            assertTrue(report.skipped().get(2).reason().contains("outside scale"));
            assertTrue(report.skipped().get(3).reason().contains("timestamp"));
            assertTrue(report.skipped().get(4).reason().contains("self endorsement"));
            assertEquals(2, snapshot.edgeCount());
            assertEquals(List.of(1L, 2L, 3L), snapshot.allNodeIds());
        }

        @Test
        @DisplayName("Fractional epoch timestamps should be accepted and floored")
        void fractionalTimestamp() {
            NetworkSnapshot snapshot = builder.build(List.of(new EndorsementRecord(1, "1", "2", "3", "1500.75")));

            assertEquals(0, snapshot.buildReport().skippedCount());
            assertEquals(1500L, snapshot.lastContact(2));
        }

        @Test
        @DisplayName("Custom rating scale should bound accepted weights")
        void customScale() {
            NetworkBuilder narrow = new NetworkBuilder(NetworkOptions.builder().ratingScale(-1, 1).build());
            NetworkSnapshot snapshot = narrow.build(List.of(
                    EndorsementRecord.of(1, 2, 1, 0),
                    EndorsementRecord.of(1, 3, 2, 0)));

            assertEquals(1, snapshot.edgeCount());
            assertEquals(1, snapshot.buildReport().skippedCount());
        }
    }

    @Nested
    @DisplayName("Edge policy")
    class EdgePolicies {

        private final List<EndorsementRecord> repeated = List.of(
                EndorsementRecord.of(1, 2, 4, 100),
                EndorsementRecord.of(1, 2, 8, 300),
                EndorsementRecord.of(1, 2, 6, 200));

        @Test
        @DisplayName("RETAIN_ALL keeps every event as its own edge")
        void retainAll() {
            NetworkSnapshot snapshot = builder.build(repeated);

            assertEquals(3, snapshot.edgeCount());
            assertEquals(3, snapshot.degree(1));
            assertEquals(3, snapshot.inDegree(2));
            assertEquals(6.0, snapshot.score(2), 1e-12);
        }

        @Test
        @DisplayName("AGGREGATE_PAIRS collapses a pair to mean weight and latest timestamp")
        void aggregatePairs() {
            NetworkBuilder aggregating = new NetworkBuilder(NetworkOptions.builder()
                    .edgePolicy(EdgePolicy.AGGREGATE_PAIRS).build());
            NetworkSnapshot snapshot = aggregating.build(repeated);

            assertEquals(1, snapshot.edgeCount());
            assertEquals(6.0, snapshot.edges().get(0).weight(), 1e-12);
            assertEquals(300L, snapshot.edges().get(0).timestamp());
            assertEquals(1, snapshot.degree(2));
        }
    }

    @Test
    @DisplayName("Identity metadata should attach only to nodes in the network")
    void attachesIdentities() {
        Map<Long, IdentityMetadata> identities = Map.of(
                1L, new IdentityMetadata("Ada Lovelace", "Analyst", "ada@example.org", "555"),
                99L, new IdentityMetadata("Ghost", null, null, null));

        NetworkSnapshot snapshot = builder.build(List.of(EndorsementRecord.of(1, 2, 3, 0)), identities, null);

        assertEquals("Ada Lovelace", snapshot.identity(1).orElseThrow().name());
        assertTrue(snapshot.identity(2).isEmpty());
        assertFalse(snapshot.contains(99));
    }

    @Test
    @DisplayName("Progress callback should be told when the build completes")
    void reportsProgress() {
        List<String> messages = new ArrayList<>();
        builder.build(List.of(EndorsementRecord.of(1, 2, 3, 0)), Map.of(),
                (processed, total, message) -> messages.add(message));

        assertEquals("Build completed", messages.get(messages.size() - 1));
    }

    @Test
    @DisplayName("Edges should be ordered by source, target and timestamp regardless of input order")
    void deterministicEdgeOrder() {
        NetworkSnapshot snapshot = builder.build(List.of(
                EndorsementRecord.of(3, 1, 1, 5),
                EndorsementRecord.of(1, 3, 1, 9),
                EndorsementRecord.of(1, 2, 1, 7),
                EndorsementRecord.of(1, 2, 1, 2)));

        assertEquals(List.of(2L, 7L, 9L, 5L),
                snapshot.edges().stream().map(e -> e.timestamp()).toList());
    }
}
