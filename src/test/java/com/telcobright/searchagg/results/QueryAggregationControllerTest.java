package com.telcobright.searchagg.results;

import com.telcobright.searchagg.bucket.AggregationResult;
import com.telcobright.searchagg.bucket.BucketContribution;
import com.telcobright.searchagg.bucket.BucketKey;
import com.telcobright.searchagg.bucket.BucketMergeException;
import com.telcobright.searchagg.bucket.BucketResult;
import com.telcobright.searchagg.bucket.BucketRow;
import com.telcobright.searchagg.bucket.MaterializedBuckets;
import com.telcobright.searchagg.config.AggregatorConfig;
import com.telcobright.searchagg.logging.Logger;
import com.telcobright.searchagg.query.GroupByRequest;
import com.telcobright.searchagg.query.QueryAggregators;
import com.telcobright.searchagg.query.QueryType;
import com.telcobright.searchagg.stats.ColumnStats;
import com.telcobright.searchagg.stats.MeasureFunction;
import com.telcobright.searchagg.stats.MeasureValue;
import com.telcobright.searchagg.stats.SegmentStatsCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("QueryAggregationController Tests")
class QueryAggregationControllerTest {

    private static QueryAggregators sortedOn(String column) {
        return QueryAggregators.builder().sortAscending(column).build();
    }

    private static QueryAggregators groupByHost(int bucketCount) {
        return QueryAggregators.builder()
            .groupBy(new GroupByRequest("by_host", Collections.singletonList("host"), null, bucketCount))
            .build();
    }

    private static QueryAggregators sumAndAvg() {
        return QueryAggregators.builder()
            .measure(MeasureFunction.SUM, "bytes")
            .measure(MeasureFunction.AVG, "bytes")
            .build();
    }

    private static Map<String, Object> rawLog(String id) {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("id", id);
        log.put("msg", "payload of " + id);
        return log;
    }

    private static Map<String, ColumnStats> stats(String column, ColumnStats columnStats) {
        Map<String, ColumnStats> map = new LinkedHashMap<>();
        map.put(column, columnStats);
        return map;
    }

    @Test
    @DisplayName("Should keep the two smallest sort values across segments")
    void testTwoSegmentsAscending() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(1L, 2, sortedOn("e"), QueryType.RAW_RECORD);

        // When
        controller.addBlockResults(new SegmentPartialResult()
            .addRecord(RecordResult.local("id1", "seg-a", 5, 5))
            .addRecord(RecordResult.local("id2", "seg-a", 1, 1))
            .setMatchedCount(2));
        controller.addBlockResults(new SegmentPartialResult()
            .addRecord(RecordResult.local("id3", "seg-b", 3, 3))
            .setMatchedCount(1));

        // Then
        assertThat(controller.getResults()).extracting(RecordResult::getRecordId).containsExactly("id2", "id3");
        assertThat(controller.getTotalCount()).isEqualTo(3);
        assertThat(controller.getRemoteLogIds()).doesNotContain("id1");
        assertThat(controller.shouldContinueRawSearch()).isFalse();
    }

    @Test
    @DisplayName("Should drop the cached raw log of an evicted remote record")
    void testRemoteEvictionClearsCache() throws Exception {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(2L, 1, sortedOn("ts"), QueryType.RAW_RECORD);
        controller.mergeRemotePartial(RemotePartialResult.builder()
            .record(RecordResult.remote("node2-r1", 10, 10), rawLog("node2-r1"))
            .count(1)
            .build());
        assertThat(controller.getRemoteLogIds()).containsExactly("node2-r1");

        // When
        controller.addBlockResults(new SegmentPartialResult()
            .addRecord(RecordResult.local("local-1", "seg-a", 2, 2))
            .setMatchedCount(1));

        // Then
        assertThat(controller.getResults()).extracting(RecordResult::getRecordId).containsExactly("local-1");
        assertThat(controller.getRemoteLogIds()).isEmpty();
        assertThat(controller.getMetrics().getRecordsEvicted()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should cache raw logs only for remote records currently in the top-K")
    void testRawLogCacheTracksTopK() throws Exception {
        // Given
        Random random = new Random(7);
        QueryAggregationController controller =
            new QueryAggregationController(3L, 5, sortedOn("ts"), QueryType.RAW_RECORD);

        // When
        for (int round = 0; round < 50; round++) {
            if (random.nextBoolean()) {
                RemotePartialResult.Builder remote = RemotePartialResult.builder().count(3);
                for (int i = 0; i < 3; i++) {
                    String id = "node" + random.nextInt(3) + "-" + round + "-" + i;
                    remote.record(RecordResult.remote(id, random.nextInt(1000), round), rawLog(id));
                }
                controller.mergeRemotePartial(remote.build());
            } else {
                SegmentPartialResult segment = new SegmentPartialResult().setMatchedCount(3);
                for (int i = 0; i < 3; i++) {
                    segment.addRecord(RecordResult.local("local-" + round + "-" + i, "seg-" + round,
                        random.nextInt(1000), round));
                }
                controller.addBlockResults(segment);
            }

            // Then
            Set<String> remoteInTopK = controller.getResults().stream()
                .filter(RecordResult::isRemote)
                .map(RecordResult::getRecordId)
                .collect(Collectors.toSet());
            assertThat(controller.getRemoteLogIds()).isEqualTo(remoteInTopK);
            assertThat(controller.getResults().size()).isLessThanOrEqualTo(5);
        }
        assertThat(controller.getTotalCount()).isEqualTo(150);
    }

    @Test
    @DisplayName("Should accept a custom result merger and logger")
    void testCustomCollaborators() {
        // Given
        BoundedResultMerger merger = mock(BoundedResultMerger.class);
        Logger logger = mock(Logger.class);
        when(merger.add(any(RecordResult.class))).thenReturn(AddOutcome.addedEvicting("old"));
        AggregatorConfig config = AggregatorConfig.builder().withLogger(logger).build();
        QueryAggregationController controller =
            new QueryAggregationController(4L, 10, null, QueryType.RAW_RECORD, config, merger);

        // When
        controller.addBlockResults(new SegmentPartialResult()
            .addRecord(RecordResult.local("new", "seg", 1, 1))
            .setMatchedCount(1));

        // Then
        verify(merger).add(RecordResult.local("new", "seg", 1, 1));
        verify(logger, atLeastOnce()).info(anyString());
        assertThat(controller.getMetrics().getRecordsEvicted()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return cached raw logs and sorted columns for one peer")
    void testGetRemoteInfo() throws Exception {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(5L, 10, sortedOn("ts"), QueryType.RAW_RECORD);
        controller.mergeRemotePartial(RemotePartialResult.builder()
            .record(RecordResult.remote("node2-a", 1, 1), rawLog("node2-a"))
            .record(RecordResult.remote("node2-b", 2, 2), rawLog("node2-b"))
            .column("status").column("host")
            .count(2)
            .build());
        controller.mergeRemotePartial(RemotePartialResult.builder()
            .record(RecordResult.remote("node3-a", 3, 3), rawLog("node3-a"))
            .column("app")
            .count(1)
            .earlyExit(true)
            .build());

        // When
        RemoteInfo info = controller.getRemoteInfo("node2", Arrays.asList(
            RecordResult.remote("node2-b", 2, 2),
            RecordResult.remote("node2-gone", 9, 9),
            RecordResult.remote("node3-a", 3, 3),
            RecordResult.remote("node2-a", 1, 1)));

        // Then
        assertThat(info.getRawLogs()).extracting(log -> log.get("id")).containsExactly("node2-b", "node2-a");
        assertThat(info.getColumns()).containsExactly("app", "host", "status");
        assertThat(controller.getTotalCount()).isEqualTo(3);
        assertThat(controller.isEarlyExit()).isTrue();
    }

    @Test
    @DisplayName("Should reject a malformed remote payload without changing state")
    void testMalformedRemote() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(6L, 10, sortedOn("ts"), QueryType.RAW_RECORD);

        // When / Then
        assertThatThrownBy(() -> controller.mergeRemotePartial(RemotePartialResult.builder()
            .record(RecordResult.remote("node2-a", 1, 1), rawLog("node2-a"))
            .record(RecordResult.remote("node2-b", 2, 2), null)
            .count(2)
            .build()))
            .isInstanceOf(RemoteMergeException.class)
            .hasMessageContaining("node2-b");
        assertThatThrownBy(() -> controller.mergeRemotePartial(RemotePartialResult.builder()
            .record(RecordResult.local("local", "seg", 1, 1), rawLog("local"))
            .count(1)
            .build()))
            .isInstanceOf(RemoteMergeException.class)
            .hasMessageContaining("not marked remote");

        assertThat(controller.getResults()).isEmpty();
        assertThat(controller.getRemoteLogIds()).isEmpty();
        assertThat(controller.getTotalCount()).isZero();
    }

    @Test
    @DisplayName("Should not add the peer count when its buckets cannot be merged")
    void testBucketFailureSkipsCount() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(7L, 10, sortedOn("ts"), QueryType.RAW_RECORD);

        // When / Then
        assertThatThrownBy(() -> controller.mergeRemotePartial(RemotePartialResult.builder()
            .record(RecordResult.remote("node2-a", 1, 1), rawLog("node2-a"))
            .timeBucket(new BucketContribution(BucketKey.scalar(60_000L), 4))
            .count(4)
            .build()))
            .isInstanceOf(RemoteMergeException.class)
            .hasCauseInstanceOf(BucketMergeException.class);

        assertThat(controller.getTotalCount()).isZero();
        assertThat(controller.getRemoteLogIds()).containsExactly("node2-a");
        assertThat(controller.getMetrics().getRemoteMergeFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should hold each record once when a peer is retried after a bucket failure")
    void testRetryAfterBucketFailure() throws Exception {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(26L, 2, sortedOn("ts"), QueryType.RAW_RECORD);
        assertThatThrownBy(() -> controller.mergeRemotePartial(RemotePartialResult.builder()
            .record(RecordResult.remote("node2-r1", 5, 5), rawLog("node2-r1"))
            .groupByBucket(new BucketContribution(BucketKey.strings("web-1"), 1))
            .count(1)
            .build()))
            .isInstanceOf(RemoteMergeException.class);

        // When
        controller.mergeRemotePartial(RemotePartialResult.builder()
            .record(RecordResult.remote("node2-r1", 5, 5), rawLog("node2-r1"))
            .count(1)
            .build());

        // Then
        assertThat(controller.getResults()).extracting(RecordResult::getRecordId).containsExactly("node2-r1");
        assertThat(controller.getTotalCount()).isEqualTo(1);

        // When
        controller.addBlockResults(new SegmentPartialResult()
            .addRecord(RecordResult.local("local-1", "seg-a", 0, 0))
            .setMatchedCount(1));

        // Then
        assertThat(controller.getResults()).extracting(RecordResult::getRecordId)
            .containsExactly("local-1", "node2-r1");
        assertThat(controller.getRemoteLogIds()).containsExactly("node2-r1");
        RemoteInfo info = controller.getRemoteInfo("node2", controller.getResults());
        assertThat(info.getRawLogs()).extracting(log -> log.get("id")).containsExactly("node2-r1");
    }

    @Test
    @DisplayName("Should ignore a local record that is already held")
    void testDuplicateLocalRecord() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(27L, 2, sortedOn("ts"), QueryType.RAW_RECORD);
        SegmentPartialResult segment = new SegmentPartialResult()
            .addRecord(RecordResult.local("a", "seg-a", 1, 1))
            .setMatchedCount(1);

        // When
        controller.addBlockResults(segment);
        controller.addBlockResults(segment);

        // Then
        assertThat(controller.getResults()).extracting(RecordResult::getRecordId).containsExactly("a");
    }

    @Test
    @DisplayName("Should report a lower bound once the query exited early")
    void testQueryCount() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(8L, 1, null, QueryType.RAW_RECORD);
        controller.addBlockResults(new SegmentPartialResult().setMatchedCount(12));

        // Then
        assertThat(controller.getQueryCount().getRelation()).isEqualTo(QueryCount.Relation.EQUALS);
        assertThat(controller.getQueryCount().isEarlyExitAllowed()).isTrue();

        // When
        controller.markEarlyExit();

        // Then
        QueryCount count = controller.getQueryCount();
        assertThat(count.getTotalCount()).isEqualTo(12);
        assertThat(count.getRelation()).isEqualTo(QueryCount.Relation.GREATER_THAN_OR_EQUAL);
        assertThat(count.toString()).isEqualTo(">=12");
    }

    @Test
    @DisplayName("Should never decrease the count or revert early exit")
    void testMonotonicState() throws Exception {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(9L, 3, sortedOn("ts"), QueryType.RAW_RECORD);
        long previous = 0;

        // When / Then
        for (int i = 0; i < 20; i++) {
            if (i % 3 == 0) {
                controller.mergeRemotePartial(RemotePartialResult.builder()
                    .record(RecordResult.remote("node2-" + i, i, i), rawLog("node2-" + i))
                    .count(i)
                    .earlyExit(i == 6)
                    .build());
            } else {
                controller.addBlockResults(new SegmentPartialResult().setMatchedCount(i % 2));
            }
            assertThat(controller.getTotalCount()).isGreaterThanOrEqualTo(previous);
            previous = controller.getTotalCount();
            if (i >= 6) {
                assertThat(controller.isEarlyExit()).isTrue();
            }
        }
    }

    @Test
    @DisplayName("Should classify a group-by segment against the bucket target")
    void testGroupBySegmentClassification() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(10L, 0, groupByHost(3), QueryType.GROUP_BY);
        SegmentCandidate candidate = SegmentCandidate.of(0, 100, SearchNodeType.FILTERED, true, false);

        // When
        controller.addBlockResults(new SegmentPartialResult()
            .addGroupByBucket(new BucketContribution(BucketKey.strings("web-1"), 1))
            .addGroupByBucket(new BucketContribution(BucketKey.strings("web-2"), 1))
            .setMatchedCount(1));

        // Then
        assertThat(controller.shouldSearchSegment(candidate)).isEqualTo(EarlyExitType.CONTINUE_SCAN);

        // When
        controller.addBlockResults(new SegmentPartialResult()
            .addGroupByBucket(new BucketContribution(BucketKey.strings("web-3"), 2))
            .setMatchedCount(2));

        // Then
        assertThat(controller.getNumBuckets()).isEqualTo(3);
        assertThat(controller.shouldSearchSegment(candidate)).isEqualTo(EarlyExitType.SKIP_ENTIRELY);
        assertThat(controller.getMetrics().getClassificationCount(EarlyExitType.SKIP_ENTIRELY)).isEqualTo(1);
        assertThat(controller.shouldSearchTimeRange(0, 100)).isTrue();
    }

    @Test
    @DisplayName("Should reject a group-by query without a group-by request")
    void testGroupByRequiresRequest() {
        assertThatThrownBy(() -> new QueryAggregationController(11L, 10, sortedOn("ts"), QueryType.GROUP_BY))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("group-by request");
    }

    @Test
    @DisplayName("Should record a local bucket failure and keep the rest of the segment")
    void testLocalBucketFailureRecorded() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(12L, 10, null, QueryType.RAW_RECORD);

        // When
        controller.addBlockResults(new SegmentPartialResult()
            .addRecord(RecordResult.local("a", "seg", 1, 1))
            .addGroupByBucket(new BucketContribution(BucketKey.strings("web-1"), 1))
            .setMatchedCount(1));

        // Then
        assertThat(controller.getResults()).hasSize(1);
        assertThat(controller.getTotalCount()).isEqualTo(1);
        assertThat(controller.getAllErrors()).hasSize(1);
    }

    @Test
    @DisplayName("Should return identical bucket results on repeated reads")
    void testIdempotentRead() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(13L, 0, groupByHost(10), QueryType.GROUP_BY);
        controller.addBlockResults(new SegmentPartialResult()
            .addGroupByBucket(new BucketContribution(BucketKey.strings("web-1"), 3))
            .setMatchedCount(1));

        // When
        Map<String, AggregationResult> first = controller.getBucketResults();
        Map<String, AggregationResult> second = controller.getBucketResults();

        // Then
        assertThat(second).isEqualTo(first);
        assertThat(first.get("by_host").getResults()).hasSize(1);
    }

    @Test
    @DisplayName("Should materialize a single group-by bucket with the query columns")
    void testGroupByRows() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(14L, 0, groupByHost(10), QueryType.GROUP_BY);

        // When
        controller.addBlockResults(new SegmentPartialResult()
            .addGroupByBucket(new BucketContribution(BucketKey.strings("web-1"), 1))
            .setMatchedCount(1));
        MaterializedBuckets rows = controller.getGroupByBuckets(100);

        // Then
        assertThat(rows.getAdded()).isEqualTo(1);
        assertThat(rows.getRows().get(0).getGroupByValues()).containsExactly("web-1");
        assertThat(rows.getGroupByColumns()).containsExactly("host");
    }

    @Test
    @DisplayName("Should freeze buckets once finalized from a group-by node result")
    void testGroupByFinalizeFreezes() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(15L, 0, groupByHost(10), QueryType.GROUP_BY);
        AggregationResult authoritative = new AggregationResult("by_host", false, Collections.singletonList(
            new BucketResult(BucketKey.strings("web-9"), 42, Collections.<String, MeasureValue>emptyMap())));
        Map<String, Integer> order = new HashMap<>();
        order.put("host", 0);

        // When
        controller.finalizeFrom(NodeResult.builder()
            .aggregation(authoritative)
            .groupByColumns(Collections.singletonList("host"))
            .columnsOrder(order)
            .build());
        controller.addBlockResults(new SegmentPartialResult()
            .addGroupByBucket(new BucketContribution(BucketKey.strings("web-1"), 1))
            .setMatchedCount(1));

        // Then
        assertThat(controller.isStatsFinal()).isTrue();
        assertThat(controller.getBucketResults().get("by_host").getResults())
            .extracting(BucketResult::getKey)
            .containsExactly(BucketKey.strings("web-9"));
        assertThat(controller.getRunningBuckets().get("by_host").getResults()).hasSize(1);
        assertThat(controller.getGroupByBuckets(10).getColumnsOrder()).containsEntry("host", 0);
    }

    @Test
    @DisplayName("Should hand out segment encodings starting at one")
    void testSegmentEncodings() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(16L, 10, null, QueryType.SEGMENT_STATISTICS);

        // Then
        assertThat(controller.getAddSegmentEncoding("seg-a")).isEqualTo(1);
        assertThat(controller.getAddSegmentEncoding("seg-b")).isEqualTo(2);
        assertThat(controller.getAddSegmentEncoding("seg-a")).isEqualTo(1);
        assertThat(controller.getSegmentKey(2)).isEqualTo("seg-b");
        assertThat(controller.getSegmentKey(3)).isNull();
    }

    @Test
    @DisplayName("Should deliver pending segment statistics at most once")
    void testPendingStatsAtMostOnce() throws Exception {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(17L, 10, sumAndAvg(), QueryType.SEGMENT_STATISTICS);
        int enc = controller.getAddSegmentEncoding("seg-a");
        controller.addPendingSegmentStats(stats("bytes", ColumnStats.ofSummary(2, 1, 9, 10)), enc);

        // When
        byte[] first = controller.getEncodedSegmentStats(enc);
        byte[] second = controller.getEncodedSegmentStats(enc);

        // Then
        assertThat(first).isNotNull();
        assertThat(SegmentStatsCodec.decode(first).get("bytes").getCount()).isEqualTo(2);
        assertThat(second).isNull();
    }

    @Test
    @DisplayName("Should fold statistics shipped as JSON by another node")
    void testAddSegmentStatsFromJson() throws Exception {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(18L, 10, sumAndAvg(), QueryType.SEGMENT_STATISTICS);
        byte[] payload = SegmentStatsCodec.encode(stats("bytes", ColumnStats.ofSummary(4, 1, 5, 10)));

        // When
        Set<String> failed = controller.addSegmentStatsFromJson(payload);
        controller.addSegmentStatistics(stats("bytes", ColumnStats.ofSummary(3, 0, 4, 7)),
            controller.getAggregators().getMeasureOperations());

        // Then
        assertThat(failed).isEmpty();
        Map<String, MeasureValue> results = controller.getSegmentStatsMeasureResults();
        assertThat(results.get("sum(bytes)")).isEqualTo(MeasureValue.ofLong(17));
        assertThat(results.get("avg(bytes)").asNumber().doubleValue()).isEqualTo(17.0 / 7);
        assertThat(controller.getSegmentRunningStats()).containsKeys("sum(bytes)", "avg(bytes)");
    }

    @Test
    @DisplayName("Should report measures that fail and keep the others")
    void testFailedMeasures() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(19L, 10, sumAndAvg(), QueryType.SEGMENT_STATISTICS);

        // When
        Set<String> failed = controller.addSegmentStatistics(
            stats("bytes", ColumnStats.fromValues("a", "b")),
            controller.getAggregators().getMeasureOperations());

        // Then
        assertThat(failed).containsExactlyInAnyOrder("sum(bytes)", "avg(bytes)");
        assertThat(controller.getAllErrors()).hasSize(2);
        assertThat(controller.getSegmentStatsMeasureResults()).isEmpty();
    }

    @Test
    @DisplayName("Should humanize statistics into a single row")
    void testSegmentStatsResults() throws Exception {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(20L, 10, sumAndAvg(), QueryType.SEGMENT_STATISTICS);
        int enc = controller.getAddSegmentEncoding("seg-a");
        controller.addPendingSegmentStats(stats("bytes", ColumnStats.ofSummary(1, 1, 1, 1)), enc);
        controller.addSegmentStatistics(stats("bytes", ColumnStats.ofSummary(1, 1_000_000, 1_000_000, 1_000_000)),
            controller.getAggregators().getMeasureOperations());
        controller.addSegmentStatistics(stats("bytes", ColumnStats.ofSummary(1, 734_567, 734_567, 734_567)),
            controller.getAggregators().getMeasureOperations());

        // When
        MaterializedBuckets buckets = controller.getSegmentStatsResults(enc);

        // Then
        assertThat(buckets.getMeasureFunctions()).containsExactly("sum(bytes)", "avg(bytes)");
        assertThat(buckets.getAdded()).isEqualTo(2);
        BucketRow row = buckets.getRows().get(0);
        assertThat(row.getGroupByValues()).containsExactly(QueryAggregationController.EMPTY_GROUPBY_KEY);
        assertThat(row.getMeasureValue("sum(bytes)")).isEqualTo("1,734,567");
        assertThat(row.getMeasureValue("avg(bytes)")).isEqualTo("867,283.5");
        assertThat(controller.getEncodedSegmentStats(enc)).isNull();
    }

    @Test
    @DisplayName("Should return no rows when the query has no measures")
    void testSegmentStatsResultsWithoutMeasures() {
        QueryAggregationController controller =
            new QueryAggregationController(21L, 10, null, QueryType.SEGMENT_STATISTICS);

        assertThat(controller.getSegmentStatsResults(1).getRows()).isEmpty();
    }

    private NodeResult statsNodeResult(String sum, String avg) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("sum(bytes)", sum);
        values.put("avg(bytes)", avg);
        return NodeResult.builder()
            .measureFunctions(Arrays.asList("sum(bytes)", "avg(bytes)"))
            .measureRow(new BucketRow(Collections.singletonList("*"), values))
            .build();
    }

    @Test
    @DisplayName("Should parse display values and freeze the statistics")
    void testFinalizeParsesValues() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(22L, 10, sumAndAvg(), QueryType.SEGMENT_STATISTICS);

        // When
        controller.finalizeFrom(statsNodeResult("12,345", "1,234.5"));

        // Then
        assertThat(controller.isStatsFinal()).isTrue();
        Map<String, MeasureValue> results = controller.getSegmentStatsMeasureResults();
        assertThat(results.get("sum(bytes)")).isEqualTo(MeasureValue.ofLong(12345));
        assertThat(results.get("avg(bytes)")).isEqualTo(MeasureValue.ofDouble(1234.5));
        assertThat(controller.getMetrics().getFinalizedTimestamp()).isNotNull();
        assertThatThrownBy(() -> controller.addSegmentStatistics(stats("bytes", ColumnStats.ofSummary(1, 1, 1, 1)),
            controller.getAggregators().getMeasureOperations()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should fail a second finalize without changing results")
    void testFinalizeOnce() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(23L, 10, sumAndAvg(), QueryType.SEGMENT_STATISTICS);
        controller.finalizeFrom(statsNodeResult("10", "2.5"));

        // When / Then
        assertThatThrownBy(() -> controller.finalizeFrom(statsNodeResult("99", "9.9")))
            .isInstanceOf(IllegalStateException.class);
        assertThat(controller.getSegmentStatsMeasureResults().get("sum(bytes)")).isEqualTo(MeasureValue.ofLong(10));
    }

    @Test
    @DisplayName("Should leave state untouched when the node result is malformed")
    void testMalformedFinalize() {
        // Given
        QueryAggregationController controller =
            new QueryAggregationController(24L, 10, sumAndAvg(), QueryType.SEGMENT_STATISTICS);
        controller.addSegmentStatistics(stats("bytes", ColumnStats.ofSummary(1, 5, 5, 5)),
            controller.getAggregators().getMeasureOperations());
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("sum(bytes)", "7");
        NodeResult missingAvg = NodeResult.builder()
            .measureFunctions(Arrays.asList("sum(bytes)", "avg(bytes)"))
            .measureRow(new BucketRow(Collections.singletonList("*"), values))
            .build();

        // When / Then
        assertThatThrownBy(() -> controller.finalizeFrom(missingAvg))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("avg(bytes)");
        assertThatThrownBy(() -> controller.finalizeFrom(NodeResult.builder().build()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(controller.isStatsFinal()).isFalse();
        assertThat(controller.getSegmentStatsMeasureResults().get("sum(bytes)")).isEqualTo(MeasureValue.ofLong(5));
    }

    @Test
    @DisplayName("Should parse integers, decimals and plain text")
    void testParseDisplayValue() {
        assertThat(QueryAggregationController.parseDisplayValue("1,234.5")).isEqualTo(MeasureValue.ofDouble(1234.5));
        assertThat(QueryAggregationController.parseDisplayValue("12,345")).isEqualTo(MeasureValue.ofLong(12345));
        assertThat(QueryAggregationController.parseDisplayValue("-3")).isEqualTo(MeasureValue.ofLong(-3));
        assertThat(QueryAggregationController.parseDisplayValue("99999999999999999999").getType())
            .isEqualTo(MeasureValue.Type.FLOAT);
        assertThat(QueryAggregationController.parseDisplayValue("web-1, web-2"))
            .isEqualTo(MeasureValue.ofString("web-1 web-2"));
    }
}
