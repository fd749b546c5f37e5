package com.telcobright.searchagg.results;

import com.telcobright.searchagg.bucket.AggregationResult;
import com.telcobright.searchagg.bucket.BucketContribution;
import com.telcobright.searchagg.bucket.BucketMaterializer;
import com.telcobright.searchagg.bucket.BucketMergeException;
import com.telcobright.searchagg.bucket.BucketRow;
import com.telcobright.searchagg.bucket.MaterializedBuckets;
import com.telcobright.searchagg.bucket.RunningBuckets;
import com.telcobright.searchagg.config.AggregatorConfig;
import com.telcobright.searchagg.logging.Logger;
import com.telcobright.searchagg.monitoring.AggregationMetrics;
import com.telcobright.searchagg.query.QueryAggregators;
import com.telcobright.searchagg.query.QueryType;
import com.telcobright.searchagg.stats.ColumnStats;
import com.telcobright.searchagg.stats.MeasureAggregator;
import com.telcobright.searchagg.stats.MeasureEvaluationException;
import com.telcobright.searchagg.stats.MeasureValue;
import com.telcobright.searchagg.stats.RunningStatisticsMerger;
import com.telcobright.searchagg.stats.SegmentStatsCodec;
import com.telcobright.searchagg.stats.SegmentStatsCodecException;

import java.math.BigInteger;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Owns all aggregation state of one in-flight query.
 *
 * Segment workers and remote-merge handlers call this concurrently. Every operation runs under
 * a single lock because the result count, the top-K membership and the remote raw-log cache
 * must change together. No operation does I/O while holding the lock.
 *
 * Invariants:
 * <ul>
 *   <li>every key of the remote raw-log cache is the id of a remote record currently in the top-K</li>
 *   <li>the result count never decreases; early exit and finality never revert</li>
 *   <li>segment encodings start at 1 and are never reassigned</li>
 *   <li>pending segment statistics are handed out at most once</li>
 * </ul>
 */
public class QueryAggregationController {

    /** Group-by value of the single row a statistics query produces. */
    public static final String EMPTY_GROUPBY_KEY = "*";

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final ReentrantLock lock = new ReentrantLock();

    private final long queryId;
    private final int sizeLimit;
    private final QueryType queryType;
    private final QueryAggregators aggregators;
    private final AggregatorConfig config;
    private final Logger logger;
    private final AggregationMetrics metrics;
    private final EarlyExitEngine earlyExitEngine;

    private final BoundedResultMerger results;
    private long resultCount;
    private boolean earlyExit;
    private boolean statsAreFinal;

    private final RunningStatisticsMerger statsMerger;
    private List<String> segStatsMeasureFunctions;

    private final Map<String, Map<String, Object>> remoteLogs = new HashMap<>();
    private final Set<String> remoteColumns = new LinkedHashSet<>();

    private final Map<String, Integer> segKeyToEnc = new HashMap<>();
    private final Map<Integer, String> segEncToKey = new HashMap<>();
    private int maxSegKeyEnc = 1;
    private final Map<Integer, Map<String, ColumnStats>> pendingStats = new HashMap<>();

    private final List<Exception> allErrors = new ArrayList<>();

    private final RunningBuckets timeBuckets;
    private final RunningBuckets groupByBuckets;
    private Map<String, AggregationResult> convertedBuckets = Collections.emptyMap();
    private boolean bucketsDirty = true;
    private Map<String, Integer> columnsOrder = Collections.emptyMap();

    public QueryAggregationController(long queryId, int sizeLimit, QueryAggregators aggregators, QueryType queryType) {
        this(queryId, sizeLimit, aggregators, queryType, AggregatorConfig.defaults());
    }

    public QueryAggregationController(long queryId, int sizeLimit, QueryAggregators aggregators,
                                      QueryType queryType, AggregatorConfig config) {
        this(queryId, sizeLimit, aggregators, queryType, config, new SortedResultMerger(sizeLimit,
            aggregators != null && aggregators.getSort() != null && aggregators.getSort().isAscending()));
    }

    /**
     * @param results top-K container; exclusively owned by this controller from now on
     * @throws IllegalArgumentException if the aggregators do not fit the query type
     */
    public QueryAggregationController(long queryId, int sizeLimit, QueryAggregators aggregators,
                                      QueryType queryType, AggregatorConfig config,
                                      BoundedResultMerger results) {
        if (sizeLimit < 0) {
            throw new IllegalArgumentException("sizeLimit cannot be negative");
        }
        if (queryType == null) {
            throw new IllegalArgumentException("queryType cannot be null");
        }
        if (queryType == QueryType.GROUP_BY && (aggregators == null || aggregators.getGroupByRequest() == null)) {
            throw new IllegalArgumentException("A group-by query requires a group-by request, qid=" + queryId);
        }
        if (config == null || results == null) {
            throw new IllegalArgumentException("config and result merger are required");
        }

        this.queryId = queryId;
        this.sizeLimit = sizeLimit;
        this.queryType = queryType;
        this.aggregators = aggregators;
        this.config = config;
        this.logger = config.getLogger();
        this.results = results;
        this.metrics = new AggregationMetrics(queryId);
        this.earlyExitEngine = new EarlyExitEngine(queryType, aggregators);
        this.statsMerger = new RunningStatisticsMerger(queryId, config.getListCapacity(), logger);

        if (aggregators != null && aggregators.hasMeasureOperations()) {
            List<String> functions = new ArrayList<>();
            for (MeasureAggregator measure : aggregators.getMeasureOperations()) {
                functions.add(measure.toString());
            }
            this.segStatsMeasureFunctions = functions;
        }

        if (aggregators != null && aggregators.getTimeHistogram() != null) {
            this.timeBuckets = new RunningBuckets(aggregators.getTimeHistogram().getAggName(), true,
                aggregators.getMeasureOperations(), config.getListCapacity());
        } else {
            this.timeBuckets = null;
        }
        if (aggregators != null && aggregators.getGroupByRequest() != null) {
            this.groupByBuckets = new RunningBuckets(aggregators.getGroupByRequest().getAggName(), false,
                aggregators.getGroupByRequest().getMeasureOperations(), config.getListCapacity());
        } else {
            this.groupByBuckets = null;
        }

        logger.info(String.format("Created aggregation controller, qid=%d, type=%s, sizeLimit=%d",
            queryId, queryType, sizeLimit));
    }

    // ----------------------------------------------------------------------------------------
    // Local segment results
    // ----------------------------------------------------------------------------------------

    /**
     * Merges one segment's matched records, match count and bucket contributions. A bucket that
     * cannot be merged is recorded as an error; the rest of the segment is kept.
     */
    public void addBlockResults(SegmentPartialResult segment) {
        lock.lock();
        try {
            for (RecordResult record : segment.getRecords()) {
                if (results.contains(record.getRecordId())) {
                    continue;
                }
                AddOutcome outcome = results.add(record);
                removeLog(outcome.getEvictedId());
            }
            resultCount += segment.getMatchedCount();
            try {
                mergeBuckets(segment.getTimeBuckets(), segment.getGroupByBuckets());
            } catch (BucketMergeException e) {
                addErrorInternal(e);
                logger.warn(String.format("Failed to merge segment buckets, qid=%d: %s", queryId, e.getMessage()));
            }
            bucketsDirty = true;
            metrics.recordSegmentMerged();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Folds one segment's column statistics into the running measure results.
     *
     * @return ids of the measures that could not be computed for this segment; each failure is
     *         also added to the error list
     * @throws com.telcobright.searchagg.stats.UnsupportedAggregationException if a measure
     *         function cannot be merged
     * @throws IllegalStateException if the statistics were already finalized
     */
    public Set<String> addSegmentStatistics(Map<String, ColumnStats> segmentStats, List<MeasureAggregator> measures) {
        lock.lock();
        try {
            if (statsAreFinal) {
                throw new IllegalStateException("Statistics are final, qid=" + queryId);
            }
            List<MeasureEvaluationException> failures = statsMerger.merge(segmentStats, measures);
            Set<String> failed = new LinkedHashSet<>();
            for (MeasureEvaluationException failure : failures) {
                failed.add(failure.getMeasureId());
                addErrorInternal(failure);
                logger.warn(String.format("Measure %s skipped for segment, qid=%d: %s",
                    failure.getMeasureId(), queryId, failure.getMessage()));
            }
            metrics.recordSegmentStatsMerged();
            return failed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Decodes statistics shipped by another node and folds them with this query's measures.
     */
    public Set<String> addSegmentStatsFromJson(byte[] payload) throws SegmentStatsCodecException {
        if (aggregators == null || !aggregators.hasMeasureOperations()) {
            throw new IllegalStateException("Query has no measure operations, qid=" + queryId);
        }
        Map<String, ColumnStats> segmentStats = SegmentStatsCodec.decode(payload);
        return addSegmentStatistics(segmentStats, aggregators.getMeasureOperations());
    }

    /**
     * Keeps a segment's raw statistics until they are fetched for transmission.
     */
    public void addPendingSegmentStats(Map<String, ColumnStats> segmentStats, int segKeyEnc) {
        Map<String, ColumnStats> copy = new LinkedHashMap<>();
        segmentStats.forEach((column, stats) -> copy.put(column, stats.copy()));
        lock.lock();
        try {
            pendingStats.put(segKeyEnc, copy);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a segment's pending statistics and returns them JSON-encoded.
     *
     * @return the payload, or null if nothing is pending for the encoding
     */
    public byte[] getEncodedSegmentStats(int segKeyEnc) throws SegmentStatsCodecException {
        Map<String, ColumnStats> pending;
        lock.lock();
        try {
            pending = pendingStats.remove(segKeyEnc);
        } finally {
            lock.unlock();
        }
        if (pending == null) {
            return null;
        }
        try {
            return SegmentStatsCodec.encode(pending);
        } catch (SegmentStatsCodecException e) {
            logger.error(String.format("Failed to encode segment statistics, qid=%d, segKeyEnc=%d", queryId, segKeyEnc), e);
            throw e;
        }
    }

    /**
     * Compact encoding of a segment key. Unseen keys get the next counter value, starting at 1.
     */
    public int getAddSegmentEncoding(String segmentKey) {
        lock.lock();
        try {
            Integer existing = segKeyToEnc.get(segmentKey);
            if (existing != null) {
                return existing;
            }
            int encoding = maxSegKeyEnc++;
            segKeyToEnc.put(segmentKey, encoding);
            segEncToKey.put(encoding, segmentKey);
            return encoding;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Segment key for an encoding, or null if the encoding was never handed out.
     */
    public String getSegmentKey(int segKeyEnc) {
        lock.lock();
        try {
            return segEncToKey.get(segKeyEnc);
        } finally {
            lock.unlock();
        }
    }

    public void addError(Exception error) {
        lock.lock();
        try {
            addErrorInternal(error);
        } finally {
            lock.unlock();
        }
    }

    // ----------------------------------------------------------------------------------------
    // Early exit
    // ----------------------------------------------------------------------------------------

    /**
     * True while the top-K can still take more raw records.
     */
    public boolean shouldContinueRawSearch() {
        lock.lock();
        try {
            return resultCount <= sizeLimit;
        } finally {
            lock.unlock();
        }
    }

    public EarlyExitType shouldSearchSegment(SegmentCandidate candidate) {
        lock.lock();
        try {
            EarlyExitType decision = earlyExitEngine.classify(resultCount, sizeLimit, numBucketsInternal(),
                results, candidate);
            metrics.recordClassification(decision);
            if (logger.isLevelEnabled(Logger.Level.TRACE)) {
                logger.trace(String.format("Segment %s classified as %s, qid=%d", candidate, decision, queryId));
            }
            return decision;
        } finally {
            lock.unlock();
        }
    }

    public boolean shouldSearchTimeRange(long lowTs, long highTs) {
        lock.lock();
        try {
            return earlyExitEngine.shouldSearchTimeRange(resultCount, sizeLimit, results, lowTs, highTs);
        } finally {
            lock.unlock();
        }
    }

    public void markEarlyExit() {
        lock.lock();
        try {
            earlyExit = true;
        } finally {
            lock.unlock();
        }
    }

    // ----------------------------------------------------------------------------------------
    // Remote results
    // ----------------------------------------------------------------------------------------

    /**
     * Merges a peer node's partial result. The payload is checked before anything changes;
     * after that, records, columns and the early-exit flag stay merged even if a bucket merge
     * fails, and the peer's count is only added once every bucket merged. Records already held
     * are skipped, so the peer may be retried after a failure.
     *
     * @throws RemoteMergeException if the payload is malformed or a bucket cannot be merged
     */
    public void mergeRemotePartial(RemotePartialResult remote) throws RemoteMergeException {
        lock.lock();
        try {
            validateRemote(remote);

            remoteColumns.addAll(remote.getColumns());

            List<RecordResult> records = remote.getRecords();
            List<Map<String, Object>> rawLogs = remote.getRawLogs();
            int accepted = 0;
            for (int i = 0; i < records.size(); i++) {
                RecordResult record = records.get(i);
                // a retried peer resends records its failed attempt already merged
                if (results.contains(record.getRecordId())) {
                    continue;
                }
                AddOutcome outcome = results.add(record);
                if (outcome.isAdded()) {
                    remoteLogs.put(record.getRecordId(), rawLogs.get(i));
                    accepted++;
                }
                removeLog(outcome.getEvictedId());
            }

            if (remote.isEarlyExit()) {
                earlyExit = true;
            }

            bucketsDirty = true;
            try {
                mergeBuckets(remote.getTimeBuckets(), remote.getGroupByBuckets());
            } catch (BucketMergeException e) {
                metrics.recordRemoteMerge(false);
                logger.error(String.format("Error merging remote buckets, qid=%d", queryId), e);
                throw new RemoteMergeException("Failed to merge remote buckets, qid=" + queryId, e);
            }

            resultCount += remote.getCount();
            metrics.recordRemoteMerge(true);

            if (logger.isLevelEnabled(Logger.Level.DEBUG)) {
                Map<String, Object> context = new LinkedHashMap<>();
                context.put("qid", queryId);
                context.put("records", records.size());
                context.put("accepted", accepted);
                context.put("count", remote.getCount());
                context.put("earlyExit", remote.isEarlyExit());
                logger.logEvent(Logger.Level.DEBUG, "REMOTE_MERGE", "Merged remote partial result", context);
            }
        } finally {
            lock.unlock();
        }
    }

    private void validateRemote(RemotePartialResult remote) throws RemoteMergeException {
        if (remote.getRawLogs().size() != remote.getRecords().size()) {
            throw new RemoteMergeException(String.format(
                "Remote result has %d records but %d raw logs, qid=%d",
                remote.getRecords().size(), remote.getRawLogs().size(), queryId));
        }
        for (int i = 0; i < remote.getRecords().size(); i++) {
            RecordResult record = remote.getRecords().get(i);
            if (!record.isRemote()) {
                throw new RemoteMergeException("Record " + record.getRecordId() + " is not marked remote, qid=" + queryId);
            }
            if (remote.getRawLogs().get(i) == null) {
                throw new RemoteMergeException("Record " + record.getRecordId() + " has no raw log, qid=" + queryId);
            }
        }
    }

    /**
     * Raw payloads of the given records that came from {@code remoteId}, in the given order,
     * plus every column peers reported. Records whose payload is no longer cached are skipped.
     */
    public RemoteInfo getRemoteInfo(String remoteId, List<RecordResult> records) {
        lock.lock();
        try {
            List<Map<String, Object>> logs = new ArrayList<>(records.size());
            for (RecordResult record : records) {
                if (!record.isRemote() || !record.getRecordId().startsWith(remoteId)) {
                    continue;
                }
                Map<String, Object> rawLog = remoteLogs.get(record.getRecordId());
                if (rawLog == null) {
                    logger.debug(String.format("No raw log cached for remote record %s, qid=%d",
                        record.getRecordId(), queryId));
                    continue;
                }
                logs.add(rawLog);
            }
            return new RemoteInfo(logs, new ArrayList<>(new TreeSet<>(remoteColumns)));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids currently held in the remote raw-log cache.
     */
    public Set<String> getRemoteLogIds() {
        lock.lock();
        try {
            return new TreeSet<>(remoteLogs.keySet());
        } finally {
            lock.unlock();
        }
    }

    // ----------------------------------------------------------------------------------------
    // Finalization
    // ----------------------------------------------------------------------------------------

    /**
     * Replaces local results with the coordinator's authoritative ones and freezes them.
     *
     * A group-by node result replaces the materialized buckets. Any other must carry exactly one
     * measure row holding a display string per measure function; separators are stripped and
     * values parse as integer, else decimal, else stay strings.
     *
     * @throws IllegalStateException if already finalized; nothing changes
     * @throws IllegalArgumentException if the node result is malformed; nothing changes
     */
    public void finalizeFrom(NodeResult nodeResult) {
        lock.lock();
        try {
            if (statsAreFinal) {
                throw new IllegalStateException("Stats are already final, qid=" + queryId);
            }

            if (nodeResult.isGroupBy()) {
                convertedBuckets = new LinkedHashMap<>(nodeResult.getHistogram());
                bucketsDirty = false;
            } else {
                Map<String, MeasureValue> finalResults = parseMeasureRow(nodeResult);
                segStatsMeasureFunctions = new ArrayList<>(nodeResult.getMeasureFunctions());
                statsMerger.replaceResults(finalResults);
            }
            columnsOrder = new LinkedHashMap<>(nodeResult.getColumnsOrder());
            statsAreFinal = true;
            metrics.setFinalizedTimestamp(LocalDateTime.now());
            logger.info(String.format("Statistics finalized from node result, qid=%d", queryId));
        } finally {
            lock.unlock();
        }
    }

    private Map<String, MeasureValue> parseMeasureRow(NodeResult nodeResult) {
        if (nodeResult.getMeasureResults().size() != 1) {
            throw new IllegalArgumentException(String.format(
                "Expected exactly one measure row but got %d, qid=%d", nodeResult.getMeasureResults().size(), queryId));
        }
        BucketRow row = nodeResult.getMeasureResults().get(0);
        Map<String, MeasureValue> parsed = new LinkedHashMap<>();
        for (String function : nodeResult.getMeasureFunctions()) {
            if (!row.getMeasureValues().containsKey(function)) {
                throw new IllegalArgumentException(function + " not found in measure row, qid=" + queryId);
            }
            Object value = row.getMeasureValue(function);
            if (!(value instanceof String)) {
                throw new IllegalArgumentException(String.format("Unexpected value type %s for %s, qid=%d",
                    value == null ? "null" : value.getClass().getSimpleName(), function, queryId));
            }
            parsed.put(function, parseDisplayValue((String) value));
        }
        return parsed;
    }

    static MeasureValue parseDisplayValue(String display) {
        String value = display.replace(",", "");
        if (INTEGER.matcher(value).matches()) {
            BigInteger integer = new BigInteger(value);
            if (integer.bitLength() < 64) {
                return MeasureValue.ofLong(integer.longValue());
            }
        }
        if (DECIMAL.matcher(value).matches()) {
            return MeasureValue.ofDouble(Double.parseDouble(value));
        }
        return MeasureValue.ofString(value);
    }

    // ----------------------------------------------------------------------------------------
    // Reads
    // ----------------------------------------------------------------------------------------

    public long getTotalCount() {
        lock.lock();
        try {
            return resultCount;
        } finally {
            lock.unlock();
        }
    }

    public QueryCount getQueryCount() {
        lock.lock();
        try {
            boolean earlyExitAllowed = aggregators == null || aggregators.isEarlyExit();
            return new QueryCount(resultCount, earlyExitAllowed,
                earlyExit ? QueryCount.Relation.GREATER_THAN_OR_EQUAL : QueryCount.Relation.EQUALS);
        } finally {
            lock.unlock();
        }
    }

    public List<Exception> getAllErrors() {
        lock.lock();
        try {
            return new ArrayList<>(allErrors);
        } finally {
            lock.unlock();
        }
    }

    public QueryAggregators getAggregators() {
        return aggregators;
    }

    public QueryType getQueryType() {
        return queryType;
    }

    public long getQueryId() {
        return queryId;
    }

    public int getSizeLimit() {
        return sizeLimit;
    }

    public boolean isEarlyExit() {
        lock.lock();
        try {
            return earlyExit;
        } finally {
            lock.unlock();
        }
    }

    public boolean isStatsFinal() {
        lock.lock();
        try {
            return statsAreFinal;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Materialized buckets per aggregation name. Recomputed after any merge until the query is
     * finalized; frozen afterwards.
     */
    public Map<String, AggregationResult> getBucketResults() {
        lock.lock();
        try {
            loadBucketsInternal();
            return Collections.unmodifiableMap(convertedBuckets);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Bucket rows up to {@code limit}, with the group-by columns and column order of the query.
     */
    public MaterializedBuckets getGroupByBuckets(int limit) {
        lock.lock();
        try {
            loadBucketsInternal();
            MaterializedBuckets rows = BucketMaterializer.materialize(limit, convertedBuckets);
            if (aggregators == null || aggregators.getGroupByRequest() == null) {
                return rows;
            }
            return rows.withColumns(aggregators.getGroupByRequest().getGroupByColumns(), columnsOrder);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current running buckets regardless of finalization.
     */
    public Map<String, AggregationResult> getRunningBuckets() {
        lock.lock();
        try {
            return buildBuckets();
        } finally {
            lock.unlock();
        }
    }

    public int getNumBuckets() {
        lock.lock();
        try {
            return numBucketsInternal();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, MeasureValue> getSegmentStatsMeasureResults() {
        lock.lock();
        try {
            return statsMerger.getMeasureResults();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, ColumnStats> getSegmentRunningStats() {
        lock.lock();
        try {
            return statsMerger.getRunningStats();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whole-query statistics as one display row keyed {@value #EMPTY_GROUPBY_KEY}. Also drops the
     * segment's pending statistics, which are no longer needed once results are read.
     */
    public MaterializedBuckets getSegmentStatsResults(int segKeyEnc) {
        lock.lock();
        try {
            if (segStatsMeasureFunctions == null) {
                return MaterializedBuckets.empty();
            }
            pendingStats.remove(segKeyEnc);

            Map<String, MeasureValue> measureResults = statsMerger.getMeasureResults();
            Map<String, Object> display = new LinkedHashMap<>();
            for (Map.Entry<String, MeasureValue> entry : measureResults.entrySet()) {
                display.put(entry.getKey(), humanize(entry.getValue()));
            }
            BucketRow row = new BucketRow(Collections.singletonList(EMPTY_GROUPBY_KEY), display);
            return new MaterializedBuckets(Collections.singletonList(row), segStatsMeasureFunctions,
                Collections.emptyList(), Collections.emptyMap(), measureResults.size());
        } finally {
            lock.unlock();
        }
    }

    private String humanize(MeasureValue value) {
        switch (value.getType()) {
            case SIGNED_NUM: {
                DecimalFormat format = new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(Locale.US));
                return format.format(value.asNumber().longValue());
            }
            case FLOAT: {
                DecimalFormat format = new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(Locale.US));
                format.setMaximumFractionDigits(config.getStatsFractionDigits());
                return format.format(value.asNumber().doubleValue());
            }
            case STRING:
                return (String) value.getValue();
            case STRING_LIST:
                return value.asString(config.getValuesSeparator());
            default:
                throw new IllegalStateException("Unknown measure value type " + value.getType());
        }
    }

    public List<RecordResult> getResults() {
        lock.lock();
        try {
            return results.getResults();
        } finally {
            lock.unlock();
        }
    }

    public List<RecordResult> getResultsCopy() {
        lock.lock();
        try {
            return results.getResultsCopy();
        } finally {
            lock.unlock();
        }
    }

    public AggregationMetrics getMetrics() {
        return metrics;
    }

    // ----------------------------------------------------------------------------------------
    // Internals; callers hold the lock
    // ----------------------------------------------------------------------------------------

    private void removeLog(String recordId) {
        if (recordId == null || recordId.isEmpty()) {
            return;
        }
        remoteLogs.remove(recordId);
        metrics.recordEvictions(1);
    }

    private void addErrorInternal(Exception error) {
        allErrors.add(error);
        metrics.recordErrors(1);
    }

    private void mergeBuckets(List<BucketContribution> time, List<BucketContribution> groupBy)
            throws BucketMergeException {
        if (!time.isEmpty()) {
            if (timeBuckets == null) {
                throw new BucketMergeException("Time bucket contributions received but no time histogram requested");
            }
            timeBuckets.merge(time);
        }
        if (!groupBy.isEmpty()) {
            if (groupByBuckets == null) {
                throw new BucketMergeException("Group-by contributions received but no group-by requested");
            }
            groupByBuckets.merge(groupBy);
        }
    }

    private int numBucketsInternal() {
        int count = 0;
        if (timeBuckets != null) {
            count += timeBuckets.size();
        }
        if (groupByBuckets != null) {
            count += groupByBuckets.size();
        }
        return count;
    }

    private void loadBucketsInternal() {
        if (statsAreFinal || !bucketsDirty) {
            return;
        }
        convertedBuckets = buildBuckets();
        bucketsDirty = false;
    }

    private Map<String, AggregationResult> buildBuckets() {
        Map<String, AggregationResult> built = new LinkedHashMap<>();
        if (timeBuckets != null) {
            built.put(timeBuckets.getAggName(), timeBuckets.toAggregationResult());
        }
        if (groupByBuckets != null) {
            built.put(groupByBuckets.getAggName(), groupByBuckets.toAggregationResult());
        }
        return built;
    }
}
