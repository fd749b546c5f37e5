package com.telcobright.searchagg.stats;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding of a segment's per-column statistics, used when pending statistics are shipped
 * to the node that owns the query. Every mergeable field is kept so the receiver can continue
 * merging exactly as if the segment had been searched locally.
 */
public final class SegmentStatsCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private SegmentStatsCodec() {
    }

    public static byte[] encode(Map<String, ColumnStats> segmentStats) throws SegmentStatsCodecException {
        try {
            return MAPPER.writeValueAsBytes(new AllSegmentStats(segmentStats));
        } catch (JsonProcessingException e) {
            throw new SegmentStatsCodecException("Failed to encode segment statistics", e);
        }
    }

    public static Map<String, ColumnStats> decode(byte[] payload) throws SegmentStatsCodecException {
        if (payload == null || payload.length == 0) {
            throw new SegmentStatsCodecException("Segment statistics payload is empty", null);
        }
        try {
            AllSegmentStats all = MAPPER.readValue(payload, AllSegmentStats.class);
            if (all.allSegStats == null) {
                throw new SegmentStatsCodecException("Segment statistics payload has no allSegStats field", null);
            }
            return all.allSegStats;
        } catch (IOException e) {
            throw new SegmentStatsCodecException("Malformed segment statistics payload", e);
        }
    }

    /**
     * Wire envelope: {@code {"allSegStats": {column: stats, ...}}}.
     */
    static final class AllSegmentStats {
        @JsonProperty("allSegStats")
        final Map<String, ColumnStats> allSegStats;

        @JsonCreator
        AllSegmentStats(@JsonProperty("allSegStats") Map<String, ColumnStats> allSegStats) {
            this.allSegStats = allSegStats != null ? new LinkedHashMap<>(allSegStats) : null;
        }
    }
}
