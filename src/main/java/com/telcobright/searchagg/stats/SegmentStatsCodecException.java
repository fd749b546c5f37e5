package com.telcobright.searchagg.stats;

/**
 * Segment statistics could not be encoded for transmission or decoded from a peer payload.
 */
public class SegmentStatsCodecException extends Exception {

    public SegmentStatsCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
