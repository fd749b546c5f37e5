package com.telcobright.searchagg.bucket;

import com.telcobright.searchagg.stats.MeasureValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final state of one bucket: its key, record count and measure values.
 */
public class BucketResult {

    private final BucketKey key;
    private final long elemCount;
    private final Map<String, MeasureValue> statRes;

    public BucketResult(BucketKey key, long elemCount, Map<String, MeasureValue> statRes) {
        this.key = key;
        this.elemCount = elemCount;
        this.statRes = Collections.unmodifiableMap(new LinkedHashMap<>(statRes));
    }

    public BucketKey getKey() {
        return key;
    }

    public long getElemCount() {
        return elemCount;
    }

    public Map<String, MeasureValue> getStatRes() {
        return statRes;
    }

    @Override
    public String toString() {
        return "BucketResult{key=" + key + ", elemCount=" + elemCount + ", statRes=" + statRes + '}';
    }
}
