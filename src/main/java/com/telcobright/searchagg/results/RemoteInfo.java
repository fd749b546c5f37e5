package com.telcobright.searchagg.results;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Raw payloads of one peer's retained records plus every column peers reported, sorted.
 */
public class RemoteInfo {

    private final List<Map<String, Object>> rawLogs;
    private final List<String> columns;

    public RemoteInfo(List<Map<String, Object>> rawLogs, List<String> columns) {
        this.rawLogs = Collections.unmodifiableList(new ArrayList<>(rawLogs));
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public List<Map<String, Object>> getRawLogs() {
        return rawLogs;
    }

    public List<String> getColumns() {
        return columns;
    }
}
