package com.stepflow.engine.history;

import com.stepflow.core.model.ExecutionLogEntry;

import java.util.List;

/**
 * One page of an execution's audit log.
 *
 * @param entries entries of the page, in sequence order
 * @param total entries matching the filter across all pages
 * @param offset index of the first entry of the page
 * @param limit page size
 */
public record LogPage(
    List<ExecutionLogEntry> entries,
    long total,
    int offset,
    int limit
) {
    public boolean hasMore() {
        return offset + entries.size() < total;
    }
}
