package com.tomeqa.index.status;

import java.util.Map;

/**
 * One-way progress channel for rebuild milestones, errors and completions.
 */
@FunctionalInterface
public interface StatusSink {

    void emit(String eventType, Map<String, Object> data);
}
