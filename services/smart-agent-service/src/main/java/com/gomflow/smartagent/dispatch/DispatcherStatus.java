package com.gomflow.smartagent.dispatch;

import com.gomflow.smartagent.domain.JobPriority;

import java.util.Map;

public record DispatcherStatus(
        boolean accepting,
        Map<JobPriority, Integer> queueDepth,
        int inFlight,
        int pendingRetries,
        int workers,
        int reservedHighPriorityWorkers,
        long processed,
        long retried,
        long deadLettered
) {

    public int totalQueued() {
        return queueDepth.values().stream().mapToInt(Integer::intValue).sum();
    }
}
