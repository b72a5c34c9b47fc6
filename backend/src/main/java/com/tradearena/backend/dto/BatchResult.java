package com.tradearena.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-item report of a batch operation. A batch never collapses into a single pass/fail.
 */
public record BatchResult(
        String operation,
        Long targetId,
        String targetStatus,
        List<ItemOutcome> items
) {
    @JsonProperty
    public long succeeded() {
        return count(ItemOutcome.Status.SUCCEEDED);
    }

    @JsonProperty
    public long skipped() {
        return count(ItemOutcome.Status.SKIPPED);
    }

    @JsonProperty
    public long failed() {
        return count(ItemOutcome.Status.FAILED);
    }

    @JsonProperty
    public boolean complete() {
        return failed() == 0;
    }

    private long count(ItemOutcome.Status status) {
        return items.stream().filter(item -> item.status() == status).count();
    }
}
