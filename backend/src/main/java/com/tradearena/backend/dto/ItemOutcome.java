package com.tradearena.backend.dto;

public record ItemOutcome(
        String itemType,
        Long itemId,
        Long userId,
        Status status,
        String message
) {
    public enum Status {
        SUCCEEDED,
        SKIPPED,
        FAILED
    }

    public static ItemOutcome succeeded(String itemType, Long itemId, Long userId, String message) {
        return new ItemOutcome(itemType, itemId, userId, Status.SUCCEEDED, message);
    }

    public static ItemOutcome skipped(String itemType, Long itemId, Long userId, String message) {
        return new ItemOutcome(itemType, itemId, userId, Status.SKIPPED, message);
    }

    public static ItemOutcome failed(String itemType, Long itemId, Long userId, String message) {
        return new ItemOutcome(itemType, itemId, userId, Status.FAILED, message);
    }
}
