package net.keygate.core.model;

import java.util.List;

public record QueueStatus(long productId, String productName, int activeSlots, int maxConcurrent,
                          List<Slot> recentCompletions) {
    public QueueStatus {
        recentCompletions = List.copyOf(recentCompletions);
    }
}
