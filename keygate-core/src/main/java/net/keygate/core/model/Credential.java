package net.keygate.core.model;

import java.time.Instant;

public record Credential(
        Long id,
        Partition partition,
        String payload,          // opaque connection material
        String assignedTo,       // subject id, null = unassigned
        Instant assignedAt,
        String batchId,          // one id per successful claim call
        boolean retired,
        Instant createdAt,
        Instant updatedAt
) {
    public boolean assigned() {
        return assignedTo != null;
    }

    @Override
    public String toString() {
        return "Credential{" +
                "id=" + id +
                ", partition=" + partition +
                ", assignedTo='" + assignedTo + '\'' +
                ", assignedAt=" + assignedAt +
                ", batchId='" + batchId + '\'' +
                ", retired=" + retired +
                '}';
    }
}
