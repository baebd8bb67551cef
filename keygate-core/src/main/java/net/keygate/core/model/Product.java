package net.keygate.core.model;

import java.time.Duration;
import java.time.Instant;

public record Product(
        Long id,
        String name,
        String description,
        String payload,             // only ever returned through a consumed token
        int maxConcurrentSlots,
        Duration slotTtl,
        Duration tokenTtl,
        boolean active,
        String downloadFilename,
        Instant createdAt,
        Instant updatedAt
) {
    public static Product ofNew(String name, String description, String payload,
                                int maxConcurrentSlots, Duration slotTtl, Duration tokenTtl,
                                String downloadFilename) {
        return new Product(null, name, description, payload, maxConcurrentSlots,
                slotTtl, tokenTtl, true, downloadFilename, null, null);
    }

    /** 라이브 슬롯이 있는 동안 바뀌면 안 되는 필드들이 같은지 */
    public boolean samePolicyAs(Product other) {
        return other != null
                && maxConcurrentSlots == other.maxConcurrentSlots
                && java.util.Objects.equals(payload, other.payload)
                && java.util.Objects.equals(slotTtl, other.slotTtl)
                && java.util.Objects.equals(tokenTtl, other.tokenTtl);
    }

    @Override
    public String toString() {
        return "Product{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", maxConcurrentSlots=" + maxConcurrentSlots +
                ", slotTtl=" + slotTtl +
                ", tokenTtl=" + tokenTtl +
                ", active=" + active +
                '}';
    }
}
