package net.keygate.core.spi;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** 오퍼레이션 하나의 결과. details의 null 값은 빠진다. */
public record AuditEvent(Instant at, String action, String outcome, String subject, Map<String, Object> details) {

    public AuditEvent {
        Map<String, Object> m = new LinkedHashMap<>();
        if (details != null) {
            details.forEach((k, v) -> {
                if (k != null && v != null) m.put(k, v);
            });
        }
        details = Collections.unmodifiableMap(m);
    }

    public static AuditEvent of(Instant at, String action, String outcome, String subject) {
        return new AuditEvent(at, action, outcome, subject, Map.of());
    }
}
