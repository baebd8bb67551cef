package net.keygate.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import net.keygate.core.model.AcquireResult;

import java.time.Instant;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AcquireResponse(String status, Long slotId, String token, Instant expiresAt,
                              String reason, int active, int max, Long retryAfter) {

    public static AcquireResponse of(AcquireResult r) {
        return new AcquireResponse(
                r.status().name().toLowerCase(Locale.ROOT),
                r.slotId(),
                r.token(),
                r.expiresAt(),
                r.reason() == null ? null : r.reason().name().toLowerCase(Locale.ROOT),
                r.active(),
                r.max(),
                r.retryAfter() == null ? null : r.retryAfter().toSeconds());
    }
}
