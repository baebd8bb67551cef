package net.keygate.web.dto;

import net.keygate.core.model.Handoff;

import java.time.Instant;
import java.util.Map;

public record HandoffResponse(String token, Instant expiresAt, String fetchUrl, Map<String, String> variables) {

    public static HandoffResponse of(Handoff h) {
        return new HandoffResponse(h.token(), h.expiresAt(), h.fetchUrl(), h.variables());
    }
}
