package net.keygate.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 부팅 스크립트용 핸드오프. 템플릿 렌더러는 {@link #variables()}만 치환 변수로 쓴다.
 */
public record Handoff(TokenPurpose purpose, String subject, String token, Instant expiresAt, String fetchUrl,
                      Map<String, String> extra) {

    public Handoff {
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public Map<String, String> variables() {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("token", token);
        vars.put("fetch_url", fetchUrl);
        vars.put("expires_at", expiresAt.toString());
        vars.putAll(extra);
        return vars;
    }

    @Override
    public String toString() {
        return "Handoff{purpose=" + purpose + ", subject='" + subject + "', expiresAt=" + expiresAt
                + ", fetchUrl='" + fetchUrl + "'}";
    }
}
