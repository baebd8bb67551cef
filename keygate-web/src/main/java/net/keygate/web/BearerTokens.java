package net.keygate.web;

import net.keygate.core.error.InvalidTokenException;
import net.keygate.core.error.RejectionReason;

import java.util.Locale;

/** {@code Authorization: Bearer <raw>} 파싱. 형식이 틀리면 토큰 거절과 같은 응답. */
public final class BearerTokens {
    private static final String PREFIX = "bearer ";

    private BearerTokens() {}

    public static String extract(String authorization) {
        if (authorization == null || authorization.length() <= PREFIX.length()
                || !authorization.substring(0, PREFIX.length()).toLowerCase(Locale.ROOT).equals(PREFIX)) {
            throw new InvalidTokenException(RejectionReason.MALFORMED);
        }
        String raw = authorization.substring(PREFIX.length()).trim();
        if (raw.isEmpty()) throw new InvalidTokenException(RejectionReason.MALFORMED);
        return raw;
    }
}
