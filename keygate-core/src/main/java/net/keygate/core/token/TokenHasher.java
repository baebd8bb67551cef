package net.keygate.core.token;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * 토큰 원문 생성과 keyed hash.
 * 저장소에는 {@link #hash(String)} 결과(HMAC-SHA256 hex)만 남는다.
 */
public final class TokenHasher {
    public static final String ALGORITHM = "HmacSHA256";
    public static final int MIN_KEY_BYTES = 32;
    public static final int SECRET_BYTES = 32;

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecretKeySpec key;

    public TokenHasher(byte[] key) {
        if (key == null || key.length < MIN_KEY_BYTES) {
            throw new IllegalArgumentException("HMAC key must be at least " + MIN_KEY_BYTES + " bytes");
        }
        this.key = new SecretKeySpec(key.clone(), ALGORITHM);
    }

    /** base64(표준 또는 url-safe) 키 문자열 */
    public static TokenHasher fromBase64(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalArgumentException("HMAC key is not configured");
        }
        String trimmed = encoded.trim();
        byte[] bytes;
        try {
            bytes = trimmed.indexOf('-') >= 0 || trimmed.indexOf('_') >= 0
                    ? Base64.getUrlDecoder().decode(trimmed)
                    : Base64.getDecoder().decode(trimmed);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("HMAC key is not valid base64", e);
        }
        return new TokenHasher(bytes);
    }

    /** 256비트 난수, base64url(패딩 없음) 43자 */
    public String newSecret() {
        byte[] buf = new byte[SECRET_BYTES];
        RANDOM.nextBytes(buf);
        return URL_ENCODER.encodeToString(buf);
    }

    public String hash(String raw) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM); // Mac은 스레드 안전하지 않음 → 호출마다 생성
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    /** 헤더에서 넘어온 원문이 발급 형식(base64url)인지 */
    public static boolean wellFormed(String raw) {
        if (raw == null || raw.isEmpty() || raw.length() > 128) return false;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            boolean ok = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-' || c == '_';
            if (!ok) return false;
        }
        return true;
    }
}
