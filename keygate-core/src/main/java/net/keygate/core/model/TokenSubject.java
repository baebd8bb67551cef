package net.keygate.core.model;

import java.time.Instant;

/** 소비에 성공한 토큰이 묶여 있던 대상 */
public record TokenSubject(Long tokenId, TokenPurpose purpose, String subject, Instant issuedAt) {

    public long subjectAsLong() {
        return Long.parseLong(subject);
    }
}
