package net.keygate.web.dto;

import net.keygate.core.model.Credential;

import java.time.Instant;

/** payload는 싣지 않는다. 수령은 핸드오프 토큰으로만. */
public record CredentialView(long id, String partition, String assignedTo, Instant assignedAt, String batchId) {

    public static CredentialView of(Credential c) {
        return new CredentialView(c.id(), c.partition().label(), c.assignedTo(), c.assignedAt(), c.batchId());
    }
}
