package net.keygate.web.dto;

import net.keygate.core.model.ClaimedBatch;

import java.util.List;

public record ClaimResponse(String batchId, String subject, int count, List<CredentialView> credentials) {

    public static ClaimResponse of(ClaimedBatch b) {
        return new ClaimResponse(b.batchId(), b.subject(), b.size(),
                b.credentials().stream().map(CredentialView::of).toList());
    }
}
