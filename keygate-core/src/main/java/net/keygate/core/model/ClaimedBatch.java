package net.keygate.core.model;

import java.util.List;

public record ClaimedBatch(String batchId, String subject, List<Credential> credentials) {
    public ClaimedBatch {
        credentials = List.copyOf(credentials);
    }

    public int size() { return credentials.size(); }
}
