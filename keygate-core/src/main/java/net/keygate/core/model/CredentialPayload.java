package net.keygate.core.model;

public record CredentialPayload(long credentialId, Partition partition, String payload) {
    @Override
    public String toString() {
        return "CredentialPayload{credentialId=" + credentialId + ", partition=" + partition + '}';
    }
}
