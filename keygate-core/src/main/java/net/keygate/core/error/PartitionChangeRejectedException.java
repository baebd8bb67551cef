package net.keygate.core.error;

public class PartitionChangeRejectedException extends KeygateException {

    private final long credentialId;

    public PartitionChangeRejectedException(long credentialId, String assignedTo) {
        super("Credential " + credentialId + " is assigned to " + assignedTo
                + "; release it before changing its partition");
        this.credentialId = credentialId;
    }

    public long getCredentialId() { return credentialId; }
}
