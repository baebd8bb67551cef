package net.keygate.core.error;

import net.keygate.core.model.Partition;

public class InsufficientResourcesException extends KeygateException {

    private final Partition partition;
    private final int requested;
    private final int available;

    public InsufficientResourcesException(Partition partition, int requested, int available) {
        super("Not enough unassigned credentials in " + partition.label()
                + ": requested " + requested + ", available " + available);
        this.partition = partition;
        this.requested = requested;
        this.available = available;
    }

    public Partition getPartition() { return partition; }
    public int getRequested() { return requested; }
    public int getAvailable() { return available; }
}
