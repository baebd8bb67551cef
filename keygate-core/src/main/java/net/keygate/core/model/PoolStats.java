package net.keygate.core.model;

public record PoolStats(Partition partition, long total, long available, long assigned) {}
