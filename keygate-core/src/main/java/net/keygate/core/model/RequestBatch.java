package net.keygate.core.model;

import java.time.Instant;

/** 한 주체의 클레임 배치 요약 */
public record RequestBatch(String batchId, int count, Instant requestedAt) {}
