package net.keygate.core.model;

public record TokenStats(TokenPurpose purpose, long issued, long consumed, long expiredUnconsumed) {}
