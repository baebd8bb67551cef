package net.keygate.core.model;

import java.util.Locale;

/** 크리덴셜 풀의 상호 배타적 구획. 클레임은 한 구획 안에서만 행을 본다. */
public enum Partition {
    USER_REQUESTABLE("user-requestable"),
    AUTO_ASSIGN("auto-assign"),
    RESERVED("reserved");

    private final String label;

    Partition(String label) {
        this.label = label;
    }

    public String label() { return label; }

    public String code() { return name(); }

    /** enum 이름("AUTO_ASSIGN")과 라벨("auto-assign") 모두 허용 */
    public static Partition from(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("partition is required");
        String key = s.trim();
        for (Partition p : values()) {
            if (p.name().equalsIgnoreCase(key) || p.label.equalsIgnoreCase(key)) return p;
        }
        // legacy import name for the auto-assign pool
        if ("INSTANCE_AUTO_ASSIGN".equals(key.toUpperCase(Locale.ROOT))) return AUTO_ASSIGN;
        throw new IllegalArgumentException("Unknown partition: " + s);
    }
}
