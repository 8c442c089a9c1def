package com.fastdispatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 标签集摘要
 * 64位 FNV-1a, 只作为查找键使用
 */
public final class Fingerprint implements Comparable<Fingerprint> {

    static final long OFFSET64 = 0xcbf29ce484222325L;

    static final long PRIME64 = 0x100000001b3L;

    private final long value;

    private Fingerprint(long value) {
        this.value = value;
    }

    public static Fingerprint of(long value) {
        return new Fingerprint(value);
    }

    /**
     * 解析无符号十进制形式（事件中记录的告警id）
     */
    public static Fingerprint fromDecimal(String s) {
        return new Fingerprint(Long.parseUnsignedLong(s.trim()));
    }

    /**
     * 与另一个摘要混合, 用于区分不同路由下相同的分组标签
     */
    public Fingerprint combine(Fingerprint other) {
        long h = OFFSET64;
        h = mix(h, value);
        h = mix(h, other.value);
        return new Fingerprint(h);
    }

    private static long mix(long h, long v) {
        for (int i = 0; i < 8; i++) {
            h ^= (v >>> (i * 8)) & 0xff;
            h *= PRIME64;
        }
        return h;
    }

    public long value() {
        return value;
    }

    public String toDecimal() {
        return Long.toUnsignedString(value);
    }

    @Override
    public int compareTo(Fingerprint o) {
        return Long.compareUnsigned(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint)) return false;
        return value == ((Fingerprint) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return String.format("%016x", value);
    }
}
