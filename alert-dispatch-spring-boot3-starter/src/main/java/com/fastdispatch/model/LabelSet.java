package com.fastdispatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 不可变标签集, 按标签名排序
 */
public final class LabelSet implements Comparable<LabelSet> {

    private static final byte SEPARATOR = (byte) 0xff;

    public static final LabelSet EMPTY = new LabelSet(new TreeMap<>());

    private final SortedMap<String, String> labels;

    private final Fingerprint fingerprint;

    private LabelSet(TreeMap<String, String> labels) {
        this.labels = Collections.unmodifiableSortedMap(labels);
        this.fingerprint = hash(this.labels);
    }

    @JsonCreator
    public static LabelSet of(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return EMPTY;
        }
        return new LabelSet(new TreeMap<>(labels));
    }

    public static LabelSet of(String... kv) {
        if (kv.length % 2 != 0) {
            throw new IllegalArgumentException("label pairs must be even, got " + kv.length);
        }
        TreeMap<String, String> m = new TreeMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put(kv[i], kv[i + 1]);
        }
        return new LabelSet(m);
    }

    /**
     * 取出指定名称的子集, 不存在的标签忽略
     */
    public LabelSet subset(Collection<String> names) {
        TreeMap<String, String> m = new TreeMap<>();
        for (String n : names) {
            String v = labels.get(n);
            if (v != null) {
                m.put(n, v);
            }
        }
        return m.isEmpty() ? EMPTY : new LabelSet(m);
    }

    public String get(String name) {
        return labels.get(name);
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public int size() {
        return labels.size();
    }

    @JsonValue
    public Map<String, String> asMap() {
        return labels;
    }

    public Fingerprint fingerprint() {
        return fingerprint;
    }

    private static Fingerprint hash(SortedMap<String, String> labels) {
        long h = Fingerprint.OFFSET64;
        for (Map.Entry<String, String> e : labels.entrySet()) {
            h = add(h, e.getKey().getBytes(StandardCharsets.UTF_8));
            h = add(h, SEPARATOR);
            h = add(h, e.getValue().getBytes(StandardCharsets.UTF_8));
            h = add(h, SEPARATOR);
        }
        return Fingerprint.of(h);
    }

    private static long add(long h, byte[] bytes) {
        for (byte b : bytes) {
            h = add(h, b);
        }
        return h;
    }

    private static long add(long h, byte b) {
        h ^= b & 0xff;
        h *= Fingerprint.PRIME64;
        return h;
    }

    /**
     * 逐对比较排序后的 (名, 值), 前缀较短者在前
     */
    @Override
    public int compareTo(LabelSet o) {
        Iterator<Map.Entry<String, String>> a = labels.entrySet().iterator();
        Iterator<Map.Entry<String, String>> b = o.labels.entrySet().iterator();
        while (a.hasNext() && b.hasNext()) {
            Map.Entry<String, String> x = a.next();
            Map.Entry<String, String> y = b.next();
            int c = x.getKey().compareTo(y.getKey());
            if (c != 0) {
                return c;
            }
            c = x.getValue().compareTo(y.getValue());
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(labels.size(), o.labels.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelSet)) return false;
        return labels.equals(((LabelSet) o).labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return labels.toString();
    }
}
