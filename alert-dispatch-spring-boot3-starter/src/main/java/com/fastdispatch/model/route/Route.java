package com.fastdispatch.model.route;

import com.fastdispatch.model.Fingerprint;
import com.fastdispatch.model.LabelSet;

import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 路由规则
 * 作为分组表的键时按引用比较
 */
public class Route {

    private final String name;

    /** 标签等值匹配 */
    private final Map<String, String> matchers;

    private final RouteOpts opts;

    private final Fingerprint fingerprint;

    public Route(String name, Map<String, String> matchers, RouteOpts opts) {
        this.name = name;
        this.matchers = matchers == null ? Map.of() : Map.copyOf(matchers);
        this.opts = opts;
        this.fingerprint = identity(name, this.matchers, opts);
    }

    private static Fingerprint identity(String name, Map<String, String> matchers, RouteOpts opts) {
        Map<String, String> id = new TreeMap<>();
        id.put("__route__", name == null ? "" : name);
        id.put("__receiver__", opts.getReceiver() == null ? "" : opts.getReceiver());
        id.put("__group_by__", String.join(",", new TreeSet<>(opts.getGroupBy())));
        matchers.forEach((k, v) -> id.put("match." + k, v));
        return LabelSet.of(id).fingerprint();
    }

    public boolean matches(LabelSet labels) {
        for (Map.Entry<String, String> m : matchers.entrySet()) {
            if (!m.getValue().equals(labels.get(m.getKey()))) {
                return false;
            }
        }
        return true;
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getMatchers() {
        return matchers;
    }

    public RouteOpts getOpts() {
        return opts;
    }

    public Fingerprint fingerprint() {
        return fingerprint;
    }

    @Override
    public String toString() {
        return "Route{" + name + " -> " + opts.getReceiver() + "}";
    }
}
