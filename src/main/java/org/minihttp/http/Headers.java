package org.minihttp.http;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Header fields keyed by case-insensitive name, kept in insertion order.
 * <p>
 * The spelling of the first occurrence of a name is the one written back out.
 * A read-only view is obtained with {@link #readOnly()}; mutators on it throw
 * {@link UnsupportedOperationException}.
 */
public final class Headers implements Iterable<Map.Entry<String, String>> {

    // lower-cased name -> (name as first seen, value)
    private final Map<String, Map.Entry<String, String>> fields;
    private final boolean readOnly;

    public Headers() {
        this(new LinkedHashMap<>(), false);
    }

    private Headers(Map<String, Map.Entry<String, String>> fields, boolean readOnly) {
        this.fields = fields;
        this.readOnly = readOnly;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private void checkWritable() {
        if (readOnly) throw new UnsupportedOperationException("headers are read-only");
    }

    /** Replaces any existing value, keeping the original position and spelling. */
    public Headers set(String name, String value) {
        checkWritable();
        String k = key(name);
        Map.Entry<String, String> old = fields.get(k);
        String spelled = old == null ? name : old.getKey();
        fields.put(k, new AbstractMap.SimpleImmutableEntry<>(spelled, value));
        return this;
    }

    /** Adds a value, resolving a repeated name with the given policy. */
    public Headers add(String name, String value, DuplicateHeaderPolicy policy) {
        checkWritable();
        Map.Entry<String, String> old = fields.get(key(name));
        if (old != null && policy == DuplicateHeaderPolicy.JOIN) {
            return set(name, old.getValue() + ", " + value);
        }
        return set(name, value);
    }

    public Headers remove(String name) {
        checkWritable();
        fields.remove(key(name));
        return this;
    }

    /** @return the value for the name in any letter case, or {@code null}. */
    public String get(String name) {
        if (name == null) return null;
        Map.Entry<String, String> e = fields.get(key(name));
        return e == null ? null : e.getValue();
    }

    public boolean contains(String name) {
        return name != null && fields.containsKey(key(name));
    }

    /**
     * @return true if the comma-separated value of {@code name} holds {@code token},
     *         compared case-insensitively (e.g. {@code Connection: keep-alive, Upgrade}).
     */
    public boolean hasToken(String name, String token) {
        String v = get(name);
        if (v == null) return false;
        for (String part : v.split(",")) {
            if (part.trim().equalsIgnoreCase(token)) return true;
        }
        return false;
    }

    public int size() { return fields.size(); }

    public boolean isEmpty() { return fields.isEmpty(); }

    /** @return (name, value) pairs in insertion order. */
    public List<Map.Entry<String, String>> entries() {
        return Collections.unmodifiableList(new ArrayList<>(fields.values()));
    }

    @Override
    public Iterator<Map.Entry<String, String>> iterator() {
        return entries().iterator();
    }

    /** @return an independent, writable copy. */
    public Headers copy() {
        return new Headers(new LinkedHashMap<>(fields), false);
    }

    /** @return a read-only snapshot that later changes to this instance do not affect. */
    public Headers readOnly() {
        return readOnly ? this : new Headers(new LinkedHashMap<>(fields), true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Headers)) return false;
        return entries().equals(((Headers) o).entries());
    }

    @Override
    public int hashCode() {
        return entries().hashCode();
    }

    @Override
    public String toString() {
        return entries().toString();
    }
}
