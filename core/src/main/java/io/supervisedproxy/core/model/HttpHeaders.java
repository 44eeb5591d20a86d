package io.supervisedproxy.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Case-insensitive, multi-valued HTTP header collection.
 *
 * <p>
 * Names are stored <strong>lowercase</strong> in the order they were first
 * seen; the values of one name keep the order in which they were received, so
 * repeated headers such as {@code Set-Cookie} survive a trip through the proxy
 * intact.
 *
 * <p>
 * Instances are immutable. {@link #without(Collection)} returns a filtered
 * copy.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(Map.of());

    /** Lowercase name to its non-empty, unmodifiable value list. */
    private final Map<String, List<String>> byName;

    private HttpHeaders(Map<String, List<String>> byName) {
        this.byName = byName;
    }

    private static String key(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }

    /**
     * First value of a header, matched case-insensitively.
     *
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        List<String> values = byName.get(key(name));
        return values == null ? null : values.get(0);
    }

    /**
     * Every value of a header in received order.
     *
     * @return an unmodifiable list, empty if the header is absent
     */
    public List<String> all(String name) {
        return byName.getOrDefault(key(name), List.of());
    }

    public boolean contains(String name) {
        return byName.containsKey(key(name));
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    /** Lowercase names, in first-seen order. */
    public Set<String> names() {
        return Collections.unmodifiableSet(byName.keySet());
    }

    /**
     * Visits each name once with all of its values.
     *
     * @param action receives the lowercase name and the unmodifiable values
     */
    public void forEach(BiConsumer<String, List<String>> action) {
        byName.forEach(action);
    }

    /**
     * Drops the given names, matched case-insensitively.
     *
     * @param excluded header names to drop
     * @return a filtered copy, or this instance when none of the names is
     *         present
     */
    public HttpHeaders without(Collection<String> excluded) {
        Map<String, List<String>> kept = new LinkedHashMap<>(byName);
        boolean removed = false;
        for (String name : excluded) {
            if (kept.remove(key(name)) != null) {
                removed = true;
            }
        }
        if (!removed) {
            return this;
        }
        return kept.isEmpty() ? EMPTY : new HttpHeaders(Collections.unmodifiableMap(kept));
    }

    /** Read-only name to values view with lowercase keys. */
    public Map<String, List<String>> toMultiValueMap() {
        return Collections.unmodifiableMap(byName);
    }

    /**
     * Headers with one value per name.
     *
     * @param singleValue name to value; a {@code null} map means no headers
     */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> multi = new LinkedHashMap<>();
        singleValue.forEach((name, value) -> multi.put(name, List.of(value)));
        return ofMulti(multi);
    }

    /**
     * Headers with any number of values per name. Names that differ only in
     * case are merged, their values appended in iteration order; names without
     * values are dropped.
     *
     * @param multiValue name to values; a {@code null} map means no headers
     */
    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> merged = new LinkedHashMap<>();
        multiValue.forEach((name, values) -> {
            if (values != null && !values.isEmpty()) {
                merged.computeIfAbsent(key(name), k -> new ArrayList<>()).addAll(values);
            }
        });
        if (merged.isEmpty()) {
            return EMPTY;
        }
        merged.replaceAll((name, values) -> List.copyOf(values));
        return new HttpHeaders(Collections.unmodifiableMap(merged));
    }

    public static HttpHeaders empty() {
        return EMPTY;
    }

    @Override
    public boolean equals(Object o) {
        return o == this || (o instanceof HttpHeaders other && byName.equals(other.byName));
    }

    @Override
    public int hashCode() {
        return byName.hashCode();
    }

    @Override
    public String toString() {
        return "HttpHeaders" + byName.keySet();
    }
}
