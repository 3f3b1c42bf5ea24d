package org.bpmnml.generator;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Hands out XML identifiers of the form {@code <base>_<n>}.
 * <p>
 * Counters are kept per sanitized base name and start at 1. Ids requested through
 * {@link #idFor(Object, String)} are memoized by object identity, so two distinct
 * nodes named "A" get "A_1" and "A_2" while asking twice for the same node
 * returns the same id.
 * <p>
 * A registry belongs to a single generator run and is not thread-safe.
 */
public class IdRegistry {
    private static final Pattern INVALID_ID_CHARS = Pattern.compile("[^A-Za-z0-9_]");

    private final Map<String, Integer> counters = new HashMap<>();
    private final Map<Object, String> idsByEntity = new IdentityHashMap<>();

    public static String sanitize(String base) {
        return INVALID_ID_CHARS.matcher(base == null ? "" : base).replaceAll("_");
    }

    /**
     * @return a fresh id for the given base name
     */
    public String nextId(String base) {
        String sanitized = sanitize(base);
        int next = counters.merge(sanitized, 1, Integer::sum);
        return sanitized + "_" + next;
    }

    /**
     * @return the id of the entity, assigning one from the base name on first request
     */
    public String idFor(Object entity, String base) {
        return idsByEntity.computeIfAbsent(entity, key -> nextId(base));
    }

    /**
     * @return the id already assigned to the entity, or null
     */
    public String existingId(Object entity) {
        return idsByEntity.get(entity);
    }
}
