package com.kotsin.ledger.state;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Bounded set of exchange fill identifiers already applied. Identifiers are opaque
 * tokens, so ordering and truncation are lexicographic: once over capacity the
 * smallest identifiers are evicted. Immutable; {@link #plusAll} returns a new set.
 */
public final class SeenSet {

    public static final int DEFAULT_CAPACITY = 1000;

    private final TreeSet<String> ids;
    private final int capacity;

    private SeenSet(TreeSet<String> ids, int capacity) {
        this.ids = ids;
        this.capacity = capacity;
    }

    public static SeenSet empty() {
        return new SeenSet(new TreeSet<>(), DEFAULT_CAPACITY);
    }

    public static SeenSet of(Collection<String> ids) {
        return empty().plusAll(ids);
    }

    public static SeenSet of(Collection<String> ids, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        return new SeenSet(new TreeSet<>(), capacity).plusAll(ids);
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    public SeenSet plusAll(Collection<String> more) {
        TreeSet<String> next = new TreeSet<>(ids);
        if (more != null) {
            for (String id : more) {
                if (id != null) next.add(id);
            }
        }
        while (next.size() > capacity) {
            next.pollFirst();
        }
        return new SeenSet(next, capacity);
    }

    public int size() {
        return ids.size();
    }

    /** ascending order, as persisted */
    public List<String> toList() {
        return List.copyOf(ids);
    }
}
