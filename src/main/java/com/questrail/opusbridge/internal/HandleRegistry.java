package com.questrail.opusbridge.internal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HandleRegistry
 * =============================================================================
 * Table mapping opaque handle tokens to the resources they stand for.
 *
 * <h2>Tokens, not addresses</h2>
 * <p>Callers hold keys into this table, never native addresses. Once
 * {@link #remove(long)} has run for a token, every later {@link #lookup(long)}
 * or {@link #remove(long)} for it returns empty.</p>
 *
 * <h2>Ownership</h2>
 * <p>The registry owns the mapping, not the resource. Whoever removes an
 * entry is responsible for releasing the resource it returns, exactly once.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Registration, lookup and removal of distinct tokens may happen
 * concurrently. Removal is atomic: if two threads remove the same token, at
 * most one of them receives the resource.</p>
 *
 * @param <T> the resource type
 */
public final class HandleRegistry<T>
{
    private final HandleSequence sequence;
    private final ConcurrentHashMap<Long, T> live = new ConcurrentHashMap<>();

    public HandleRegistry(HandleSequence sequence)
    {
        this.sequence = Objects.requireNonNull(sequence, "sequence");
    }

    /**
     * Stores {@code resource} under a freshly issued token and returns it.
     */
    public long register(T resource)
    {
        Objects.requireNonNull(resource, "resource");
        long token = sequence.next();
        live.put(token, resource);
        return token;
    }

    /**
     * Returns the resource for a live token, or empty if the token was never
     * issued by this registry or has been removed.
     */
    public Optional<T> lookup(long token)
    {
        return Optional.ofNullable(live.get(token));
    }

    /**
     * Removes a live token and returns its resource, or empty if it was not live.
     */
    public Optional<T> remove(long token)
    {
        return Optional.ofNullable(live.remove(token));
    }

    /**
     * Removes every live token and returns the removed entries in token order.
     */
    public Map<Long, T> drain()
    {
        Map<Long, T> drained = new LinkedHashMap<>();
        live.keySet().stream().sorted().forEach(token -> {
            T resource = live.remove(token);
            if (resource != null) {
                drained.put(token, resource);
            }
        });
        return drained;
    }

    public int size()
    {
        return live.size();
    }
}
