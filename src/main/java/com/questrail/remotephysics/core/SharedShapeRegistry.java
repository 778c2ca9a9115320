package com.questrail.remotephysics.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.IntConsumer;

/**
 * SharedShapeRegistry
 * -----------------------------------------------------------------------------
 * Scene-scoped table of shapes that many actors share, keyed by an archetype
 * (for example "default avatar capsule").
 *
 * <p>The first {@link #acquire(Object, IntConsumer)} for a key allocates a
 * shape ID and invokes the creator with it, which is expected to send the
 * add-shape command. Later acquisitions for the same key return the same ID
 * without creating anything. Each scene owns its own registry; there is no
 * process-wide shape state.</p>
 *
 * @param <K> archetype key type
 */
public final class SharedShapeRegistry<K>
{
    private final Object lock = new Object();

    private final Map<K, Integer> shapeIds = new HashMap<>();
    private int nextShapeId;

    /**
     * @param firstShapeId first ID handed out; IDs increase by one per new archetype
     */
    public SharedShapeRegistry(int firstShapeId)
    {
        this.nextShapeId = firstShapeId;
    }

    public int acquire(K archetype, IntConsumer creator)
    {
        Objects.requireNonNull(archetype, "archetype");
        Objects.requireNonNull(creator, "creator");

        final int shapeId;
        synchronized (lock) {
            Integer existing = shapeIds.get(archetype);
            if (existing != null) {
                return existing;
            }
            shapeId = nextShapeId;

            // Inside the lock: a concurrent acquire must not observe the ID
            // before the shape has been created. A creator that throws leaves
            // the archetype unbound and the ID free for the next attempt.
            creator.accept(shapeId);

            nextShapeId++;
            shapeIds.put(archetype, shapeId);
        }
        return shapeId;
    }

    public OptionalInt lookup(K archetype)
    {
        synchronized (lock) {
            Integer id = shapeIds.get(archetype);
            return id == null ? OptionalInt.empty() : OptionalInt.of(id);
        }
    }

    /**
     * Forgets an archetype. The caller is responsible for removing the shape
     * from the remote engine.
     *
     * @return the ID the archetype was bound to, if any
     */
    public OptionalInt release(K archetype)
    {
        synchronized (lock) {
            Integer id = shapeIds.remove(archetype);
            return id == null ? OptionalInt.empty() : OptionalInt.of(id);
        }
    }

    public int size()
    {
        synchronized (lock) {
            return shapeIds.size();
        }
    }
}
