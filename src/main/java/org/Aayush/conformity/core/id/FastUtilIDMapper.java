package org.Aayush.conformity.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collection;

/**
 * {@link IDMapper} backed by a fastutil open hash map.
 *
 * <p>Immutable after construction and safe for concurrent reads, which is what the
 * per-node conformity workers rely on.</p>
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<String> forward;
    // index -> node id, no boxing on the reverse path
    private final String[] reverse;

    /**
     * Builds the mapper from distinct node ids.
     *
     * @throws IllegalArgumentException on null input, null ids or duplicates.
     */
    public FastUtilIDMapper(Collection<String> nodeIds) {
        if (nodeIds == null) {
            throw new IllegalArgumentException("nodeIds cannot be null");
        }
        int size = nodeIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        int next = 0;
        for (String nodeId : nodeIds) {
            if (nodeId == null) {
                throw new IllegalArgumentException("node id cannot be null");
            }
            if (forward.containsKey(nodeId)) {
                throw new IllegalArgumentException("Duplicate node id detected: " + nodeId);
            }
            forward.put(nodeId, next);
            reverse[next] = nodeId;
            next++;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String nodeId) throws UnknownIDException {
        int id = forward.getInt(nodeId);
        if (id == MISSING) {
            throw new UnknownIDException("Node id not found: " + nodeId);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (internalId < 0 || internalId >= reverse.length) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String nodeId) {
        return forward.containsKey(nodeId);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
