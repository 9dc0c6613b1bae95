package org.Aayush.conformity.core.id;

import lombok.experimental.StandardException;

import java.util.Collection;

/**
 * Bidirectional mapping between snapshot node ids and dense internal indices.
 *
 * <p>One mapper is built per window snapshot; indices are always the dense range
 * {@code 0..size-1} in snapshot iteration order.</p>
 */
public interface IDMapper {

    /**
     * Converts a snapshot node id to its dense index.
     * @param nodeId the snapshot node id.
     * @return the internal index.
     * @throws UnknownIDException If the node is not part of the snapshot.
     */
    int toInternal(String nodeId) throws UnknownIDException;

    /**
     * Converts a dense index back to its snapshot node id.
     * @param internalId internal index.
     * @return the snapshot node id.
     * @throws IndexOutOfBoundsException If the index is outside the mapping.
     */
    String toExternal(int internalId);

    /**
     * Checks whether a snapshot node id is mapped.
     *
     * @param nodeId node id to test.
     * @return true when the node id is present.
     */
    boolean containsExternal(String nodeId);

    /**
     * Returns number of mapped nodes.
     */
    int size();

    /**
     * Exception thrown when a node id is not part of the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Creates the default immutable mapper, assigning indices in iteration order.
     *
     * @param nodeIds distinct, non-null node ids.
     * @return an immutable IDMapper instance.
     */
    static IDMapper denseOf(Collection<String> nodeIds) {
        return new FastUtilIDMapper(nodeIds);
    }
}
