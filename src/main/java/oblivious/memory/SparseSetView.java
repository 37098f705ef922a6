package oblivious.memory;

import java.util.PrimitiveIterator;

/**
 * Read-only view of a {@link SparseSet}.
 */
public interface SparseSetView {
	boolean contains(int key);

	int size();

	boolean isEmpty();

	/**
	 * Key stored at the given position of the dense array.
	 */
	int get(int position);

	/**
	 * Walks the dense array from the back. Erasing the key just returned does not skip or repeat any other
	 * key; keys added during the walk are not visited. Erasing a key not visited yet moves the last key,
	 * which was already visited, into its position, so that key is returned a second time.
	 */
	PrimitiveIterator.OfInt iterator();
}
