package oblivious.memory;

import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Fixed-capacity map from integer ids to resources. A {@link SparseSet} tracks membership and a parallel
 * array holds the resources at the same dense positions; both are kept in lock-step on erase.
 * <p>
 * Handles are dense positions. They remain valid until the next erase.
 */
public class ResourcePool<V> {
	private final SparseSet ids;
	private final Object[] resources;

	public ResourcePool(int idCapacity, int capacity) {
		this(idCapacity, capacity, null);
	}

	/**
	 * @param slotFactory when not {@code null}, pre-fills every slot so that {@link #emplaceEmpty(int)} hands
	 *                    out a reusable resource instead of {@code null}
	 */
	public ResourcePool(int idCapacity, int capacity, Supplier<V> slotFactory) {
		this.ids = new SparseSet(idCapacity, capacity);
		this.resources = new Object[capacity];
		if (slotFactory != null) {
			for (int i = 0; i < capacity; i++) {
				resources[i] = slotFactory.get();
			}
		}
	}

	public InsertResult emplace(int id, V resource) {
		InsertResult result = emplaceEmpty(id);
		if (result.isInserted()) {
			resources[result.getHandle()] = resource;
		}
		return result;
	}

	/**
	 * Reserves a slot for {@code id} without touching the resource currently stored in it.
	 */
	public InsertResult emplaceEmpty(int id) {
		if (ids.contains(id))
			return InsertResult.existing(ids.indexOf(id));
		if (ids.isFull() || !ids.insert(id))
			return InsertResult.rejected();
		return InsertResult.inserted(ids.size() - 1);
	}

	public boolean erase(int id) {
		if (!ids.contains(id))
			return false;
		int position = ids.indexOf(id);
		int last = ids.size() - 1;
		Object removed = resources[position];
		resources[position] = resources[last];
		resources[last] = removed;
		ids.erase(id);
		return true;
	}

	public void clear() {
		ids.clear();
	}

	public boolean contains(int id) {
		return ids.contains(id);
	}

	public V at(int id) {
		if (!ids.contains(id))
			throw new NoSuchElementException("Resource " + id + " is not in the pool");
		return get(ids.indexOf(id));
	}

	@SuppressWarnings("unchecked")
	public V get(int handle) {
		checkHandle(handle);
		return (V) resources[handle];
	}

	public int handleOf(int id) {
		return ids.contains(id) ? ids.indexOf(id) : InsertResult.END;
	}

	public SparseSetView handles() {
		return ids;
	}

	public int size() {
		return ids.size();
	}

	public boolean isEmpty() {
		return ids.isEmpty();
	}

	public boolean isFull() {
		return ids.isFull();
	}

	public int capacity() {
		return ids.capacity();
	}

	private void checkHandle(int handle) {
		if (handle < 0 || handle >= ids.size())
			throw new IndexOutOfBoundsException("Handle " + handle + " out of [0, " + ids.size() + ")");
	}
}
