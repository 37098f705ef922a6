package oblivious.memory;

import java.util.AbstractMap;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Shared logic of the array-backed ordered maps: handle validation, overwriting insertion and in-order
 * iteration over {@link #first()} and {@link #next(int)}.
 */
public abstract class AbstractBoundedMap<K, V> implements BoundedMap<K, V> {
	protected final Object[] keys;
	protected final Object[] values;
	protected final Comparator<? super K> comparator;
	protected int size;

	protected AbstractBoundedMap(int slots, Comparator<? super K> comparator) {
		this.keys = new Object[slots];
		this.values = new Object[slots];
		this.comparator = comparator;
	}

	protected abstract boolean isValid(int handle);

	protected abstract InsertResult setupNode(K key);

	@Override
	public InsertResult insert(K key, V value) {
		InsertResult result = setupNode(key);
		if (result.isInserted()) {
			values[result.getHandle()] = value;
		}
		return result;
	}

	@Override
	public InsertResult emplace(K key, Supplier<? extends V> valueFactory) {
		InsertResult result = setupNode(key);
		if (result.isInserted()) {
			values[result.getHandle()] = valueFactory.get();
		}
		return result;
	}

	@Override
	public InsertResult emplaceEmpty(K key) {
		InsertResult result = setupNode(key);
		if (result.isInserted()) {
			values[result.getHandle()] = null;
		}
		return result;
	}

	@Override
	public boolean put(K key, V value) {
		InsertResult result = setupNode(key);
		if (result.isRejected())
			return false;
		values[result.getHandle()] = value;
		return true;
	}

	@Override
	public boolean contains(K key) {
		return find(key) != InsertResult.END;
	}

	@Override
	public V at(K key) {
		int handle = find(key);
		if (handle == InsertResult.END)
			throw new NoSuchElementException("Key " + key + " is not in the map");
		return valueAt(handle);
	}

	@Override
	@SuppressWarnings("unchecked")
	public K keyAt(int handle) {
		checkHandle(handle);
		return (K) keys[handle];
	}

	@Override
	@SuppressWarnings("unchecked")
	public V valueAt(int handle) {
		checkHandle(handle);
		return (V) values[handle];
	}

	@Override
	public void setValue(int handle, V value) {
		checkHandle(handle);
		values[handle] = value;
	}

	@Override
	public int size() {
		return size;
	}

	@Override
	public boolean isEmpty() {
		return size == 0;
	}

	@Override
	public Iterator<Map.Entry<K, V>> iterator() {
		return new Iterator<Map.Entry<K, V>>() {
			private int current = first();

			@Override
			public boolean hasNext() {
				return current != InsertResult.END;
			}

			@Override
			public Map.Entry<K, V> next() {
				if (current == InsertResult.END)
					throw new NoSuchElementException();
				Map.Entry<K, V> entry = new AbstractMap.SimpleImmutableEntry<>(keyAt(current), valueAt(current));
				current = AbstractBoundedMap.this.next(current);
				return entry;
			}
		};
	}

	@SuppressWarnings("unchecked")
	protected int compare(K lhs, Object rhs) {
		return comparator.compare(lhs, (K) rhs);
	}

	private void checkHandle(int handle) {
		if (!isValid(handle))
			throw new IndexOutOfBoundsException("Invalid handle " + handle);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		for (Map.Entry<K, V> entry : this) {
			if (sb.length() > 1)
				sb.append(", ");
			sb.append(entry.getKey()).append('=').append(entry.getValue());
		}
		return sb.append('}').toString();
	}
}
