package oblivious.memory;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Ordered key-value map with a capacity fixed at construction. Entries are addressed by integer handles;
 * operations that cannot be served within the fixed capacity return {@link InsertResult#END} or a rejected
 * {@link InsertResult} instead of growing.
 */
public interface BoundedMap<K, V> extends Iterable<Map.Entry<K, V>> {

	/**
	 * Inserts the pair if the key is absent. An existing mapping is left unchanged.
	 */
	InsertResult insert(K key, V value);

	/**
	 * Inserts the key with a value produced by {@code valueFactory} if the key is absent.
	 */
	InsertResult emplace(K key, Supplier<? extends V> valueFactory);

	/**
	 * Inserts the key with a {@code null} value if the key is absent.
	 */
	InsertResult emplaceEmpty(K key);

	/**
	 * Inserts or overwrites the mapping.
	 * @return {@code false} if the key was absent and the map could not take it
	 */
	boolean put(K key, V value);

	boolean erase(K key);

	/**
	 * @return handle of the entry with the given key, or {@link InsertResult#END}
	 */
	int find(K key);

	boolean contains(K key);

	/**
	 * @throws java.util.NoSuchElementException if the key is absent
	 */
	V at(K key);

	K keyAt(int handle);

	V valueAt(int handle);

	void setValue(int handle, V value);

	/**
	 * Handle of the smallest key, or {@link InsertResult#END} if the map is empty.
	 */
	int first();

	/**
	 * Handle of the next key in order, or {@link InsertResult#END}.
	 */
	int next(int handle);

	int size();

	int capacity();

	boolean isEmpty();
}
