package oblivious.memory;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Bounded set of integer keys in {@code [0, sparseCapacity)} with O(1) insert, erase and membership test.
 * Members are packed in a dense array of {@code denseCapacity} entries; the sparse array maps a key to its
 * position in the dense array and is only meaningful for keys that are members.
 * <p>
 * Erasing moves the last dense entry into the freed position, so iteration order is unspecified.
 */
public class SparseSet implements SparseSetView {
	private final int[] dense;
	private final int[] sparse;
	private int size;

	public SparseSet(int capacity) {
		this(capacity, capacity);
	}

	public SparseSet(int sparseCapacity, int denseCapacity) {
		if (denseCapacity < 0 || sparseCapacity < denseCapacity)
			throw new IllegalArgumentException("Sparse capacity (" + sparseCapacity
					+ ") must be >= dense capacity (" + denseCapacity + ")");
		this.dense = new int[denseCapacity];
		this.sparse = new int[sparseCapacity];
	}

	@Override
	public boolean contains(int key) {
		return key >= 0 && key < sparse.length
				&& sparse[key] < size
				&& dense[sparse[key]] == key;
	}

	/**
	 * Position of a member key in the dense array.
	 */
	public int indexOf(int key) {
		if (!contains(key))
			throw new NoSuchElementException("Key " + key + " is not in the set");
		return sparse[key];
	}

	@Override
	public int get(int position) {
		if (position < 0 || position >= size)
			throw new IndexOutOfBoundsException("Position " + position + " out of [0, " + size + ")");
		return dense[position];
	}

	/**
	 * @return {@code false} if the key was already present, is outside the key domain or the set is full.
	 */
	public boolean insert(int key) {
		if (key < 0 || key >= sparse.length || size == dense.length || contains(key))
			return false;
		sparse[key] = size;
		dense[size] = key;
		size++;
		return true;
	}

	public boolean erase(int key) {
		if (!contains(key))
			return false;
		int position = sparse[key];
		int last = dense[size - 1];
		dense[position] = last;
		sparse[last] = position;
		size--;
		return true;
	}

	public void clear() {
		size = 0;
	}

	@Override
	public int size() {
		return size;
	}

	@Override
	public boolean isEmpty() {
		return size == 0;
	}

	public int capacity() {
		return dense.length;
	}

	public boolean isFull() {
		return size == dense.length;
	}

	@Override
	public PrimitiveIterator.OfInt iterator() {
		return new PrimitiveIterator.OfInt() {
			private int index = size;

			@Override
			public boolean hasNext() {
				if (index > size)
					index = size;
				return index > 0;
			}

			@Override
			public int nextInt() {
				if (!hasNext())
					throw new NoSuchElementException();
				return dense[--index];
			}
		};
	}

	public int[] toArray() {
		return Arrays.copyOf(dense, size);
	}

	@Override
	public String toString() {
		return Arrays.toString(toArray());
	}
}
