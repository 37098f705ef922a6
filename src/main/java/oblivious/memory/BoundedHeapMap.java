package oblivious.memory;

import java.util.Comparator;

/**
 * Binary search tree laid out implicitly in a flat array of {@code 2^(height+1) - 1} slots: the children of
 * slot {@code i} are {@code 2i+1} and {@code 2i+2}. Keys are ordered as in a search tree (this is not a
 * priority heap). A key whose search path runs past the last level cannot be stored even if other slots
 * are free.
 * <p>
 * An invalid slot never has valid descendants.
 */
public class BoundedHeapMap<K, V> extends AbstractBoundedMap<K, V> {
	public static final int MAX_HEIGHT = 24;

	private final int height;
	private final int nSlots;
	private final boolean[] valid;

	@SuppressWarnings("unchecked")
	public BoundedHeapMap(int height) {
		this(height, (Comparator<? super K>) Comparator.naturalOrder());
	}

	public BoundedHeapMap(int height, Comparator<? super K> comparator) {
		super(computeSlots(height), comparator);
		this.height = height;
		this.nSlots = computeSlots(height);
		this.valid = new boolean[nSlots];
	}

	private static int computeSlots(int height) {
		if (height < 0 || height > MAX_HEIGHT)
			throw new IllegalArgumentException("Height must be in [0, " + MAX_HEIGHT + "]: " + height);
		return (1 << height + 1) - 1;
	}

	@Override
	public boolean erase(K key) {
		int leaf = find(key);
		if (leaf == InsertResult.END)
			return false;

		int leftChild = getLeftChild(leaf);
		int rightChild = getRightChild(leaf);
		boolean hasLeft = !isInvalidLeaf(leftChild);
		boolean hasRight = !isInvalidLeaf(rightChild);

		if (hasLeft && hasRight) {
			int successor = findMin(rightChild);
			keys[leaf] = keys[successor];
			values[leaf] = values[successor];
			invalidate(successor);

			// the successor has no left child, its right subtree moves up into its place
			int successorRight = getRightChild(successor);
			if (!isInvalidLeaf(successorRight))
				iterativeMove(successorRight, successor);
		} else if (hasLeft) {
			invalidate(leaf);
			iterativeMove(leftChild, leaf);
		} else if (hasRight) {
			invalidate(leaf);
			iterativeMove(rightChild, leaf);
		} else {
			invalidate(leaf);
		}
		size--;
		return true;
	}

	@Override
	public int find(K key) {
		int leaf = 0;
		while (leaf < nSlots && valid[leaf]) {
			int cmp = compare(key, keys[leaf]);
			if (cmp == 0)
				return leaf;
			leaf = cmp < 0 ? getLeftChild(leaf) : getRightChild(leaf);
		}
		return InsertResult.END;
	}

	@Override
	public int first() {
		return findMin(0);
	}

	@Override
	public int next(int handle) {
		if (isInvalidLeaf(handle))
			return InsertResult.END;

		int right = getRightChild(handle);
		if (!isInvalidLeaf(right))
			return findMin(right);

		int node = handle;
		while (node != 0) {
			int parent = getParent(node);
			if (getLeftChild(parent) == node)
				return parent;
			node = parent;
		}
		return InsertResult.END;
	}

	@Override
	public int capacity() {
		return nSlots;
	}

	public int getHeight() {
		return height;
	}

	@Override
	protected boolean isValid(int handle) {
		return !isInvalidLeaf(handle);
	}

	@Override
	protected InsertResult setupNode(K key) {
		int leaf = 0;
		while (leaf < nSlots && valid[leaf]) {
			int cmp = compare(key, keys[leaf]);
			if (cmp == 0)
				return InsertResult.existing(leaf);
			leaf = cmp < 0 ? getLeftChild(leaf) : getRightChild(leaf);
		}
		if (leaf >= nSlots)
			return InsertResult.rejected();

		valid[leaf] = true;
		keys[leaf] = key;
		size++;
		return InsertResult.inserted(leaf);
	}

	/**
	 * Moves the subtree rooted at {@code from} so that it is rooted at {@code to}, one level at a time.
	 * Source slots are invalidated as they are copied. Only valid for a {@code to} that is the parent of
	 * {@code from} and whose other subtree is empty or has just been vacated.
	 */
	private void iterativeMove(int from, int to) {
		int srcStart = from;
		int destStart = to;
		int levels = height - floorLog2(from + 1) + 1;

		for (int level = 0; level < levels; level++) {
			int nodes = 1 << level;
			for (int n = 0; n < nodes; n++) {
				int src = srcStart + n;
				int dest = destStart + n;
				if (valid[src]) {
					keys[dest] = keys[src];
					values[dest] = values[src];
					valid[dest] = true;
					invalidate(src);
				}
			}
			srcStart = getLeftChild(srcStart);
			destStart = getLeftChild(destStart);
		}
	}

	private int findMin(int leaf) {
		if (isInvalidLeaf(leaf))
			return InsertResult.END;
		int current = leaf;
		while (!isInvalidLeaf(getLeftChild(current))) {
			current = getLeftChild(current);
		}
		return current;
	}

	private void invalidate(int leaf) {
		valid[leaf] = false;
		keys[leaf] = null;
		values[leaf] = null;
	}

	private boolean isInvalidLeaf(int leaf) {
		return leaf < 0 || leaf >= nSlots || !valid[leaf];
	}

	private static int getParent(int leaf) {
		return leaf == 0 ? 0 : (leaf - 1) / 2;
	}

	private static int getLeftChild(int leaf) {
		return (leaf * 2) + 1;
	}

	private static int getRightChild(int leaf) {
		return (leaf * 2) + 2;
	}

	private static int floorLog2(int n) {
		return 31 - Integer.numberOfLeadingZeros(n);
	}
}
