package oblivious.memory;

import java.util.Comparator;

/**
 * Binary search tree over a pool of {@code capacity} node slots. Each slot carries parent, left and right
 * links and a validity flag; free slots are handed out and reclaimed through a {@link FreeList}. The tree
 * is not rebalanced.
 */
public class BoundedTreeMap<K, V> extends AbstractBoundedMap<K, V> {
	private static final int NONE = InsertResult.END;

	private final int[] parent;
	private final int[] left;
	private final int[] right;
	private final boolean[] valid;
	private final FreeList freeNodes;
	private int root;

	@SuppressWarnings("unchecked")
	public BoundedTreeMap(int capacity) {
		this(capacity, (Comparator<? super K>) Comparator.naturalOrder());
	}

	public BoundedTreeMap(int capacity, Comparator<? super K> comparator) {
		super(capacity, comparator);
		if (capacity < 1)
			throw new IllegalArgumentException("Capacity must be positive: " + capacity);
		this.parent = new int[capacity];
		this.left = new int[capacity];
		this.right = new int[capacity];
		this.valid = new boolean[capacity];
		this.freeNodes = new FreeList(capacity);
		this.root = NONE;
		for (int i = capacity - 1; i >= 0; i--) {
			pushFree(i);
		}
	}

	@Override
	public boolean erase(K key) {
		int id = findExact(key);
		if (isInvalidNode(id))
			return false;

		boolean hasLeft = !isInvalidNode(left[id]);
		boolean hasRight = !isInvalidNode(right[id]);

		if (hasLeft && hasRight) {
			int successor = findMin(right[id]);
			int oldSuccessorRight = right[successor];

			moveNode(successor, id, false, false);

			// the successor's right subtree lost its parent link; a temporary node marks where it belongs
			if (!isInvalidNode(oldSuccessorRight)) {
				@SuppressWarnings("unchecked")
				K subtreeKey = (K) keys[oldSuccessorRight];
				int temp = setupNode(subtreeKey).getHandle();
				int tempParent = parent[temp];

				parent[oldSuccessorRight] = tempParent;
				if (left[tempParent] == temp) {
					left[tempParent] = oldSuccessorRight;
				} else {
					right[tempParent] = oldSuccessorRight;
				}
				pushFree(temp);
				size--;
			}
		} else if (hasLeft) {
			moveNode(left[id], id, true, true);
		} else if (hasRight) {
			moveNode(right[id], id, true, true);
		} else {
			if (id == root) {
				root = NONE;
			} else if (left[parent[id]] == id) {
				left[parent[id]] = NONE;
			} else {
				right[parent[id]] = NONE;
			}
			pushFree(id);
		}
		size--;
		return true;
	}

	@Override
	public int find(K key) {
		return findExact(key);
	}

	@Override
	public int first() {
		return findMin(root);
	}

	@Override
	public int next(int handle) {
		if (isInvalidNode(handle))
			return NONE;
		if (!isInvalidNode(right[handle]))
			return findMin(right[handle]);

		int node = handle;
		while (parent[node] != NONE) {
			int p = parent[node];
			if (left[p] == node)
				return p;
			node = p;
		}
		return NONE;
	}

	@Override
	public int capacity() {
		return valid.length;
	}

	/**
	 * Number of slots still available for new keys.
	 */
	public int available() {
		return freeNodes.size();
	}

	@Override
	protected boolean isValid(int handle) {
		return !isInvalidNode(handle);
	}

	@Override
	protected InsertResult setupNode(K key) {
		if (freeNodes.isEmpty()) {
			int existing = findExact(key);
			return existing == NONE ? InsertResult.rejected() : InsertResult.existing(existing);
		}

		if (isInvalidNode(root)) {
			int id = popFree();
			root = id;
			keys[id] = key;
			size++;
			return InsertResult.inserted(id);
		}

		int nearest = findNearest(key);
		int cmp = compare(key, keys[nearest]);
		if (cmp == 0)
			return InsertResult.existing(nearest);

		int id = popFree();
		parent[id] = nearest;
		keys[id] = key;
		if (cmp < 0) {
			left[nearest] = id;
		} else {
			right[nearest] = id;
		}
		size++;
		return InsertResult.inserted(id);
	}

	/**
	 * Moves node {@code from} into the place of node {@code to}, which is freed. Unless asked to keep its own
	 * subtrees, {@code from} adopts the children of {@code to}.
	 */
	private void moveNode(int from, int to, boolean keepLeftSubtree, boolean keepRightSubtree) {
		int fromParent = parent[from];
		if (left[fromParent] == from) {
			left[fromParent] = NONE;
		} else {
			right[fromParent] = NONE;
		}

		parent[from] = parent[to];

		if (!keepLeftSubtree) {
			left[from] = left[to];
			if (!isInvalidNode(left[to]))
				parent[left[to]] = from;
		}
		if (!keepRightSubtree) {
			right[from] = right[to];
			if (!isInvalidNode(right[to]))
				parent[right[to]] = from;
		}

		if (to != root) {
			int toParent = parent[to];
			if (left[toParent] == to) {
				left[toParent] = from;
			} else {
				right[toParent] = from;
			}
		} else {
			root = from;
		}

		pushFree(to);
	}

	private int findExact(K key) {
		int current = root;
		while (!isInvalidNode(current)) {
			int cmp = compare(key, keys[current]);
			if (cmp == 0)
				return current;
			current = cmp < 0 ? left[current] : right[current];
		}
		return NONE;
	}

	// Either the node holding the key or the node that would become its parent
	private int findNearest(K key) {
		int current = root;
		int previous = NONE;
		while (!isInvalidNode(current)) {
			previous = current;
			int cmp = compare(key, keys[current]);
			if (cmp == 0)
				return current;
			current = cmp < 0 ? left[current] : right[current];
		}
		return previous;
	}

	private int findMin(int node) {
		if (isInvalidNode(node))
			return NONE;
		int current = node;
		while (!isInvalidNode(left[current])) {
			current = left[current];
		}
		return current;
	}

	private boolean isInvalidNode(int node) {
		return node < 0 || node >= valid.length || !valid[node];
	}

	private int popFree() {
		int node = freeNodes.pop();
		valid[node] = true;
		return node;
	}

	private void pushFree(int node) {
		freeNodes.push(node);
		valid[node] = false;
		parent[node] = NONE;
		left[node] = NONE;
		right[node] = NONE;
		keys[node] = null;
		values[node] = null;
	}
}
