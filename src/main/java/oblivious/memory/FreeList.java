package oblivious.memory;

/**
 * Array-backed stack of free slot indexes.
 */
public class FreeList {
	private final int[] slots;
	private int count;

	public FreeList(int capacity) {
		this.slots = new int[capacity];
	}

	public void push(int slot) {
		if (count == slots.length)
			throw new IllegalStateException("Free list is full");
		slots[count++] = slot;
	}

	public int pop() {
		if (count == 0)
			throw new IllegalStateException("Free list is empty");
		return slots[--count];
	}

	public int size() {
		return count;
	}

	public boolean isEmpty() {
		return count == 0;
	}
}
