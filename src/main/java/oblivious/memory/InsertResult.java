package oblivious.memory;

/**
 * Outcome of an insertion into a fixed-capacity container: the handle of the entry holding the key and
 * whether a new entry was created. A rejected insertion carries the {@link #END} handle.
 */
public final class InsertResult {
	public static final int END = -1;
	private static final InsertResult REJECTED = new InsertResult(END, false);

	private final int handle;
	private final boolean inserted;

	private InsertResult(int handle, boolean inserted) {
		this.handle = handle;
		this.inserted = inserted;
	}

	public static InsertResult inserted(int handle) {
		return new InsertResult(handle, true);
	}

	public static InsertResult existing(int handle) {
		return new InsertResult(handle, false);
	}

	public static InsertResult rejected() {
		return REJECTED;
	}

	public int getHandle() {
		return handle;
	}

	public boolean isInserted() {
		return inserted;
	}

	public boolean isRejected() {
		return handle == END;
	}

	@Override
	public String toString() {
		return isRejected() ? "REJECTED" : "(" + handle + ", " + inserted + ")";
	}
}
