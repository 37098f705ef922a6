package oblivious.client;

/**
 * Thrown when an access would need more stash entries than the configured capacity. The access is
 * abandoned before the stash, the position map or the server memory are modified.
 */
public class StashOverflowException extends RuntimeException {
	private final int address;
	private final int stashSize;
	private final int required;

	public StashOverflowException(int address, int stashSize, int required, int capacity) {
		super("Stash overflow while accessing block " + address + ": " + stashSize + " stashed + "
				+ required + " incoming > capacity " + capacity);
		this.address = address;
		this.stashSize = stashSize;
		this.required = required;
	}

	public int getAddress() {
		return address;
	}

	public int getStashSize() {
		return stashSize;
	}

	public int getRequired() {
		return required;
	}
}
