package oblivious.client;

import oblivious.utils.Operation;

/**
 * Receives engine events. Callbacks run synchronously on the accessing thread.
 */
public interface ORAMListener {
	/**
	 * Called at the end of {@link PathORAM#initialize(long)}; every block written before is forgotten.
	 */
	default void initialized() {
	}

	default void accessCompleted(Operation op, int address, int stashSize) {
	}

	default void stashOverflow(StashOverflowException cause) {
	}
}
