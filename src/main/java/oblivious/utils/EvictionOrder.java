package oblivious.utils;

/**
 * Order in which stash-resident candidates are considered when more than a bucket's worth of blocks can
 * be evicted to the same node.
 */
public enum EvictionOrder {
	/**
	 * Candidates are taken in stash iteration order.
	 */
	STASH_ORDER,
	/**
	 * Candidates are shuffled with the engine's path generator before the first bucket-size entries are taken.
	 */
	SHUFFLED
}
