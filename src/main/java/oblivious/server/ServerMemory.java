package oblivious.server;

import oblivious.client.structure.Bucket;

/**
 * Untrusted storage holding the bucket tree in level order (bucket 0 is the root). Every request names
 * the bucket it touches, so an implementation sees exactly the physical access pattern.
 */
public interface ServerMemory {
	int getBucketCount();

	/**
	 * Fills {@code bucket} with the content stored at {@code location}.
	 */
	void readBucket(int location, Bucket bucket);

	void writeBucket(int location, Bucket bucket);
}
