package oblivious.server;

import oblivious.client.structure.Bucket;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records the bucket locations requested from the wrapped memory, in the order a passive observer of
 * the server would see them.
 */
public class ObservedServerMemory implements ServerMemory {
	private final ServerMemory serverMemory;
	private final List<Integer> readLocations;
	private final List<Integer> writtenLocations;
	private final List<Integer> accessedLocations;

	public ObservedServerMemory(ServerMemory serverMemory) {
		this.serverMemory = serverMemory;
		this.readLocations = new ArrayList<>();
		this.writtenLocations = new ArrayList<>();
		this.accessedLocations = new ArrayList<>();
	}

	@Override
	public int getBucketCount() {
		return serverMemory.getBucketCount();
	}

	@Override
	public void readBucket(int location, Bucket bucket) {
		readLocations.add(location);
		accessedLocations.add(location);
		serverMemory.readBucket(location, bucket);
	}

	@Override
	public void writeBucket(int location, Bucket bucket) {
		writtenLocations.add(location);
		accessedLocations.add(location);
		serverMemory.writeBucket(location, bucket);
	}

	public List<Integer> getReadLocations() {
		return Collections.unmodifiableList(readLocations);
	}

	public List<Integer> getWrittenLocations() {
		return Collections.unmodifiableList(writtenLocations);
	}

	public List<Integer> getAccessedLocations() {
		return Collections.unmodifiableList(accessedLocations);
	}

	public void clear() {
		readLocations.clear();
		writtenLocations.clear();
		accessedLocations.clear();
	}
}
