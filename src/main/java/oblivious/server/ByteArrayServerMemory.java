package oblivious.server;

import oblivious.client.structure.Bucket;
import oblivious.utils.ORAMContext;

import java.util.Arrays;

/**
 * Server memory kept in its wire format: {@code Z * bucketCount} slots of {@code idSize + blockSize} bytes,
 * each a little-endian block id followed by the payload.
 */
public class ByteArrayServerMemory implements ServerMemory {
	private final ORAMContext oramContext;
	private final byte[] data;
	private final int bucketByteSize;

	public ByteArrayServerMemory(ORAMContext oramContext) {
		this(oramContext, new byte[oramContext.getServerSize()]);
	}

	/**
	 * Wraps an existing memory image without copying it.
	 */
	public ByteArrayServerMemory(ORAMContext oramContext, byte[] data) {
		if (data.length != oramContext.getServerSize())
			throw new IllegalArgumentException("Server memory must have " + oramContext.getServerSize()
					+ " bytes, got " + data.length);
		this.oramContext = oramContext;
		this.data = data;
		this.bucketByteSize = oramContext.getBucketByteSize();
	}

	@Override
	public int getBucketCount() {
		return oramContext.getTreeSize();
	}

	@Override
	public void readBucket(int location, Bucket bucket) {
		bucket.readExternal(data, offsetOf(location));
		bucket.setLocation(location);
	}

	@Override
	public void writeBucket(int location, Bucket bucket) {
		bucket.writeExternal(data, offsetOf(location));
	}

	public byte[] toByteArray() {
		return Arrays.copyOf(data, data.length);
	}

	private int offsetOf(int location) {
		if (location < 0 || location >= oramContext.getTreeSize())
			throw new IndexOutOfBoundsException("Bucket " + location + " out of [0, "
					+ oramContext.getTreeSize() + ")");
		return location * bucketByteSize;
	}
}
