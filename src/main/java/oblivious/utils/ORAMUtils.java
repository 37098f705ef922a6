package oblivious.utils;

public class ORAMUtils {
	public static final int DUMMY_LOCATION = -1;
	public static final int DUMMY_ADDRESS = -1;

	public static int computeNumberOfNodes(int treeHeight) {
		return (1 << treeHeight + 1) - 1;
	}

	public static int computeNumberOfLeaves(int treeHeight) {
		return 1 << treeHeight;
	}

	public static long computeNumberOfSlots(int treeHeight, int bucketSize) {
		return (long) computeNumberOfNodes(treeHeight) * bucketSize;
	}

	public static int computePathLength(int treeHeight, int bucketSize) {
		return (treeHeight + 1) * bucketSize;
	}

	public static long computeServerSize(int treeHeight, int bucketSize, int slotSize) {
		return computeNumberOfSlots(treeHeight, bucketSize) * slotSize;
	}

	/**
	 * Index of the bucket lying on the path to {@code leaf} at the given level (0 is the root, treeHeight the
	 * leaf level). Starts at the leaf bucket and folds to the parent until the level is reached.
	 */
	public static int computeNodeOnPath(int leaf, int level, int treeHeight) {
		int node = leaf + (computeNumberOfNodes(treeHeight) >>> 1);
		for (int l = treeHeight - 1; l >= level; l--) {
			node = ((node + 1) >>> 1) - 1;
		}
		return node;
	}

	/**
	 * Bucket indexes on the path to {@code leaf}, indexed by level (root first).
	 */
	public static int[] computePathLocations(int leaf, int treeHeight) {
		int[] locations = new int[treeHeight + 1];
		int node = leaf + (computeNumberOfNodes(treeHeight) >>> 1);
		for (int level = treeHeight; level >= 0; level--) {
			locations[level] = node;
			node = ((node + 1) >>> 1) - 1;
		}
		return locations;
	}

	public static int computeLevel(int node) {
		return 31 - Integer.numberOfLeadingZeros(node + 1);
	}

	public static int ceilLog2(long n) {
		if (n <= 1)
			return 0;
		return 64 - Long.numberOfLeadingZeros(n - 1);
	}

	public static long ceilDiv(long numerator, long denominator) {
		return (numerator / denominator) + ((numerator % denominator) != 0 ? 1 : 0);
	}

	/**
	 * All-ones value of an identifier that is {@code idSize} bytes wide.
	 */
	public static long computeInvalidId(int idSize) {
		return idSize >= Long.BYTES ? -1L : (1L << (idSize * 8)) - 1;
	}

	public static void serializeLittleEndian(long value, int nBytes, byte[] output, int startOffset) {
		for (int i = 0; i < nBytes; i++) {
			output[startOffset + i] = (byte) (value >>> (i * 8));
		}
	}

	public static long deserializeLittleEndian(byte[] input, int startOffset, int nBytes) {
		long value = 0;
		for (int i = 0; i < nBytes; i++) {
			value |= (long) Byte.toUnsignedInt(input[startOffset + i]) << (i * 8);
		}
		return value;
	}
}
