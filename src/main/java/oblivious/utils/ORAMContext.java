package oblivious.utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

public class ORAMContext {
	public static final int DEFAULT_BUCKET_SIZE = 4;
	public static final int DEFAULT_ID_SIZE = Long.BYTES;
	public static final int MAX_TREE_HEIGHT = 26;

	private final int TREE_HEIGHT; // number of levels is equal to tree height + 1
	private final int TREE_SIZE; // number of buckets in the tree
	private final int BUCKET_SIZE;
	private final int BLOCK_SIZE;
	private final int ID_SIZE;
	private final int STASH_CAPACITY;
	private final int N_BLOCKS;
	private final long INVALID_ID;
	private final EvictionOrder evictionOrder;

	public ORAMContext(int treeHeight, int bucketSize, int blockSize) {
		this(treeHeight, bucketSize, blockSize, DEFAULT_ID_SIZE,
				computeDefaultStashCapacity(treeHeight, bucketSize), EvictionOrder.STASH_ORDER);
	}

	public ORAMContext(int treeHeight, int bucketSize, int blockSize, int idSize, int stashCapacity,
					   EvictionOrder evictionOrder) {
		if (treeHeight < 0 || treeHeight > MAX_TREE_HEIGHT)
			throw new IllegalArgumentException("Tree height must be in [0, " + MAX_TREE_HEIGHT + "]: " + treeHeight);
		if (bucketSize < 1)
			throw new IllegalArgumentException("Bucket size must be positive: " + bucketSize);
		if (blockSize < 1)
			throw new IllegalArgumentException("Block size must be positive: " + blockSize);
		if (idSize < 1 || idSize > Long.BYTES)
			throw new IllegalArgumentException("Id size must be in [1, 8] bytes: " + idSize);
		if (stashCapacity < 1)
			throw new IllegalArgumentException("Stash capacity must be positive: " + stashCapacity);
		if (evictionOrder == null)
			throw new IllegalArgumentException("Eviction order is required");

		long nBlocks = ORAMUtils.computeNumberOfSlots(treeHeight, bucketSize);
		if (nBlocks > Integer.MAX_VALUE)
			throw new IllegalArgumentException("Too many blocks in a tree: " + nBlocks);
		long invalidId = ORAMUtils.computeInvalidId(idSize);
		if (idSize < Long.BYTES && nBlocks - 1 >= invalidId)
			throw new IllegalArgumentException("Id size of " + idSize + " bytes cannot address " + nBlocks + " blocks");
		if ((long) ORAMUtils.computeNumberOfSlots(treeHeight, bucketSize) * (idSize + blockSize) > Integer.MAX_VALUE)
			throw new IllegalArgumentException("Server memory does not fit in a single byte array");

		this.TREE_HEIGHT = treeHeight;
		this.TREE_SIZE = ORAMUtils.computeNumberOfNodes(treeHeight);
		this.BUCKET_SIZE = bucketSize;
		this.BLOCK_SIZE = blockSize;
		this.ID_SIZE = idSize;
		this.STASH_CAPACITY = stashCapacity;
		this.N_BLOCKS = (int) nBlocks;
		this.INVALID_ID = invalidId;
		this.evictionOrder = evictionOrder;
	}

	/**
	 * Four times the number of bits needed to address every block, and never less than one path.
	 */
	public static int computeDefaultStashCapacity(int treeHeight, int bucketSize) {
		long nBlocks = ORAMUtils.computeNumberOfSlots(treeHeight, bucketSize);
		return Math.max(ORAMUtils.ceilLog2(nBlocks) << 2, ORAMUtils.computePathLength(treeHeight, bucketSize));
	}

	public static ORAMContext fromProperties(Properties properties) {
		int treeHeight = Integer.parseInt(required(properties, "oram.tree_height"));
		int bucketSize = Integer.parseInt(properties.getProperty("oram.bucket_size",
				String.valueOf(DEFAULT_BUCKET_SIZE)));
		int blockSize = Integer.parseInt(required(properties, "oram.block_size"));
		int idSize = Integer.parseInt(properties.getProperty("oram.id_size", String.valueOf(DEFAULT_ID_SIZE)));
		String stashCapacity = properties.getProperty("oram.stash_capacity");
		int capacity = stashCapacity == null || stashCapacity.isBlank()
				? computeDefaultStashCapacity(treeHeight, bucketSize)
				: Integer.parseInt(stashCapacity.trim());
		EvictionOrder evictionOrder = EvictionOrder.valueOf(properties.getProperty("oram.eviction_order",
				EvictionOrder.STASH_ORDER.name()).trim().toUpperCase());
		return new ORAMContext(treeHeight, bucketSize, blockSize, idSize, capacity, evictionOrder);
	}

	public static ORAMContext load(Path configurationFile) throws IOException {
		Properties properties = new Properties();
		try (InputStream in = Files.newInputStream(configurationFile)) {
			properties.load(in);
		}
		return fromProperties(properties);
	}

	private static String required(Properties properties, String key) {
		String value = properties.getProperty(key);
		if (value == null || value.isBlank())
			throw new IllegalArgumentException("Missing configuration property " + key);
		return value.trim();
	}

	public int getTreeHeight() {
		return TREE_HEIGHT;
	}

	public int getTreeLevels() {
		return TREE_HEIGHT + 1;
	}

	public int getTreeSize() {
		return TREE_SIZE;
	}

	public int getNumberOfLeaves() {
		return ORAMUtils.computeNumberOfLeaves(TREE_HEIGHT);
	}

	public int getBucketSize() {
		return BUCKET_SIZE;
	}

	public int getBlockSize() {
		return BLOCK_SIZE;
	}

	public int getIdSize() {
		return ID_SIZE;
	}

	public int getStashCapacity() {
		return STASH_CAPACITY;
	}

	/**
	 * Number of logical block ids, one per physical slot.
	 */
	public int getNumberOfBlocks() {
		return N_BLOCKS;
	}

	public long getInvalidId() {
		return INVALID_ID;
	}

	public int getSlotSize() {
		return ID_SIZE + BLOCK_SIZE;
	}

	public int getBucketByteSize() {
		return BUCKET_SIZE * getSlotSize();
	}

	public int getServerSize() {
		return (int) ORAMUtils.computeServerSize(TREE_HEIGHT, BUCKET_SIZE, getSlotSize());
	}

	public int getPathCapacity() {
		return ORAMUtils.computePathLength(TREE_HEIGHT, BUCKET_SIZE);
	}

	public EvictionOrder getEvictionOrder() {
		return evictionOrder;
	}

	@Override
	public String toString() {
		return "ORAMContext(L: " + TREE_HEIGHT + ", Z: " + BUCKET_SIZE + ", B: " + BLOCK_SIZE
				+ ", ID: " + ID_SIZE + ", C: " + STASH_CAPACITY + ", N: " + N_BLOCKS + ", " + evictionOrder + ")";
	}
}
