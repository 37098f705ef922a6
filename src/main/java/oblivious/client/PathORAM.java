package oblivious.client;

import oblivious.client.structure.Block;
import oblivious.client.structure.Bucket;
import oblivious.client.structure.PositionMap;
import oblivious.client.structure.Stash;
import oblivious.client.structure.XorShift64;
import oblivious.server.ServerMemory;
import oblivious.utils.EvictionOrder;
import oblivious.utils.ORAMContext;
import oblivious.utils.ORAMUtils;
import oblivious.utils.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.PrimitiveIterator;

/**
 * Path ORAM client (Stefanov et al., "Path ORAM: An Extremely Simple Oblivious RAM Protocol", CCS 2013).
 * <p>
 * Every access reads the whole root-to-leaf path the block is mapped to into the stash, serves the request
 * from the stash, remaps the block to a fresh random leaf and writes the same path back from the leaf up,
 * evicting as many stashed blocks as each bucket can take. Each access therefore touches
 * {@code 2 * (L + 1)} buckets on a uniformly random path, whatever block was requested.
 * <p>
 * Not thread-safe: one access must complete before the next one starts.
 */
public class PathORAM {
	private final Logger logger = LoggerFactory.getLogger("oram");
	private final Logger measurementLogger = LoggerFactory.getLogger("measurement");

	private final ORAMContext oramContext;
	private final ServerMemory serverMemory;
	private final PositionMap positionMap;
	private final Stash stash;
	private final XorShift64 rndGenerator;
	private final BitSet writtenAddresses;
	private final Bucket[] pathBuckets;
	private final Bucket evictionBucket;
	private final int[] evictionCandidates;
	private final List<ORAMListener> listeners;
	private boolean initialized;
	private long accessCount;
	private int maxStashSize;

	public PathORAM(ORAMContext oramContext, ServerMemory serverMemory) {
		if (serverMemory.getBucketCount() != oramContext.getTreeSize())
			throw new IllegalArgumentException("Server memory holds " + serverMemory.getBucketCount()
					+ " buckets, expected " + oramContext.getTreeSize());
		this.oramContext = oramContext;
		this.serverMemory = serverMemory;
		int nBlocks = oramContext.getNumberOfBlocks();
		this.positionMap = new PositionMap(nBlocks);
		this.stash = new Stash(nBlocks, oramContext.getStashCapacity(), oramContext.getBlockSize());
		this.rndGenerator = new XorShift64(0);
		this.writtenAddresses = new BitSet(nBlocks);
		this.pathBuckets = new Bucket[oramContext.getTreeLevels()];
		for (int i = 0; i < pathBuckets.length; i++) {
			pathBuckets[i] = new Bucket(oramContext);
		}
		this.evictionBucket = new Bucket(oramContext);
		this.evictionCandidates = new int[oramContext.getStashCapacity()];
		this.listeners = new ArrayList<>();
	}

	/**
	 * Seeds the path generator, marks every server slot as empty and assigns a random leaf to every block.
	 * Blocks written before are forgotten.
	 */
	public void initialize(long seed) {
		rndGenerator.setSeed(seed);

		evictionBucket.clear();
		for (int location = 0; location < oramContext.getTreeSize(); location++) {
			serverMemory.writeBucket(location, evictionBucket);
		}

		int nLeaves = oramContext.getNumberOfLeaves();
		for (int address = 0; address < oramContext.getNumberOfBlocks(); address++) {
			positionMap.update(address, rndGenerator.nextLeaf(nLeaves));
		}

		stash.clear();
		writtenAddresses.clear();
		accessCount = 0;
		maxStashSize = 0;
		initialized = true;
		logger.info("Initialized {} ({} buckets)", oramContext, oramContext.getTreeSize());
		for (ORAMListener listener : listeners) {
			listener.initialized();
		}
	}

	/**
	 * Copies block {@code address} into {@code output}. A block that was never written reads as zeros.
	 */
	public void read(int address, byte[] output) {
		access(Operation.READ, address, output, null);
	}

	public void write(int address, byte[] content) {
		access(Operation.WRITE, address, content, null);
	}

	/**
	 * Read the memory address.
	 *
	 * @param address Memory address.
	 * @return Content located at the memory address.
	 */
	public byte[] readMemory(int address) {
		byte[] content = new byte[oramContext.getBlockSize()];
		access(Operation.READ, address, content, null);
		return content;
	}

	/**
	 * Write content to the memory address.
	 *
	 * @param address Memory address.
	 * @param content Content to write.
	 * @return Old content located at the memory address.
	 */
	public byte[] writeMemory(int address, byte[] content) {
		byte[] oldContent = new byte[oramContext.getBlockSize()];
		access(Operation.WRITE, address, content, oldContent);
		return oldContent;
	}

	private void access(Operation op, int address, byte[] data, byte[] oldContent) {
		if (!initialized)
			throw new IllegalStateException("ORAM is not initialized");
		if (address < 0 || address >= oramContext.getNumberOfBlocks())
			throw new IllegalArgumentException("Block " + address + " out of [0, "
					+ oramContext.getNumberOfBlocks() + ")");
		if (data == null || data.length != oramContext.getBlockSize())
			throw new IllegalArgumentException("Buffer must have " + oramContext.getBlockSize() + " bytes");

		long start = System.nanoTime();

		int leaf = positionMap.getLocation(address);
		positionMap.update(address, rndGenerator.nextLeaf(oramContext.getNumberOfLeaves()));
		int[] pathLocations = ORAMUtils.computePathLocations(leaf, oramContext.getTreeHeight());

		logger.debug("Accessing block {} on path {} (new path {})", address, leaf, positionMap.getLocation(address));

		readPath(pathLocations);
		int incoming = countIncomingBlocks(op, address);
		if (incoming > stash.available()) {
			positionMap.update(address, leaf);
			StashOverflowException overflow = new StashOverflowException(address, stash.size(), incoming,
					stash.capacity());
			logger.error("Stash overflow on block {}: {} stashed, {} incoming, capacity {}", address,
					stash.size(), incoming, stash.capacity());
			for (ORAMListener listener : listeners) {
				listener.stashOverflow(overflow);
			}
			throw overflow;
		}
		stashPath();
		maxStashSize = Math.max(maxStashSize, stash.size());

		if (op == Operation.READ) {
			copyStashedContent(address, data);
		} else {
			if (oldContent != null)
				copyStashedContent(address, oldContent);
			if (!stash.putBlock(address, data))
				throw new IllegalStateException("No stash entry available for block " + address);
			writtenAddresses.set(address);
		}

		writePath(pathLocations);

		accessCount++;
		long delay = System.nanoTime() - start;
		measurementLogger.debug("M-access: {}", delay);
		measurementLogger.debug("M-stash: {}", stash.size());
		for (ORAMListener listener : listeners) {
			listener.accessCompleted(op, address, stash.size());
		}
	}

	private void readPath(int[] pathLocations) {
		for (int level = 0; level <= oramContext.getTreeHeight(); level++) {
			serverMemory.readBucket(pathLocations[level], pathBuckets[level]);
		}
	}

	/**
	 * Number of stash entries the path and the request would add. Checked before anything is modified so
	 * that a refused access leaves the stash, the position map and the server memory as they were.
	 */
	private int countIncomingBlocks(Operation op, int address) {
		int incoming = 0;
		boolean requestedOnPath = false;
		for (Bucket bucket : pathBuckets) {
			for (Block block : bucket.getBlocks()) {
				if (block.isDummy())
					continue;
				int blockAddress = toAddress(block);
				if (blockAddress == address)
					requestedOnPath = true;
				if (!stash.contains(blockAddress))
					incoming++;
			}
		}
		if (op == Operation.WRITE && !requestedOnPath && !stash.contains(address))
			incoming++;
		return incoming;
	}

	private void stashPath() {
		for (Bucket bucket : pathBuckets) {
			for (Block block : bucket.getBlocks()) {
				if (!block.isDummy())
					stash.putBlockIfAbsent(toAddress(block), block.getContent());
			}
		}
	}

	private void copyStashedContent(int address, byte[] output) {
		if (stash.contains(address)) {
			System.arraycopy(stash.getBlock(address), 0, output, 0, oramContext.getBlockSize());
		} else if (writtenAddresses.get(address)) {
			throw new IllegalStateException("Block " + address + " was written but is neither on its path "
					+ "nor in the stash");
		} else {
			Arrays.fill(output, (byte) 0);
		}
	}

	/**
	 * Writes the path back from the leaf to the root. At each level, the stashed blocks whose own path goes
	 * through that bucket are candidates and up to a bucket's worth of them leave the stash.
	 */
	private void writePath(int[] pathLocations) {
		int treeHeight = oramContext.getTreeHeight();
		int bucketSize = oramContext.getBucketSize();

		for (int level = treeHeight; level >= 0; level--) {
			int location = pathLocations[level];
			int nCandidates = collectEvictionCandidates(location, level);
			if (oramContext.getEvictionOrder() == EvictionOrder.SHUFFLED)
				shuffle(evictionCandidates, nCandidates);

			int nEvicted = Math.min(nCandidates, bucketSize);
			for (int z = 0; z < nEvicted; z++) {
				int candidate = evictionCandidates[z];
				Block block = evictionBucket.getBlock(z);
				block.setAddress(candidate);
				block.setContent(stash.getBlock(candidate));
				stash.removeBlock(candidate);
			}
			for (int z = nEvicted; z < bucketSize; z++) {
				evictionBucket.getBlock(z).markDummy();
			}

			serverMemory.writeBucket(location, evictionBucket);
		}
	}

	private int collectEvictionCandidates(int location, int level) {
		int treeHeight = oramContext.getTreeHeight();
		int nCandidates = 0;
		PrimitiveIterator.OfInt addresses = stash.getAddresses().iterator();
		while (addresses.hasNext()) {
			int stashedAddress = addresses.nextInt();
			int stashedLeaf = positionMap.getLocation(stashedAddress);
			if (ORAMUtils.computeNodeOnPath(stashedLeaf, level, treeHeight) == location)
				evictionCandidates[nCandidates++] = stashedAddress;
		}
		return nCandidates;
	}

	private void shuffle(int[] values, int length) {
		for (int i = length - 1; i > 0; i--) {
			int j = rndGenerator.nextInt(i + 1);
			int tmp = values[i];
			values[i] = values[j];
			values[j] = tmp;
		}
	}

	private int toAddress(Block block) {
		long address = block.getAddress();
		if (address < 0 || address >= oramContext.getNumberOfBlocks())
			throw new IllegalStateException("Server memory holds unknown block id " + address);
		return (int) address;
	}

	public void addListener(ORAMListener listener) {
		listeners.add(listener);
	}

	public void removeListener(ORAMListener listener) {
		listeners.remove(listener);
	}

	public ORAMContext getORAMContext() {
		return oramContext;
	}

	public int getStashSize() {
		return stash.size();
	}

	/**
	 * Largest stash occupancy observed right after a path was read since initialization.
	 */
	public int getMaxStashSize() {
		return maxStashSize;
	}

	public long getAccessCount() {
		return accessCount;
	}

	public boolean isInitialized() {
		return initialized;
	}

	PositionMap getPositionMap() {
		return positionMap;
	}

	Stash getStash() {
		return stash;
	}
}
