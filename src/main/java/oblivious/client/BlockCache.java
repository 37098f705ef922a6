package oblivious.client;

import oblivious.utils.ORAMUtils;
import oblivious.utils.Operation;

/**
 * Keeps the last block read through the ORAM so that consecutive lookups into the same block cost a
 * single access. Reads of the cached block are not visible on the server.
 * <p>
 * The cache listens to the engine: re-initializing it, or writing the cached block without going through
 * the cache, drops the cached copy.
 */
public class BlockCache implements ORAMListener {
	private final PathORAM oram;
	private final byte[] block;
	private int cachedAddress;
	private long hits;
	private long misses;

	public BlockCache(PathORAM oram) {
		this.oram = oram;
		this.block = new byte[oram.getORAMContext().getBlockSize()];
		this.cachedAddress = ORAMUtils.DUMMY_ADDRESS;
		oram.addListener(this);
	}

	/**
	 * Content of block {@code address}. The returned buffer is owned by the cache and is overwritten by the
	 * next miss.
	 */
	public byte[] get(int address) {
		if (address != cachedAddress) {
			oram.read(address, block);
			cachedAddress = address;
			misses++;
		} else {
			hits++;
		}
		return block;
	}

	/**
	 * Writes through to the ORAM and keeps the written block as the cached one.
	 */
	public void write(int address, byte[] content) {
		oram.write(address, content);
		System.arraycopy(content, 0, block, 0, block.length);
		cachedAddress = address;
	}

	@Override
	public void initialized() {
		invalidate();
	}

	@Override
	public void accessCompleted(Operation op, int address, int stashSize) {
		if (op == Operation.WRITE && address == cachedAddress)
			invalidate();
	}

	public void invalidate() {
		cachedAddress = ORAMUtils.DUMMY_ADDRESS;
	}

	public int getBlockSize() {
		return block.length;
	}

	public int getCachedAddress() {
		return cachedAddress;
	}

	public long getHits() {
		return hits;
	}

	public long getMisses() {
		return misses;
	}
}
