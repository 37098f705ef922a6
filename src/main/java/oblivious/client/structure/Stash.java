package oblivious.client.structure;

import oblivious.memory.InsertResult;
import oblivious.memory.ResourcePool;
import oblivious.memory.SparseSetView;

/**
 * Client-side buffer of blocks displaced from the tree, keyed by block id. Backed by a
 * {@link ResourcePool} whose slots own pre-allocated payload buffers, so that the stash never grows.
 */
public class Stash {
	private final ResourcePool<byte[]> blocks;
	private final int blockSize;

	public Stash(int nAddresses, int capacity, int blockSize) {
		this.blockSize = blockSize;
		this.blocks = new ResourcePool<>(nAddresses, capacity, () -> new byte[blockSize]);
	}

	/**
	 * Copies {@code content} into the stash entry of {@code address}, creating it if needed.
	 * @return {@code false} if the entry did not exist and the stash is full
	 */
	public boolean putBlock(int address, byte[] content) {
		InsertResult result = blocks.emplaceEmpty(address);
		if (result.isRejected())
			return false;
		System.arraycopy(content, 0, blocks.get(result.getHandle()), 0, blockSize);
		return true;
	}

	/**
	 * Copies {@code content} into a new entry. An entry that already exists is left unchanged.
	 * @return the outcome of the reservation
	 */
	public InsertResult putBlockIfAbsent(int address, byte[] content) {
		InsertResult result = blocks.emplaceEmpty(address);
		if (result.isInserted())
			System.arraycopy(content, 0, blocks.get(result.getHandle()), 0, blockSize);
		return result;
	}

	public boolean contains(int address) {
		return blocks.contains(address);
	}

	/**
	 * Live payload of a stashed block.
	 * @throws java.util.NoSuchElementException if the block is not in the stash
	 */
	public byte[] getBlock(int address) {
		return blocks.at(address);
	}

	public void getAndRemoveBlock(int address, byte[] output) {
		System.arraycopy(blocks.at(address), 0, output, 0, blockSize);
		blocks.erase(address);
	}

	public boolean removeBlock(int address) {
		return blocks.erase(address);
	}

	public SparseSetView getAddresses() {
		return blocks.handles();
	}

	public int size() {
		return blocks.size();
	}

	public int capacity() {
		return blocks.capacity();
	}

	public int available() {
		return blocks.capacity() - blocks.size();
	}

	public void clear() {
		blocks.clear();
	}

	@Override
	public String toString() {
		if (blocks.size() > 60) {
			return blocks.size() + " blocks";
		}
		return blocks.handles().toString();
	}
}
