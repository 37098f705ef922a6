package oblivious.translation;

import oblivious.utils.ORAMUtils;

/**
 * Maps the elements of a multi-layer parameter set onto fixed-size blocks. Every layer packs as many whole
 * elements as fit in a block and occupies its own contiguous range of blocks, right after the previous
 * layer. The per-layer tables are computed once; instances are immutable.
 */
public abstract class AddressTranslator {
	private final int blockSize;
	private final int[] elementSizes;
	private final int[] elementsPerBlock;
	private final long[] elementCounts;
	private final int[] blockCounts;
	private final int[] startBlocks;
	private final int endBlock;

	protected AddressTranslator(int blockSize, int[] elementSizes, long[] elementCounts, int blockOffset) {
		if (blockSize < 1)
			throw new IllegalArgumentException("Block size must be positive: " + blockSize);
		if (blockOffset < 0)
			throw new IllegalArgumentException("Block offset must not be negative: " + blockOffset);
		int layers = elementSizes.length;
		this.blockSize = blockSize;
		this.elementSizes = elementSizes.clone();
		this.elementCounts = elementCounts.clone();
		this.elementsPerBlock = new int[layers];
		this.blockCounts = new int[layers];
		this.startBlocks = new int[layers];

		long nextBlock = blockOffset;
		for (int i = 0; i < layers; i++) {
			if (elementSizes[i] < 1)
				throw new IllegalArgumentException("Layer " + i + " has no element bits");
			if (elementSizes[i] > blockSize)
				throw new IllegalArgumentException("Layer " + i + " elements take " + elementSizes[i]
						+ " bytes, more than the block size " + blockSize);
			if (elementCounts[i] < 0)
				throw new IllegalArgumentException("Layer " + i + " has a negative element count");

			elementsPerBlock[i] = blockSize / elementSizes[i];
			long blockCount = ORAMUtils.ceilDiv(elementCounts[i], elementsPerBlock[i]);
			if (nextBlock + blockCount > Integer.MAX_VALUE)
				throw new IllegalArgumentException("Layer " + i + " does not fit in the block id space");
			blockCounts[i] = (int) blockCount;
			startBlocks[i] = (int) nextBlock;
			nextBlock += blockCount;
		}
		this.endBlock = (int) nextBlock;
	}

	/**
	 * Bytes taken by an element of {@code bits} bits, checked against the block size before narrowing.
	 */
	protected static int computeElementSize(int layer, long bits, int blockSize) {
		long bytes = ORAMUtils.ceilDiv(bits, 8);
		if (bytes > blockSize)
			throw new IllegalArgumentException("Layer " + layer + " elements take " + bytes
					+ " bytes, more than the block size " + blockSize);
		return (int) bytes;
	}

	protected static void checkLayerShapes(int layers, int[]... shapes) {
		for (int[] shape : shapes) {
			if (shape.length != layers)
				throw new IllegalArgumentException("Every shape array must have " + layers + " layers");
			for (int value : shape) {
				if (value < 0)
					throw new IllegalArgumentException("Shape values must not be negative");
			}
		}
	}

	/**
	 * Block and byte offset of the {@code elementIndex}-th element of a layer.
	 */
	public BlockAddress elementToBlock(int layer, long elementIndex) {
		checkLayer(layer);
		if (elementIndex < 0 || elementIndex >= elementCounts[layer])
			throw new IndexOutOfBoundsException("Element " + elementIndex + " out of [0, "
					+ elementCounts[layer] + ") in layer " + layer);
		int block = startBlocks[layer] + (int) (elementIndex / elementsPerBlock[layer]);
		int offset = elementSizes[layer] * (int) (elementIndex % elementsPerBlock[layer]);
		return new BlockAddress(block, offset);
	}

	public int elementSize(int layer) {
		checkLayer(layer);
		return elementSizes[layer];
	}

	public int blockElements(int layer) {
		checkLayer(layer);
		return elementsPerBlock[layer];
	}

	public int startBlock(int layer) {
		checkLayer(layer);
		return startBlocks[layer];
	}

	public int blockCount(int layer) {
		checkLayer(layer);
		return blockCounts[layer];
	}

	public long elementCount(int layer) {
		checkLayer(layer);
		return elementCounts[layer];
	}

	public int getLayers() {
		return elementSizes.length;
	}

	public int getBlockSize() {
		return blockSize;
	}

	/**
	 * First block after the last layer.
	 */
	public int endBlock() {
		return endBlock;
	}

	protected void checkLayer(int layer) {
		if (layer < 0 || layer >= elementSizes.length)
			throw new IndexOutOfBoundsException("Layer " + layer + " out of [0, " + elementSizes.length + ")");
	}

	protected static void checkCoordinate(String name, int value, int bound) {
		if (value < 0 || value >= bound)
			throw new IndexOutOfBoundsException(name + " " + value + " out of [0, " + bound + ")");
	}
}
