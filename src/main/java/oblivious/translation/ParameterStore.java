package oblivious.translation;

import oblivious.client.BlockCache;
import oblivious.utils.ORAMUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Reads and writes layer parameters kept in ORAM blocks. Element values are little-endian and
 * {@link AddressTranslator#elementSize(int)} bytes wide; the block traffic goes through a {@link BlockCache}
 * so that walking a layer in element order reads each block once.
 */
public class ParameterStore {
	private final Logger logger = LoggerFactory.getLogger("oram");
	private final AddressTranslator translator;
	private final BlockCache blockCache;

	public ParameterStore(AddressTranslator translator, BlockCache blockCache) {
		if (translator.getBlockSize() != blockCache.getBlockSize())
			throw new IllegalArgumentException("Translator block size " + translator.getBlockSize()
					+ " differs from the ORAM block size " + blockCache.getBlockSize());
		this.translator = translator;
		this.blockCache = blockCache;
	}

	public byte[] readElementBytes(int layer, BlockAddress address) {
		int elementSize = translator.elementSize(layer);
		byte[] block = blockCache.get(address.getBlock());
		return Arrays.copyOfRange(block, address.getOffset(), address.getOffset() + elementSize);
	}

	public long readElement(int layer, BlockAddress address) {
		int elementSize = checkNumericElement(layer);
		byte[] block = blockCache.get(address.getBlock());
		return ORAMUtils.deserializeLittleEndian(block, address.getOffset(), elementSize);
	}

	public long readWeight(WeightAddressTranslator weights, int layer, int pe, int tile) {
		checkTranslator(weights);
		return readElement(layer, weights.indexToBlock(layer, pe, tile));
	}

	public long readThreshold(ThresholdAddressTranslator thresholds, int layer, int pe, int nf, int numTh) {
		checkTranslator(thresholds);
		return readElement(layer, thresholds.indexToBlock(layer, pe, nf, numTh));
	}

	/**
	 * All elements of a layer in element order.
	 */
	public long[] readLayer(int layer) {
		checkNumericElement(layer);
		long nElements = translator.elementCount(layer);
		if (nElements > Integer.MAX_VALUE - 8)
			throw new IllegalArgumentException("Layer " + layer + " is too large to read at once");
		long[] values = new long[(int) nElements];
		for (int i = 0; i < values.length; i++) {
			values[i] = readElement(layer, translator.elementToBlock(layer, i));
		}
		return values;
	}

	/**
	 * Overwrites every block of a layer. Values wider than the element size are truncated to their low
	 * bytes; unused bytes at the end of a block are zero.
	 */
	public void storeLayer(int layer, long[] values) {
		int elementSize = checkNumericElement(layer);
		if (values.length != translator.elementCount(layer))
			throw new IllegalArgumentException("Layer " + layer + " has " + translator.elementCount(layer)
					+ " elements, got " + values.length);

		int perBlock = translator.blockElements(layer);
		byte[] block = new byte[translator.getBlockSize()];
		for (int b = 0; b < translator.blockCount(layer); b++) {
			Arrays.fill(block, (byte) 0);
			int first = b * perBlock;
			int last = Math.min(first + perBlock, values.length);
			for (int i = first; i < last; i++) {
				ORAMUtils.serializeLittleEndian(values[i], elementSize, block, (i - first) * elementSize);
			}
			blockCache.write(translator.startBlock(layer) + b, block);
		}
		logger.debug("Stored {} elements of layer {} in {} blocks", values.length, layer,
				translator.blockCount(layer));
	}

	/**
	 * Read-modify-write of a single element.
	 */
	public void storeElement(int layer, BlockAddress address, long value) {
		int elementSize = checkNumericElement(layer);
		byte[] block = blockCache.get(address.getBlock()).clone();
		ORAMUtils.serializeLittleEndian(value, elementSize, block, address.getOffset());
		blockCache.write(address.getBlock(), block);
	}

	private int checkNumericElement(int layer) {
		int elementSize = translator.elementSize(layer);
		if (elementSize > Long.BYTES)
			throw new IllegalArgumentException("Layer " + layer + " elements take " + elementSize
					+ " bytes, use readElementBytes");
		return elementSize;
	}

	private void checkTranslator(AddressTranslator other) {
		if (other != translator)
			throw new IllegalArgumentException("Translator does not belong to this store");
	}
}
