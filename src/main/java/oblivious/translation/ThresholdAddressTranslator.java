package oblivious.translation;

/**
 * Locates activation thresholds. Layer {@code i} has {@code PE[i] * NF[i] * NumTH[i]} elements of
 * {@code ceil(TA[i] / 8)} bytes, ordered by processing element, then neuron fold, then threshold.
 */
public class ThresholdAddressTranslator extends AddressTranslator {
	private final int[] nf;
	private final int[] pe;
	private final int[] numTh;

	public ThresholdAddressTranslator(int blockSize, int[] nf, int[] pe, int[] numTh, int[] ta) {
		this(blockSize, nf, pe, numTh, ta, 0);
	}

	/**
	 * @param nf          neuron folds, per layer
	 * @param pe          processing elements, per layer
	 * @param numTh       thresholds per output, per layer
	 * @param ta          bits per threshold, per layer
	 * @param blockOffset first block of layer 0, typically the end of the weights
	 */
	public ThresholdAddressTranslator(int blockSize, int[] nf, int[] pe, int[] numTh, int[] ta, int blockOffset) {
		super(blockSize, elementSizes(blockSize, nf, pe, numTh, ta), elementCounts(nf, pe, numTh), blockOffset);
		this.nf = nf.clone();
		this.pe = pe.clone();
		this.numTh = numTh.clone();
	}

	private static int[] elementSizes(int blockSize, int[] nf, int[] pe, int[] numTh, int[] ta) {
		checkLayerShapes(nf.length, nf, pe, numTh, ta);
		int[] sizes = new int[ta.length];
		for (int i = 0; i < ta.length; i++) {
			sizes[i] = computeElementSize(i, ta[i], blockSize);
		}
		return sizes;
	}

	private static long[] elementCounts(int[] nf, int[] pe, int[] numTh) {
		long[] counts = new long[pe.length];
		for (int i = 0; i < pe.length; i++) {
			counts[i] = (long) pe[i] * nf[i] * numTh[i];
		}
		return counts;
	}

	public BlockAddress indexToBlock(int layer, int pe, int nf, int numTh) {
		checkLayer(layer);
		checkCoordinate("PE", pe, this.pe[layer]);
		checkCoordinate("NF", nf, this.nf[layer]);
		checkCoordinate("NumTH", numTh, this.numTh[layer]);
		long element = (long) pe * this.nf[layer] * this.numTh[layer] + (long) nf * this.numTh[layer] + numTh;
		return elementToBlock(layer, element);
	}

	public int getNF(int layer) {
		checkLayer(layer);
		return nf[layer];
	}

	public int getPE(int layer) {
		checkLayer(layer);
		return pe[layer];
	}

	public int getNumTH(int layer) {
		checkLayer(layer);
		return numTh[layer];
	}
}
