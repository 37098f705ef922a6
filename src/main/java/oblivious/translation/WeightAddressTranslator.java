package oblivious.translation;

/**
 * Locates weight tiles. Layer {@code i} has {@code PE[i] * TILES[i]} elements of
 * {@code ceil(WT[i] * SIMD[i] / 8)} bytes, stored processing element by processing element.
 */
public class WeightAddressTranslator extends AddressTranslator {
	private final int[] pe;
	private final int[] tiles;

	public WeightAddressTranslator(int blockSize, int[] simd, int[] wt, int[] pe, int[] tiles) {
		this(blockSize, simd, wt, pe, tiles, 0);
	}

	/**
	 * @param simd        input columns computed in parallel, per layer
	 * @param wt          bits per weight, per layer
	 * @param pe          output rows computed in parallel, per layer
	 * @param tiles       tiles per processing element, per layer
	 * @param blockOffset first block of layer 0
	 */
	public WeightAddressTranslator(int blockSize, int[] simd, int[] wt, int[] pe, int[] tiles, int blockOffset) {
		super(blockSize, elementSizes(blockSize, simd, wt, pe, tiles), elementCounts(pe, tiles), blockOffset);
		this.pe = pe.clone();
		this.tiles = tiles.clone();
	}

	private static int[] elementSizes(int blockSize, int[] simd, int[] wt, int[] pe, int[] tiles) {
		checkLayerShapes(simd.length, simd, wt, pe, tiles);
		int[] sizes = new int[simd.length];
		for (int i = 0; i < simd.length; i++) {
			sizes[i] = computeElementSize(i, (long) wt[i] * simd[i], blockSize);
		}
		return sizes;
	}

	private static long[] elementCounts(int[] pe, int[] tiles) {
		long[] counts = new long[pe.length];
		for (int i = 0; i < pe.length; i++) {
			counts[i] = (long) pe[i] * tiles[i];
		}
		return counts;
	}

	public BlockAddress indexToBlock(int layer, int pe, int tile) {
		checkLayer(layer);
		checkCoordinate("PE", pe, this.pe[layer]);
		checkCoordinate("Tile", tile, tiles[layer]);
		return elementToBlock(layer, (long) pe * tiles[layer] + tile);
	}

	public int getPE(int layer) {
		checkLayer(layer);
		return pe[layer];
	}

	public int getTiles(int layer) {
		checkLayer(layer);
		return tiles[layer];
	}
}
