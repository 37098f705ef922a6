package oblivious.client.structure;

import java.util.random.RandomGenerator;

/**
 * Marsaglia xorshift generator (13, 7, 17) used to draw leaves. Deterministic for a given seed.
 */
public class XorShift64 implements RandomGenerator {
	// an all-zero state is a fixed point of the generator
	private static final long ZERO_SEED_REPLACEMENT = 0x9E3779B97F4A7C15L;

	private long state;

	public XorShift64(long seed) {
		setSeed(seed);
	}

	public void setSeed(long seed) {
		this.state = seed == 0 ? ZERO_SEED_REPLACEMENT : seed;
	}

	@Override
	public long nextLong() {
		long x = state;
		x ^= x << 13;
		x ^= x >>> 7;
		x ^= x << 17;
		state = x;
		return x;
	}

	/**
	 * Uniform leaf of a tree with {@code nLeaves} leaves, a power of two.
	 */
	public int nextLeaf(int nLeaves) {
		return (int) (nextLong() & (nLeaves - 1));
	}
}
