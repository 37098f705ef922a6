package oblivious.testers;

import oblivious.client.PathORAM;
import oblivious.server.ByteArrayServerMemory;
import oblivious.server.ObservedServerMemory;
import oblivious.utils.ORAMContext;
import org.apache.commons.math3.distribution.UniformIntegerDistribution;
import org.apache.commons.math3.stat.inference.ChiSquareTest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Compares the leaf buckets a server observes for two very different logical request sequences: one that
 * keeps accessing the same block and one that accesses uniformly random blocks.
 */
public class PathDistributionTester {
	private static final Logger logger = LoggerFactory.getLogger("benchmark");
	private static final double SIGNIFICANCE = 0.001;

	// ARGS: [height] [nAccesses]
	public static void main(String[] args) {
		int height = args.length > 0 ? Integer.parseInt(args[0]) : 5;
		int nAccesses = args.length > 1 ? Integer.parseInt(args[1]) : 64000;
		ORAMContext oramContext = new ORAMContext(height, 4, 16);
		int nLeaves = oramContext.getNumberOfLeaves();
		logger.info("Configuration: {}", oramContext);

		long[] sameBlock = countLeafAccesses(oramContext, nAccesses, 1L, new int[]{0});
		UniformIntegerDistribution distribution = new UniformIntegerDistribution(0,
				oramContext.getNumberOfBlocks() / 2 - 1);
		distribution.reseedRandomGenerator(2L);
		long[] randomBlocks = countLeafAccesses(oramContext, nAccesses, 3L, distribution.sample(nAccesses));

		ChiSquareTest chiSquareTest = new ChiSquareTest();
		double[] uniform = new double[nLeaves];
		Arrays.fill(uniform, 1.0);
		double sameBlockUniformity = chiSquareTest.chiSquareTest(uniform, sameBlock);
		double randomBlocksUniformity = chiSquareTest.chiSquareTest(uniform, randomBlocks);
		double comparison = chiSquareTest.chiSquareTestDataSetsComparison(sameBlock, randomBlocks);

		logger.info("Same block leaves: {}", Arrays.toString(sameBlock));
		logger.info("Random blocks leaves: {}", Arrays.toString(randomBlocks));
		logger.info("p-value uniform (same block): {}", sameBlockUniformity);
		logger.info("p-value uniform (random blocks): {}", randomBlocksUniformity);
		logger.info("p-value same distribution: {}", comparison);
		if (comparison < SIGNIFICANCE)
			logger.warn("Leaf distributions differ at significance {}", SIGNIFICANCE);
	}

	/**
	 * Reads the given blocks in a cycle until {@code nAccesses} accesses were made and counts how often each
	 * leaf bucket was read.
	 */
	public static long[] countLeafAccesses(ORAMContext oramContext, int nAccesses, long seed, int[] addresses) {
		ObservedServerMemory serverMemory = new ObservedServerMemory(new ByteArrayServerMemory(oramContext));
		PathORAM oram = new PathORAM(oramContext, serverMemory);
		oram.initialize(seed);
		byte[] content = new byte[oramContext.getBlockSize()];
		for (int address : Arrays.stream(addresses).distinct().toArray()) {
			oram.write(address, content);
		}

		int treeLevels = oramContext.getTreeLevels();
		int firstLeaf = oramContext.getTreeSize() - oramContext.getNumberOfLeaves();
		long[] leafCounts = new long[oramContext.getNumberOfLeaves()];
		for (int i = 0; i < nAccesses; i++) {
			serverMemory.clear();
			oram.read(addresses[i % addresses.length], content);
			List<Integer> readLocations = serverMemory.getReadLocations();
			leafCounts[readLocations.get(treeLevels - 1) - firstLeaf]++;
		}
		return leafCounts;
	}
}
