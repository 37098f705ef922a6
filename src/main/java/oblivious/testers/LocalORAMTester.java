package oblivious.testers;

import oblivious.client.BlockCache;
import oblivious.client.PathORAM;
import oblivious.client.StashOverflowException;
import oblivious.server.ByteArrayServerMemory;
import oblivious.translation.ParameterStore;
import oblivious.translation.WeightAddressTranslator;
import oblivious.utils.ORAMContext;
import oblivious.utils.Operation;
import org.apache.commons.lang3.tuple.Triple;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

/**
 * Runs the engine against an in-memory server: a fixed two-block scenario, a random read/write workload
 * checked against a plain map, and a parameter layout round trip.
 */
public class LocalORAMTester {
	private static final Logger logger = LoggerFactory.getLogger("benchmark");

	// ARGS: [configFile] [nTests] [zipfParameter]
	public static void main(String[] args) throws IOException {
		Path configurationFile = Path.of(args.length > 0 ? args[0] : "config/oram.properties");
		int nTests = args.length > 1 ? Integer.parseInt(args[1]) : 10000;
		double zipfParameter = args.length > 2 ? Double.parseDouble(args[2]) : 1.0;

		ORAMContext oramContext = Files.exists(configurationFile)
				? ORAMContext.load(configurationFile)
				: new ORAMContext(3, 4, 8);
		logger.info("Configuration: {}", oramContext);

		boolean scenarioPassed = runScenario();
		Triple<Integer, Integer, Integer> workload = runWorkload(oramContext, nTests, zipfParameter);
		boolean parametersPassed = runParameterLayout();

		logger.info("Scenario: {}", scenarioPassed ? "passed" : "FAILED");
		logger.info("Workload: {} correct, {} wrong, max stash {}", workload.getLeft(), workload.getMiddle(),
				workload.getRight());
		logger.info("Parameters: {}", parametersPassed ? "passed" : "FAILED");
		if (!scenarioPassed || workload.getMiddle() > 0 || !parametersPassed)
			System.exit(1);
	}

	private static boolean runScenario() {
		ORAMContext oramContext = new ORAMContext(3, 4, 8);
		PathORAM oram = new PathORAM(oramContext, new ByteArrayServerMemory(oramContext));
		oram.initialize(0xDEADBEEFL);

		byte[] five = new byte[8];
		byte[] twelve = new byte[8];
		Arrays.fill(five, (byte) 5);
		Arrays.fill(twelve, (byte) 12);
		oram.write(5, five);
		oram.write(12, twelve);

		byte[] readFive = oram.readMemory(5);
		byte[] readTwelve = oram.readMemory(12);
		byte[] neverWritten = oram.readMemory(7);
		logger.info("Block 5: {} | block 12: {} | block 7: {}", Arrays.toString(readFive),
				Arrays.toString(readTwelve), Arrays.toString(neverWritten));
		return Arrays.equals(five, readFive) && Arrays.equals(twelve, readTwelve)
				&& Arrays.equals(new byte[8], neverWritten);
	}

	/**
	 * @return number of correct answers, number of wrong answers and the largest stash occupancy
	 */
	private static Triple<Integer, Integer, Integer> runWorkload(ORAMContext oramContext, int nTests,
																double zipfParameter) {
		PathORAM oram = new PathORAM(oramContext, new ByteArrayServerMemory(oramContext));
		Random random = new Random();
		oram.initialize(random.nextLong());

		// half of the ids are used so the tree never fills up
		int nAddresses = Math.max(1, oramContext.getNumberOfBlocks() / 2);
		ZipfDistribution distribution = new ZipfDistribution(nAddresses, zipfParameter);
		Map<Integer, byte[]> expected = new HashMap<>();
		int correct = 0;
		int wrong = 0;
		long start = System.nanoTime();
		for (int i = 0; i < nTests; i++) {
			int address = distribution.sample() - 1;
			Operation op = random.nextBoolean() ? Operation.READ : Operation.WRITE;
			try {
				byte[] expectedContent = expected.getOrDefault(address, new byte[oramContext.getBlockSize()]);
				byte[] answer;
				if (op == Operation.WRITE) {
					byte[] value = new byte[oramContext.getBlockSize()];
					random.nextBytes(value);
					answer = oram.writeMemory(address, value);
					expected.put(address, value);
				} else {
					answer = oram.readMemory(address);
				}
				if (Arrays.equals(expectedContent, answer)) {
					correct++;
				} else {
					wrong++;
					logger.error("op {} on block {} | expected {} | answer {}", op, address,
							Arrays.toString(expectedContent), Arrays.toString(answer));
				}
			} catch (StashOverflowException e) {
				wrong++;
				logger.error("Access {} refused", i, e);
			}
		}
		long delay = System.nanoTime() - start;
		logger.info("{} accesses in {} ms", nTests, delay / 1_000_000);
		return Triple.of(correct, wrong, oram.getMaxStashSize());
	}

	private static boolean runParameterLayout() {
		ORAMContext oramContext = new ORAMContext(5, 4, 16);
		PathORAM oram = new PathORAM(oramContext, new ByteArrayServerMemory(oramContext));
		oram.initialize(42);

		int[] simd = {4, 4};
		int[] weightBits = {8, 12};
		int[] pe = {3, 2};
		int[] tiles = {5, 9};
		WeightAddressTranslator weights = new WeightAddressTranslator(16, simd, weightBits, pe, tiles);
		BlockCache blockCache = new BlockCache(oram);
		ParameterStore store = new ParameterStore(weights, blockCache);

		Random random = new Random(7);
		boolean passed = true;
		for (int layer = 0; layer < weights.getLayers(); layer++) {
			long[] values = new long[(int) weights.elementCount(layer)];
			long mask = weights.elementSize(layer) >= Long.BYTES ? -1L
					: (1L << (weights.elementSize(layer) * 8)) - 1;
			for (int i = 0; i < values.length; i++) {
				values[i] = random.nextLong() & mask;
			}
			store.storeLayer(layer, values);
			long[] stored = store.readLayer(layer);
			passed &= Arrays.equals(values, stored);
			long last = store.readWeight(weights, layer, pe[layer] - 1, tiles[layer] - 1);
			passed &= last == values[values.length - 1];
		}
		logger.info("Parameter cache: {} hits, {} misses", blockCache.getHits(), blockCache.getMisses());
		return passed;
	}
}
