package oblivious.utils;

import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import static org.junit.Assert.*;

public class ORAMContextTest {

	@Test
	public void testDerivedValues() {
		ORAMContext oramContext = new ORAMContext(3, 4, 8);
		assertEquals(3, oramContext.getTreeHeight());
		assertEquals(4, oramContext.getTreeLevels());
		assertEquals(15, oramContext.getTreeSize());
		assertEquals(8, oramContext.getNumberOfLeaves());
		assertEquals(60, oramContext.getNumberOfBlocks());
		assertEquals(16, oramContext.getSlotSize());
		assertEquals(64, oramContext.getBucketByteSize());
		assertEquals(960, oramContext.getServerSize());
		assertEquals(16, oramContext.getPathCapacity());
		assertEquals(-1L, oramContext.getInvalidId());
		assertEquals(EvictionOrder.STASH_ORDER, oramContext.getEvictionOrder());
	}

	@Test
	public void testDefaultStashCapacity() {
		// ceil(log2(60)) * 4 = 24
		assertEquals(24, ORAMContext.computeDefaultStashCapacity(3, 4));
		assertEquals(24, new ORAMContext(3, 4, 8).getStashCapacity());
		assertEquals(52, ORAMContext.computeDefaultStashCapacity(10, 4));
		// never smaller than one path
		assertEquals(ORAMUtils.computePathLength(1, 16), ORAMContext.computeDefaultStashCapacity(1, 16));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTreeHeightTooLarge() {
		new ORAMContext(ORAMContext.MAX_TREE_HEIGHT + 1, 4, 8);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeTreeHeight() {
		new ORAMContext(-1, 4, 8);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testZeroBucketSize() {
		new ORAMContext(3, 0, 8);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testIdSizeTooSmallForBlocks() {
		// 508 blocks need more than one id byte
		new ORAMContext(6, 4, 8, 1, 32, EvictionOrder.STASH_ORDER);
	}

	@Test
	public void testIdSizeJustLargeEnough() {
		// 252 blocks, ids 0..251 stay below the sentinel 255
		ORAMContext oramContext = new ORAMContext(5, 4, 8, 1, 32, EvictionOrder.STASH_ORDER);
		assertEquals(0xFFL, oramContext.getInvalidId());
		assertEquals(9, oramContext.getSlotSize());
	}

	@Test
	public void testFromProperties() throws IOException {
		Properties properties = new Properties();
		try (InputStream in = getClass().getResourceAsStream("/oram.properties")) {
			assertNotNull(in);
			properties.load(in);
		}
		ORAMContext oramContext = ORAMContext.fromProperties(properties);
		assertEquals(4, oramContext.getTreeHeight());
		assertEquals(4, oramContext.getBucketSize());
		assertEquals(16, oramContext.getBlockSize());
		assertEquals(2, oramContext.getIdSize());
		assertEquals(40, oramContext.getStashCapacity());
		assertEquals(EvictionOrder.SHUFFLED, oramContext.getEvictionOrder());
	}

	@Test
	public void testFromPropertiesDefaults() {
		Properties properties = new Properties();
		properties.setProperty("oram.tree_height", "3");
		properties.setProperty("oram.block_size", "8");
		properties.setProperty("oram.stash_capacity", " ");
		ORAMContext oramContext = ORAMContext.fromProperties(properties);
		assertEquals(ORAMContext.DEFAULT_BUCKET_SIZE, oramContext.getBucketSize());
		assertEquals(ORAMContext.DEFAULT_ID_SIZE, oramContext.getIdSize());
		assertEquals(24, oramContext.getStashCapacity());
		assertEquals(EvictionOrder.STASH_ORDER, oramContext.getEvictionOrder());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingBlockSize() {
		Properties properties = new Properties();
		properties.setProperty("oram.tree_height", "3");
		ORAMContext.fromProperties(properties);
	}
}
