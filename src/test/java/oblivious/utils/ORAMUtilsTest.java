package oblivious.utils;

import org.junit.Test;

import static org.junit.Assert.*;

public class ORAMUtilsTest {

	@Test
	public void testTreeShape() {
		assertEquals(15, ORAMUtils.computeNumberOfNodes(3));
		assertEquals(8, ORAMUtils.computeNumberOfLeaves(3));
		assertEquals(60, ORAMUtils.computeNumberOfSlots(3, 4));
		assertEquals(16, ORAMUtils.computePathLength(3, 4));
		assertEquals(960, ORAMUtils.computeServerSize(3, 4, 16));
		assertEquals(1, ORAMUtils.computeNumberOfNodes(0));
	}

	@Test
	public void testPathLocations() {
		assertArrayEquals(new int[]{0, 1, 3, 7}, ORAMUtils.computePathLocations(0, 3));
		assertArrayEquals(new int[]{0, 2, 5, 12}, ORAMUtils.computePathLocations(5, 3));
		assertArrayEquals(new int[]{0, 2, 6, 14}, ORAMUtils.computePathLocations(7, 3));
		assertArrayEquals(new int[]{0}, ORAMUtils.computePathLocations(0, 0));
	}

	@Test
	public void testNodeOnPathMatchesPathLocations() {
		int treeHeight = 6;
		for (int leaf = 0; leaf < ORAMUtils.computeNumberOfLeaves(treeHeight); leaf++) {
			int[] path = ORAMUtils.computePathLocations(leaf, treeHeight);
			for (int level = 0; level <= treeHeight; level++) {
				assertEquals(path[level], ORAMUtils.computeNodeOnPath(leaf, level, treeHeight));
				assertEquals(level, ORAMUtils.computeLevel(path[level]));
			}
		}
	}

	@Test
	public void testCeilLog2() {
		assertEquals(0, ORAMUtils.ceilLog2(1));
		assertEquals(1, ORAMUtils.ceilLog2(2));
		assertEquals(2, ORAMUtils.ceilLog2(3));
		assertEquals(6, ORAMUtils.ceilLog2(60));
		assertEquals(6, ORAMUtils.ceilLog2(64));
		assertEquals(7, ORAMUtils.ceilLog2(65));
	}

	@Test
	public void testCeilDiv() {
		assertEquals(0, ORAMUtils.ceilDiv(0, 4));
		assertEquals(1, ORAMUtils.ceilDiv(4, 4));
		assertEquals(2, ORAMUtils.ceilDiv(5, 4));
	}

	@Test
	public void testInvalidId() {
		assertEquals(0xFFL, ORAMUtils.computeInvalidId(1));
		assertEquals(0xFFFFFFFFL, ORAMUtils.computeInvalidId(4));
		assertEquals(-1L, ORAMUtils.computeInvalidId(8));
	}

	@Test
	public void testLittleEndian() {
		byte[] buffer = new byte[6];
		ORAMUtils.serializeLittleEndian(0x0A0B0C0DL, 4, buffer, 1);
		assertArrayEquals(new byte[]{0, 0x0D, 0x0C, 0x0B, 0x0A, 0}, buffer);
		assertEquals(0x0A0B0C0DL, ORAMUtils.deserializeLittleEndian(buffer, 1, 4));
		assertEquals(0x0C0DL, ORAMUtils.deserializeLittleEndian(buffer, 1, 2));
	}

	@Test
	public void testLittleEndianAllOnes() {
		byte[] buffer = new byte[8];
		ORAMUtils.serializeLittleEndian(-1L, 8, buffer, 0);
		for (byte b : buffer) {
			assertEquals((byte) 0xFF, b);
		}
		assertEquals(-1L, ORAMUtils.deserializeLittleEndian(buffer, 0, 8));
		assertEquals(0xFFFFL, ORAMUtils.deserializeLittleEndian(buffer, 0, 2));
	}
}
