package oblivious.client.structure;

import org.junit.Test;

import static org.junit.Assert.*;

public class XorShift64Test {

	@Test
	public void testFirstValue() {
		XorShift64 generator = new XorShift64(1);
		// 1 ^ 1 << 13 = 0x2001; ^ >>> 7 = 0x2041; ^ << 17 = 0x40822041
		assertEquals(0x40822041L, generator.nextLong());
	}

	@Test
	public void testSameSeedSameSequence() {
		XorShift64 a = new XorShift64(0xDEADBEEFL);
		XorShift64 b = new XorShift64(0xDEADBEEFL);
		for (int i = 0; i < 100; i++) {
			assertEquals(a.nextLong(), b.nextLong());
		}
		a.setSeed(7);
		b.setSeed(7);
		assertEquals(a.nextLeaf(8), b.nextLeaf(8));
	}

	@Test
	public void testZeroSeedDoesNotStall() {
		XorShift64 generator = new XorShift64(0);
		assertNotEquals(0L, generator.nextLong());
		assertNotEquals(0L, generator.nextLong());
	}

	@Test
	public void testLeavesInRange() {
		XorShift64 generator = new XorShift64(3);
		int[] counts = new int[16];
		for (int i = 0; i < 16000; i++) {
			counts[generator.nextLeaf(16)]++;
		}
		for (int count : counts) {
			assertTrue(count > 800);
		}
	}
}
