package oblivious.client.structure;

import oblivious.utils.EvictionOrder;
import oblivious.utils.ORAMContext;
import org.junit.Test;

import static org.junit.Assert.*;

public class BlockTest {

	@Test
	public void testNewBlockIsDummy() {
		Block block = new Block(4, 2);
		assertTrue(block.isDummy());
		assertEquals(0xFFFFL, block.getAddress());
		assertEquals(6, block.getSerializedSize());
	}

	@Test
	public void testWireFormat() {
		Block block = new Block(4, 2);
		block.setAddress(0x0102);
		block.setContent(new byte[]{9, 8, 7, 6});
		byte[] output = new byte[8];
		assertEquals(7, block.writeExternal(output, 1));
		assertArrayEquals(new byte[]{0, 0x02, 0x01, 9, 8, 7, 6, 0}, output);

		Block copy = new Block(4, 2);
		assertEquals(7, copy.readExternal(output, 1));
		assertEquals(0x0102, copy.getAddress());
		assertArrayEquals(new byte[]{9, 8, 7, 6}, copy.getContent());
	}

	@Test
	public void testDummyIsAllOnes() {
		Block block = new Block(2, 3);
		byte[] output = new byte[5];
		block.writeExternal(output, 0);
		assertArrayEquals(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0, 0}, output);
	}

	@Test
	public void testMarkDummyClearsContent() {
		Block block = new Block(3, 8);
		block.setAddress(4);
		block.setContent(new byte[]{1, 2, 3});
		block.markDummy();
		assertTrue(block.isDummy());
		assertArrayEquals(new byte[3], block.getContent());
	}

	@Test
	public void testBucketWireFormat() {
		ORAMContext oramContext = new ORAMContext(1, 2, 2, 1, 4, EvictionOrder.STASH_ORDER);
		Bucket bucket = new Bucket(oramContext);
		assertEquals(6, bucket.getSerializedSize());
		bucket.getBlock(1).setAddress(3);
		bucket.getBlock(1).setContent(new byte[]{5, 6});
		assertEquals(1, bucket.countRealBlocks());

		byte[] output = new byte[6];
		assertEquals(6, bucket.writeExternal(output, 0));
		assertArrayEquals(new byte[]{(byte) 0xFF, 0, 0, 3, 5, 6}, output);

		Bucket copy = new Bucket(oramContext);
		copy.readExternal(output, 0);
		assertTrue(copy.getBlock(0).isDummy());
		assertEquals(3, copy.getBlock(1).getAddress());
		copy.clear();
		assertEquals(0, copy.countRealBlocks());
	}
}
