package oblivious.client.structure;

import oblivious.memory.InsertResult;
import org.junit.Test;

import java.util.NoSuchElementException;

import static org.junit.Assert.*;

public class StashTest {

	@Test
	public void testPutCopiesContent() {
		Stash stash = new Stash(10, 2, 3);
		byte[] content = {1, 2, 3};
		assertTrue(stash.putBlock(4, content));
		content[0] = 9;
		assertArrayEquals(new byte[]{1, 2, 3}, stash.getBlock(4));
		assertTrue(stash.putBlock(4, new byte[]{7, 7, 7}));
		assertArrayEquals(new byte[]{7, 7, 7}, stash.getBlock(4));
		assertEquals(1, stash.size());
	}

	@Test
	public void testPutIfAbsentKeepsExisting() {
		Stash stash = new Stash(10, 2, 1);
		stash.putBlock(4, new byte[]{1});
		InsertResult result = stash.putBlockIfAbsent(4, new byte[]{2});
		assertFalse(result.isInserted());
		assertArrayEquals(new byte[]{1}, stash.getBlock(4));
	}

	@Test
	public void testFullStash() {
		Stash stash = new Stash(10, 2, 1);
		stash.putBlock(1, new byte[]{1});
		stash.putBlock(2, new byte[]{2});
		assertEquals(0, stash.available());
		assertFalse(stash.putBlock(3, new byte[]{3}));
		assertTrue(stash.putBlockIfAbsent(3, new byte[]{3}).isRejected());
		assertTrue(stash.putBlock(2, new byte[]{4}));
		assertFalse(stash.contains(3));
	}

	@Test
	public void testRemove() {
		Stash stash = new Stash(10, 3, 1);
		stash.putBlock(1, new byte[]{1});
		stash.putBlock(2, new byte[]{2});
		stash.putBlock(3, new byte[]{3});
		byte[] output = new byte[1];
		stash.getAndRemoveBlock(1, output);
		assertArrayEquals(new byte[]{1}, output);
		assertFalse(stash.contains(1));
		assertTrue(stash.removeBlock(3));
		assertFalse(stash.removeBlock(3));
		assertArrayEquals(new byte[]{2}, stash.getBlock(2));
		assertEquals(1, stash.getAddresses().size());
		assertEquals(2, stash.available());
	}

	@Test(expected = NoSuchElementException.class)
	public void testGetMissingBlock() {
		new Stash(10, 2, 1).getBlock(0);
	}

	@Test
	public void testPositionMap() {
		PositionMap positionMap = new PositionMap(4);
		assertEquals(-1, positionMap.getLocation(0));
		positionMap.update(0, 3);
		assertEquals(3, positionMap.getLocation(0));
		assertEquals(-1, positionMap.getLocation(4));
		assertEquals(4, positionMap.size());
	}
}
