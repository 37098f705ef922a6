package oblivious.memory;

import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.PrimitiveIterator;
import java.util.Random;
import java.util.Set;

import static org.junit.Assert.*;

public class SparseSetTest {

	@Test
	public void testInsertThenContains() {
		SparseSet set = new SparseSet(100);
		for (int key = 0; key < 100; key += 7) {
			assertTrue(set.insert(key));
			assertTrue(set.contains(key));
		}
		assertFalse(set.contains(1));
		assertEquals(15, set.size());
	}

	@Test
	public void testInsertIsIdempotent() {
		SparseSet set = new SparseSet(10);
		assertTrue(set.insert(3));
		assertFalse(set.insert(3));
		assertEquals(1, set.size());
	}

	@Test
	public void testEraseThenNotContains() {
		SparseSet set = new SparseSet(10);
		set.insert(1);
		set.insert(2);
		set.insert(3);
		assertTrue(set.erase(1));
		assertFalse(set.contains(1));
		assertTrue(set.contains(2));
		assertTrue(set.contains(3));
		assertFalse(set.erase(1));
		assertEquals(2, set.size());
	}

	@Test
	public void testEraseMovesLastEntry() {
		SparseSet set = new SparseSet(10);
		set.insert(4);
		set.insert(5);
		set.insert(6);
		set.erase(4);
		assertEquals(6, set.get(0));
		assertEquals(0, set.indexOf(6));
		assertEquals(1, set.indexOf(5));
	}

	@Test
	public void testInsertRejectedWhenFull() {
		SparseSet set = new SparseSet(10, 2);
		assertTrue(set.insert(8));
		assertTrue(set.insert(9));
		assertTrue(set.isFull());
		assertFalse(set.insert(0));
		assertFalse(set.contains(0));
		assertEquals(2, set.size());
	}

	@Test
	public void testKeysOutsideDomain() {
		SparseSet set = new SparseSet(4);
		assertFalse(set.insert(-1));
		assertFalse(set.insert(4));
		assertFalse(set.contains(4));
		assertFalse(set.erase(-1));
	}

	@Test
	public void testStaleSparseEntryIsNotMember() {
		SparseSet set = new SparseSet(10);
		set.insert(7);
		set.erase(7);
		set.insert(2);
		// sparse[7] still points at position 0, which now holds 2
		assertFalse(set.contains(7));
	}

	@Test
	public void testClear() {
		SparseSet set = new SparseSet(10);
		set.insert(1);
		set.insert(9);
		set.clear();
		assertTrue(set.isEmpty());
		assertFalse(set.contains(1));
		assertTrue(set.insert(9));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDenseLargerThanSparse() {
		new SparseSet(4, 5);
	}

	@Test
	public void testSizeMatchesMembersUnderRandomOperations() {
		Random random = new Random(11);
		SparseSet set = new SparseSet(64, 32);
		Set<Integer> expected = new HashSet<>();
		for (int i = 0; i < 5000; i++) {
			int key = random.nextInt(64);
			if (random.nextBoolean()) {
				boolean inserted = set.insert(key);
				assertEquals(!expected.contains(key) && expected.size() < 32, inserted);
				if (inserted)
					expected.add(key);
			} else {
				assertEquals(expected.remove(key), set.erase(key));
			}
			assertEquals(expected.size(), set.size());
		}
		for (int key = 0; key < 64; key++) {
			assertEquals(expected.contains(key), set.contains(key));
		}
	}

	@Test
	public void testIterationVisitsEveryKey() {
		SparseSet set = new SparseSet(20);
		Set<Integer> expected = new HashSet<>();
		for (int key = 0; key < 20; key += 3) {
			set.insert(key);
			expected.add(key);
		}
		Set<Integer> visited = new HashSet<>();
		PrimitiveIterator.OfInt it = set.iterator();
		while (it.hasNext()) {
			assertTrue(visited.add(it.nextInt()));
		}
		assertEquals(expected, visited);
	}

	@Test
	public void testEraseCurrentDuringIteration() {
		SparseSet set = new SparseSet(20);
		Set<Integer> expected = new HashSet<>();
		for (int key = 1; key < 20; key += 2) {
			set.insert(key);
			expected.add(key);
		}
		Set<Integer> visited = new HashSet<>();
		PrimitiveIterator.OfInt it = set.iterator();
		while (it.hasNext()) {
			int key = it.nextInt();
			assertTrue(visited.add(key));
			if (key % 3 == 0)
				set.erase(key);
		}
		assertEquals(expected, visited);
		assertFalse(set.contains(3));
		assertFalse(set.contains(9));
		assertTrue(set.contains(5));
	}

	@Test
	public void testEraseUnvisitedKeyRepeatsLastKey() {
		SparseSet set = new SparseSet(8);
		set.insert(0);
		set.insert(1);
		set.insert(2);
		List<Integer> visited = new ArrayList<>();
		PrimitiveIterator.OfInt it = set.iterator();
		visited.add(it.nextInt());
		// 0 sits at position 0 and is replaced by 2, the key just returned
		set.erase(0);
		while (it.hasNext()) {
			visited.add(it.nextInt());
		}
		assertEquals(List.of(2, 1, 2), visited);
	}

	@Test
	public void testEraseAllDuringIteration() {
		SparseSet set = new SparseSet(8);
		for (int key = 0; key < 8; key++) {
			set.insert(key);
		}
		int visited = 0;
		PrimitiveIterator.OfInt it = set.iterator();
		while (it.hasNext()) {
			set.erase(it.nextInt());
			visited++;
		}
		assertEquals(8, visited);
		assertTrue(set.isEmpty());
	}
}
