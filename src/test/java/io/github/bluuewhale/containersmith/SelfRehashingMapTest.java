package io.github.bluuewhale.containersmith;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class SelfRehashingMapTest {

	@Test
	void crossingMinimumTriggersExactlyOneRehash() {
		var m = new SelfRehashingMap<Integer, String>(8, 1.5d);

		for (int i = 0; i < 8; i++) m.put(i, "v" + i);
		assertEquals(0, m.rehashCount());
		assertEquals(8, m.newKeysSinceLastRehash());

		m.put(8, "v8");
		assertEquals(1, m.rehashCount());
		assertEquals(0, m.newKeysSinceLastRehash());
		assertEquals(9, m.lengthAtLastRehash());

		// Next rehash needs 9 more new keys and size > 9 * 1.5.
		for (int i = 9; i < 17; i++) m.put(i, "v" + i);
		assertEquals(1, m.rehashCount());
		m.put(17, "v17");
		assertEquals(2, m.rehashCount());
		assertEquals(18, m.lengthAtLastRehash());

		for (int i = 0; i < 18; i++) assertEquals("v" + i, m.get(i));
	}

	private static Stream<Arguments> multiplierCases() {
		return Stream.of(
			Arguments.of(2.0d, List.of(1, 3, 7, 15, 31)),
			Arguments.of(4.0d, List.of(1, 5, 21))
		);
	}

	@ParameterizedTest(name = "multiplier {0} rehashes at sizes {1}")
	@MethodSource("multiplierCases")
	void multiplierGatesRehashOnceMinimumIsZero(double multiplier, List<Integer> expectedSizes) {
		var m = new SelfRehashingMap<Integer, Integer>(0, multiplier);
		List<Integer> observed = new ArrayList<>();
		m.setOnRehash(map -> observed.add(map.size()));

		int last = expectedSizes.get(expectedSizes.size() - 1);
		for (int i = 0; i < last; i++) m.put(i, i);

		assertEquals(expectedSizes, observed);
		assertEquals(expectedSizes.size(), m.rehashCount());
	}

	@Test
	void overwritingExistingKeyDoesNoBookkeeping() {
		var m = new SelfRehashingMap<String, Integer>(1, 1.5d);
		m.put("a", 1);
		assertEquals(1, m.newKeysSinceLastRehash());

		for (int i = 0; i < 100; i++) assertNotNull(m.put("a", i));
		assertEquals(1, m.newKeysSinceLastRehash());
		assertEquals(0, m.rehashCount());
		assertEquals(99, m.get("a"));
	}

	@Test
	void observerReceivesLiveBackingMap() {
		var m = new SelfRehashingMap<Integer, Integer>(0, 1.5d);
		m.setOnRehash(map -> map.put(-1, -1));

		m.put(1, 1);
		assertEquals(1, m.rehashCount());
		assertEquals(-1, m.get(-1), "observer mutations land in the map");
		assertEquals(2, m.size());

		m.setOnRehash(null);
		m.rehash();
		assertEquals(2, m.rehashCount());
	}

	@Test
	void explicitRehashKeepsEntries() {
		var m = new SelfRehashingMap<Integer, Integer>();
		int n = 10_000;
		for (int i = 0; i < n; i++) m.put(i, i * 2);
		for (int i = 0; i < n; i += 2) m.remove(i);

		int before = m.rehashCount();
		m.rehash();

		assertEquals(before + 1, m.rehashCount());
		assertEquals(0, m.newKeysSinceLastRehash());
		assertEquals(n / 2, m.lengthAtLastRehash());
		assertEquals(n / 2, m.size());
		for (int i = 0; i < n; i++) {
			if (i % 2 == 0) assertNull(m.get(i));
			else assertEquals(i * 2, m.get(i));
		}
	}

	@Test
	void requireOrInsertSkipsRehashDecision() {
		var m = new SelfRehashingMap<Integer, String>(0, 1.5d);
		int[] calls = { 0 };

		assertEquals("x", m.requireOrInsert(1, () -> { calls[0]++; return "x"; }));
		assertEquals("x", m.requireOrInsert(1, () -> { calls[0]++; return "y"; }));

		assertEquals(1, calls[0], "default is only evaluated on a miss");
		assertEquals(0, m.newKeysSinceLastRehash());
		assertEquals(0, m.rehashCount());
		assertEquals(1, m.size());
	}

	@Test
	void reserveUniqueKeyFindsTheOnlyFreeKey() {
		var m = new SelfRehashingMap<Integer, Integer>();
		assertEquals(5, m.reserveUniqueKey(UniqueKeys.ints(5, 6), 42));
		assertEquals(42, m.get(5));

		for (int i = 10; i < 19; i++) m.put(i, 0);
		assertEquals(19, m.reserveUniqueKey(UniqueKeys.ints(10, 20), 7));
		assertEquals(7, m.get(19));
	}

	@Test
	void reserveUniqueKeyWithDefaultRange() {
		var m = new SelfRehashingMap<Long, String>();
		long key = m.reserveUniqueKey(UniqueKeys.longs(), "reserved");
		assertTrue(key >= 1);
		assertEquals("reserved", m.get(key));
	}

	@Test
	void dupCopiesEntriesAndOptionallyState() {
		var m = new SelfRehashingMap<Integer, Integer>(2, 1.5d);
		for (int i = 0; i < 5; i++) m.put(i, i);
		assertEquals(1, m.rehashCount());

		var withState = m.dup(true);
		var withoutState = m.dup(false);

		assertEquals(m, withState);
		assertEquals(m, withoutState);
		assertEquals(m.rehashCount(), withState.rehashCount());
		assertEquals(m.newKeysSinceLastRehash(), withState.newKeysSinceLastRehash());
		assertEquals(m.lengthAtLastRehash(), withState.lengthAtLastRehash());
		assertEquals(0, withoutState.rehashCount());
		assertEquals(0, withoutState.newKeysSinceLastRehash());
		assertEquals(0, withoutState.lengthAtLastRehash());
		assertEquals(m.minimumNeededForRehash(), withoutState.minimumNeededForRehash());

		withState.put(100, 100);
		assertFalse(m.containsKey(100), "dup must not share storage");
	}

	@Test
	void equalityIgnoresCounters() {
		var a = new SelfRehashingMap<String, Integer>(0, 1.5d);
		var b = new SelfRehashingMap<String, Integer>(100, 3.0d);
		a.put("x", 1);
		a.put("y", 2);
		b.put("y", 2);
		b.put("x", 1);

		assertNotEquals(a.rehashCount(), b.rehashCount());
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertEquals(Map.of("x", 1, "y", 2), a);
		assertEquals(a, new HashMap<>(Map.of("x", 1, "y", 2)));
	}

	@Test
	void clearWipesEntriesAndHeuristicCounters() {
		var m = new SelfRehashingMap<Integer, Integer>(3, 1.5d);
		for (int i = 0; i < 6; i++) m.put(i, i);
		int rehashes = m.rehashCount();
		assertTrue(rehashes > 0);

		m.clear();
		assertTrue(m.isEmpty());
		assertEquals(0, m.newKeysSinceLastRehash());
		assertEquals(0, m.lengthAtLastRehash());
		assertEquals(rehashes, m.rehashCount());
	}

	@Test
	void entrySetIteratorRemovesFromBackingMap() {
		var m = new SelfRehashingMap<Integer, Integer>();
		for (int i = 0; i < 10; i++) m.put(i, i);

		var it = m.entrySet().iterator();
		while (it.hasNext()) {
			if (it.next().getKey() % 2 == 0) it.remove();
		}
		assertEquals(5, m.size());
		for (int i = 0; i < 10; i++) assertEquals(i % 2 != 0, m.containsKey(i));
	}

	@Test
	void entrySetRejectsNullValues() {
		var m = new SelfRehashingMap<String, Integer>(1, 1.5d);
		m.put("a", 1);

		var entry = m.entrySet().iterator().next();
		assertThrows(NullPointerException.class, () -> entry.setValue(null));
		assertEquals(1, m.get("a"));

		assertEquals(1, entry.setValue(2));
		assertEquals(2, m.get("a"));
		assertEquals(Map.entry("a", 2), entry);
	}

	@Test
	void overwriteAfterEntryUpdateDoesNoBookkeeping() {
		var m = new SelfRehashingMap<String, Integer>(1, 1.5d);
		m.put("a", 1);
		m.entrySet().iterator().next().setValue(5);

		assertEquals(5, m.put("a", 6));
		assertEquals(1, m.newKeysSinceLastRehash());
		assertEquals(0, m.rehashCount());
		assertEquals(6, m.requireOrInsert("a", () -> 7));
	}

	@Test
	void nullsAndBadPolicyAreRejected() {
		var m = new SelfRehashingMap<String, String>();
		assertThrows(NullPointerException.class, () -> m.put(null, "v"));
		assertThrows(NullPointerException.class, () -> m.put("k", null));
		assertThrows(IllegalArgumentException.class, () -> new SelfRehashingMap<String, String>(8, 1.0d));
		assertThrows(IllegalArgumentException.class, () -> new SelfRehashingMap<String, String>(8, Double.NaN));
		assertThrows(IllegalArgumentException.class, () -> new SelfRehashingMap<String, String>(-1, 2.0d));
	}
}
