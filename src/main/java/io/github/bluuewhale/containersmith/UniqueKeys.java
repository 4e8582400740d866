package io.github.bluuewhale.containersmith;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Uniform samplers over integral key ranges, for {@link SelfRehashingMap#reserveUniqueKey} and
 * {@link MutexedMap#reserveUniqueKey}.
 *
 * <p>Reservation probes random keys until it finds an unused one. Nothing bounds the number of
 * probes: a nearly full range makes it slow, a full range makes it spin forever.
 */
public final class UniqueKeys {

	private UniqueKeys() {}

	/**
	 * Keys drawn uniformly from {@code [1, Integer.MAX_VALUE)}.
	 */
	public static Supplier<Integer> ints() {
		return ints(1, Integer.MAX_VALUE);
	}

	/**
	 * Keys drawn uniformly from {@code [min, max)}.
	 */
	public static Supplier<Integer> ints(int min, int max) {
		validateRange(min, max);
		return () -> ThreadLocalRandom.current().nextInt(min, max);
	}

	public static Supplier<Long> longs() {
		return longs(1L, Long.MAX_VALUE);
	}

	public static Supplier<Long> longs(long min, long max) {
		validateRange(min, max);
		return () -> ThreadLocalRandom.current().nextLong(min, max);
	}

	static <K, V> K reserve(Map<K, V> map, Supplier<? extends K> candidates, V value) {
		Objects.requireNonNull(candidates, "candidates");
		Objects.requireNonNull(value, "value");
		K key;
		do {
			key = Objects.requireNonNull(candidates.get(), "candidate key");
		} while (map.containsKey(key));
		map.put(key, value);
		return key;
	}

	private static void validateRange(long min, long max) {
		if (max <= min) {
			throw new IllegalArgumentException("max must be greater than min: [" + min + ", " + max + ")");
		}
	}
}
