package io.github.bluuewhale.containersmith;

/**
 * Static sizing and threshold helpers shared by the buffers and the rehashing map.
 */
final class Growth {

	private Growth() {}

	/*
	 * Factor applied to a growable buffer's capacity once it is exhausted.
	 */
	static final double GROWTH_FACTOR = 1.5d;

	/*
	 * Upper bound for any array-backed capacity; a few header words below Integer.MAX_VALUE.
	 */
	static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

	/*
	 * Next capacity for an exhausted growable buffer. An empty buffer jumps straight to
	 * originalCapacity; afterwards capacity grows by GROWTH_FACTOR, never by less than one slot.
	 */
	static int nextCapacity(int capacity, int originalCapacity) {
		if (capacity >= MAX_CAPACITY) {
			throw new IllegalStateException("buffer capacity exhausted: " + capacity);
		}
		long grown = Math.max(originalCapacity, (long) (capacity * GROWTH_FACTOR));
		grown = Math.max(grown, capacity + 1L);
		return (int) Math.min(grown, MAX_CAPACITY);
	}

	static boolean needsRehash(int newKeys, int minimumNeeded, int length, int lengthAtLastRehash,
			double thresholdMultiplier) {
		return newKeys > minimumNeeded && length > lengthAtLastRehash * thresholdMultiplier;
	}

	static void validateCapacity(int capacity, int minimum) {
		if (capacity < minimum) {
			throw new IllegalArgumentException("capacity must be >= " + minimum + ": " + capacity);
		}
	}

	static void validateThresholdMultiplier(double multiplier) {
		if (!(multiplier > 1.0d) || Double.isInfinite(multiplier)) {
			throw new IllegalArgumentException("rehashThresholdMultiplier must be in (1,inf): " + multiplier);
		}
	}

	static void validateMinimumNeeded(int minimumNeeded) {
		if (minimumNeeded < 0) {
			throw new IllegalArgumentException("minimumNeededForRehash must be >= 0: " + minimumNeeded);
		}
	}
}
