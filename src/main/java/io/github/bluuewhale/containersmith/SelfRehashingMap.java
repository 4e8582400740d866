package io.github.bluuewhale.containersmith;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Map that rehashes itself as it grows (null keys and null values NOT allowed).
 *
 * <p>Entries live in a fastutil {@link Object2ObjectOpenHashMap}. Every insertion of a new key
 * bumps a counter; once more than {@code minimumNeededForRehash} new keys have arrived and the
 * map has outgrown its size at the previous rehash by {@code rehashThresholdMultiplier}, the
 * backing table is trimmed to the smallest layout that fits its entries.
 *
 * <p>Counters are bookkeeping only: {@link #equals} and {@link #hashCode} look at entries alone.
 * Not thread-safe.
 */
public class SelfRehashingMap<K, V> extends AbstractMap<K, V> {

	private static final Logger log = LoggerFactory.getLogger(SelfRehashingMap.class);

	/* Defaults */
	static final int DEFAULT_MINIMUM_NEEDED_FOR_REHASH = 64;
	static final double DEFAULT_REHASH_THRESHOLD_MULTIPLIER = 1.5d;

	/* Storage */
	private Object2ObjectOpenHashMap<K, V> map;

	/* Policy */
	private final int minimumNeededForRehash;
	private final double rehashThresholdMultiplier;
	private Consumer<? super Map<K, V>> onRehash;

	/* Bookkeeping */
	private int rehashCount;
	private int newKeysSinceLastRehash;
	private int lengthAtLastRehash;

	public SelfRehashingMap() {
		this(DEFAULT_MINIMUM_NEEDED_FOR_REHASH, DEFAULT_REHASH_THRESHOLD_MULTIPLIER);
	}

	public SelfRehashingMap(int minimumNeededForRehash, double rehashThresholdMultiplier) {
		Growth.validateMinimumNeeded(minimumNeededForRehash);
		Growth.validateThresholdMultiplier(rehashThresholdMultiplier);
		this.minimumNeededForRehash = minimumNeededForRehash;
		this.rehashThresholdMultiplier = rehashThresholdMultiplier;
		this.map = new Object2ObjectOpenHashMap<>();
	}

	/* ------------ Map API ------------ */

	@Override
	public int size() {
		return map.size();
	}

	@Override
	public boolean isEmpty() {
		return map.isEmpty();
	}

	@Override
	public boolean containsKey(Object key) {
		return map.containsKey(Objects.requireNonNull(key, "key"));
	}

	@Override
	public V get(Object key) {
		return map.get(Objects.requireNonNull(key, "key"));
	}

	/**
	 * Overwrites the value of an existing key in place. A new key is inserted and may trigger a
	 * rehash.
	 */
	@Override
	public V put(K key, V value) {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(value, "value");
		int before = map.size();
		V old = map.put(key, value);
		if (map.size() > before) maybeRehash();
		return old;
	}

	@Override
	public V remove(Object key) {
		return map.remove(Objects.requireNonNull(key, "key"));
	}

	/**
	 * Removes all entries and restarts the rehash heuristic. {@link #rehashCount()} is a
	 * lifetime statistic and survives.
	 */
	@Override
	public void clear() {
		map.clear();
		newKeysSinceLastRehash = 0;
		lengthAtLastRehash = 0;
	}

	/**
	 * Live view of the entries; {@link Entry#setValue} rejects null like {@link #put} does.
	 */
	@Override
	public Set<Entry<K, V>> entrySet() {
		return new EntrySet();
	}

	@Override
	public Set<K> keySet() {
		return map.keySet();
	}

	@Override
	public Collection<V> values() {
		return map.values();
	}

	/* ------------ Rehashing ------------ */

	/**
	 * Compacts the backing table, resets the heuristic counters and notifies the observer.
	 */
	public void rehash() {
		lengthAtLastRehash = map.size();
		newKeysSinceLastRehash = 0;
		rehashCount++;
		map.trim();
		log.debug("Rehashed map of {} entries (rehash #{})", lengthAtLastRehash, rehashCount);
		if (onRehash != null) onRehash.accept(map);
	}

	/**
	 * Registers a callback that receives the live backing map after every rehash, or clears it
	 * when {@code observer} is null.
	 */
	public void setOnRehash(Consumer<? super Map<K, V>> observer) {
		this.onRehash = observer;
	}

	public int rehashCount() {
		return rehashCount;
	}

	public int newKeysSinceLastRehash() {
		return newKeysSinceLastRehash;
	}

	public int lengthAtLastRehash() {
		return lengthAtLastRehash;
	}

	public int minimumNeededForRehash() {
		return minimumNeededForRehash;
	}

	public double rehashThresholdMultiplier() {
		return rehashThresholdMultiplier;
	}

	/* ------------ Compound operations ------------ */

	/**
	 * Returns the value for {@code key}, inserting the lazily computed default first if there is
	 * none. Never triggers a rehash.
	 */
	public V requireOrInsert(K key, Supplier<? extends V> defaultValue) {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(defaultValue, "defaultValue");
		V cur = map.get(key);
		if (cur != null || map.containsKey(key)) return cur;
		V created = Objects.requireNonNull(defaultValue.get(), "default value");
		map.put(key, created);
		return created;
	}

	/**
	 * Stores {@code value} under a randomly drawn key that was not in use and returns that key.
	 * Never triggers a rehash.
	 *
	 * @see UniqueKeys
	 */
	public K reserveUniqueKey(Supplier<? extends K> candidates, V value) {
		return UniqueKeys.reserve(map, candidates, value);
	}

	/**
	 * Deep copy of the entries. Policy and observer carry over; counters carry over only when
	 * {@code copyState} is set.
	 */
	public SelfRehashingMap<K, V> dup(boolean copyState) {
		SelfRehashingMap<K, V> copy = new SelfRehashingMap<>(minimumNeededForRehash, rehashThresholdMultiplier);
		copy.map = map.clone();
		copy.onRehash = onRehash;
		if (copyState) {
			copy.rehashCount = rehashCount;
			copy.newKeysSinceLastRehash = newKeysSinceLastRehash;
			copy.lengthAtLastRehash = lengthAtLastRehash;
		}
		return copy;
	}

	/* Internal helpers */
	private void maybeRehash() {
		newKeysSinceLastRehash++;
		if (Growth.needsRehash(newKeysSinceLastRehash, minimumNeededForRehash, map.size(), lengthAtLastRehash,
				rehashThresholdMultiplier)) {
			rehash();
		}
	}

	/* ------------ EntrySet / Iterator ------------ */

	private final class EntrySet extends AbstractSet<Entry<K, V>> {
		@Override
		public int size() {
			return map.size();
		}

		@Override
		public void clear() {
			SelfRehashingMap.this.clear();
		}

		@Override
		public boolean contains(Object o) {
			return map.entrySet().contains(o);
		}

		@Override
		public boolean remove(Object o) {
			return map.entrySet().remove(o);
		}

		@Override
		public Iterator<Entry<K, V>> iterator() {
			Iterator<Entry<K, V>> it = map.entrySet().iterator();
			return new Iterator<>() {
				@Override
				public boolean hasNext() {
					return it.hasNext();
				}

				@Override
				public Entry<K, V> next() {
					return new NonNullEntry(it.next());
				}

				@Override
				public void remove() {
					it.remove();
				}
			};
		}
	}

	private final class NonNullEntry implements Entry<K, V> {
		private final Entry<K, V> entry;

		NonNullEntry(Entry<K, V> entry) {
			this.entry = entry;
		}

		@Override
		public K getKey() {
			return entry.getKey();
		}

		@Override
		public V getValue() {
			return entry.getValue();
		}

		@Override
		public V setValue(V value) {
			return entry.setValue(Objects.requireNonNull(value, "value"));
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(getKey()) ^ Objects.hashCode(getValue());
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Entry<?, ?> e)) return false;
			return Objects.equals(getKey(), e.getKey()) && Objects.equals(getValue(), e.getValue());
		}

		@Override
		public String toString() {
			return getKey() + "=" + getValue();
		}
	}
}
