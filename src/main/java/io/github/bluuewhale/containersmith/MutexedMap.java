package io.github.bluuewhale.containersmith;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.locks.StampedLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Map guarded by a single exclusive lock (null keys and null values NOT allowed).
 *
 * <p>Design notes:
 * - {@link #setup()} must run once before anything else; until then every operation throws
 *   {@link IllegalStateException}. Repeated calls are no-ops.
 * - Every operation is one critical section on a {@link StampedLock} held in write mode, reads
 *   included. Compound operations ({@link #requireOrInsert}, {@link #updateOrCreate},
 *   {@link #update}, {@link #reserveUniqueKey}) evaluate their callbacks inside that section, so
 *   no other thread ever sees the gap between the check and the write.
 * - The lock is not reentrant. A callback that calls back into the same map deadlocks.
 * - {@link #keys()}, {@link #values()} and {@link #toMap()} return copies.
 */
public final class MutexedMap<K, V> {

	private static final Logger log = LoggerFactory.getLogger(MutexedMap.class);

	private static final VarHandle GUARDED;

	static {
		try {
			GUARDED = MethodHandles.lookup().findVarHandle(MutexedMap.class, "guarded", Guarded.class);
		} catch (ReflectiveOperationException e) {
			throw new ExceptionInInitializerError(e);
		}
	}

	/** Lock and storage, published together by {@link #setup()}. */
	private static final class Guarded<K, V> {
		final StampedLock lock = new StampedLock();
		final Object2ObjectOpenHashMap<K, V> map = new Object2ObjectOpenHashMap<>();
	}

	@SuppressWarnings("FieldMayBeFinal")
	private volatile Guarded<K, V> guarded;

	public MutexedMap() {}

	/* ------------ Lifecycle ------------ */

	/**
	 * Allocates the lock and the backing map. Safe to call any number of times from any thread;
	 * only the first call has an effect.
	 */
	public void setup() {
		if (guarded != null) return;
		if (GUARDED.compareAndSet(this, null, new Guarded<K, V>())) {
			log.debug("MutexedMap {} set up", Integer.toHexString(System.identityHashCode(this)));
		}
	}

	public boolean isSetup() {
		return guarded != null;
	}

	/* ------------ Map operations ------------ */

	/**
	 * @return the previous value for {@code key}, or null if there was none
	 */
	public V put(K key, V value) {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(value, "value");
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			return g.map.put(key, value);
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/**
	 * @throws NoSuchElementException if {@code key} is absent
	 */
	public V get(K key) {
		Objects.requireNonNull(key, "key");
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			V v = g.map.get(key);
			if (v == null) throw new NoSuchElementException("No such key: " + key);
			return v;
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	public V getOrDefault(K key, V defaultValue) {
		Objects.requireNonNull(key, "key");
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			V v = g.map.get(key);
			return (v != null) ? v : defaultValue;
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/**
	 * Like {@link #getOrDefault} but the default is only computed on a miss. It is not stored.
	 */
	public V getOrElse(K key, Supplier<? extends V> defaultValue) {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(defaultValue, "defaultValue");
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			V v = g.map.get(key);
			return (v != null) ? v : defaultValue.get();
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/**
	 * @return the removed value, or null if {@code key} was absent
	 */
	public V remove(K key) {
		Objects.requireNonNull(key, "key");
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			return g.map.remove(key);
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	public boolean containsKey(K key) {
		Objects.requireNonNull(key, "key");
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			return g.map.containsKey(key);
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	public int size() {
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			return g.map.size();
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	/**
	 * @return a new list holding the keys; changes to it do not reach the map
	 */
	public List<K> keys() {
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			return new ArrayList<>(g.map.keySet());
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/**
	 * @return a new list holding the values; changes to it do not reach the map
	 */
	public List<V> values() {
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			return new ArrayList<>(g.map.values());
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/**
	 * @return a new {@link HashMap} holding every entry
	 */
	public Map<K, V> toMap() {
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			return new HashMap<>(g.map);
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/**
	 * Compacts the backing table to the smallest layout that fits the current entries.
	 */
	public void rehash() {
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			g.map.trim();
			log.debug("Rehashed MutexedMap of {} entries", g.map.size());
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	public void clear() {
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			g.map.clear();
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/* ------------ Atomic compound operations ------------ */

	/**
	 * Atomic get-or-create: returns the value for {@code key}, computing and storing
	 * {@code defaultValue} first when the key is absent. Concurrent callers racing on the same
	 * absent key all observe the single value that was stored.
	 */
	public V requireOrInsert(K key, Supplier<? extends V> defaultValue) {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(defaultValue, "defaultValue");
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			V cur = g.map.get(key);
			if (cur != null) return cur;
			V created = Objects.requireNonNull(defaultValue.get(), "default value");
			g.map.put(key, created);
			return created;
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/**
	 * Stores {@code create.get()} if {@code key} is absent, otherwise {@code update.apply(current)}.
	 *
	 * @return the value now stored
	 */
	public V updateOrCreate(K key, Supplier<? extends V> create, UnaryOperator<V> update) {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(create, "create");
		Objects.requireNonNull(update, "update");
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			V cur = g.map.get(key);
			V next = (cur == null) ? create.get() : update.apply(cur);
			g.map.put(key, Objects.requireNonNull(next, "new value"));
			return next;
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/**
	 * In-place read-modify-write of an existing entry, e.g. {@code map.update(k, n -> n + 1)}.
	 *
	 * @return the value now stored
	 * @throws NoSuchElementException if {@code key} is absent
	 */
	public V update(K key, UnaryOperator<V> update) {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(update, "update");
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			V cur = g.map.get(key);
			if (cur == null) throw new NoSuchElementException("No such key: " + key);
			V next = Objects.requireNonNull(update.apply(cur), "new value");
			g.map.put(key, next);
			return next;
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/**
	 * Stores {@code value} under a randomly drawn key that was not in use and returns that key.
	 * The whole probe loop runs under the lock.
	 *
	 * @see UniqueKeys
	 */
	public K reserveUniqueKey(Supplier<? extends K> candidates, V value) {
		Guarded<K, V> g = guarded();
		long stamp = g.lock.writeLock();
		try {
			return UniqueKeys.reserve(g.map, candidates, value);
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/* ------------ Object ------------ */

	/**
	 * Compares entries with another {@code MutexedMap} only; compare against a plain {@link Map}
	 * through {@link #toMap()}. The other map is copied under its own lock first, so the two locks
	 * are never held together.
	 */
	@Override
	public boolean equals(Object o) {
		if (o == this) return true;
		if (!(o instanceof MutexedMap<?, ?> m)) return false;
		Guarded<K, V> g = guarded;
		if (g == null || !m.isSetup()) return g == null && !m.isSetup();
		Map<?, ?> other = m.toMap();
		long stamp = g.lock.writeLock();
		try {
			return g.map.equals(other);
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/**
	 * Hash of the entries, or 0 before {@link #setup()}.
	 */
	@Override
	public int hashCode() {
		Guarded<K, V> g = guarded;
		if (g == null) return 0;
		long stamp = g.lock.writeLock();
		try {
			return g.map.hashCode();
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	@Override
	public String toString() {
		Guarded<K, V> g = guarded;
		if (g == null) return "MutexedMap{not set up}";
		long stamp = g.lock.writeLock();
		try {
			return g.map.toString();
		} finally {
			g.lock.unlockWrite(stamp);
		}
	}

	/* Internal helpers */
	private Guarded<K, V> guarded() {
		Guarded<K, V> g = guarded;
		if (g == null) throw new IllegalStateException("MutexedMap used before setup()");
		return g;
	}
}
