package io.github.bluuewhale.containersmith;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Bounded history buffer: once every slot is used, each {@link #put} silently overwrites the
 * oldest element.
 *
 * <p>Reads are youngest-first. {@link #front()} is the most recently written element and
 * {@link #popFront()} walks backwards towards older ones, wrapping around the array once.
 * {@code head} is the read/write cursor; {@code tail} only remembers where the last write landed,
 * and together with {@code caughtUp} tells whether the backwards walk has come full circle.
 *
 * <p>Storage is either fixed at construction (at least two slots) or growable through an
 * explicit {@link #resize}. Not thread-safe.
 */
public final class RingBuffer<T> implements Iterable<T> {

	/* Storage */
	private Object[] buf;
	private final boolean growable;

	/* Cursors, always in [0, capacity) once capacity > 0 */
	private int head;
	private int tail;
	private boolean caughtUp;
	private boolean initialised;

	private RingBuffer(Object[] buf, boolean growable) {
		this.buf = buf;
		this.growable = growable;
	}

	private RingBuffer(RingBuffer<T> source, Object[] buf) {
		this.buf = buf;
		this.growable = source.growable;
		this.head = source.head;
		this.tail = source.tail;
		this.caughtUp = source.caughtUp;
		this.initialised = source.initialised;
	}

	public static <T> RingBuffer<T> fixed(int capacity) {
		Growth.validateCapacity(capacity, 2);
		return new RingBuffer<>(new Object[capacity], false);
	}

	/**
	 * Growable buffer with no storage; call {@link #resize} before writing to it.
	 */
	public static <T> RingBuffer<T> growable() {
		return growable(0);
	}

	public static <T> RingBuffer<T> growable(int capacity) {
		Growth.validateCapacity(capacity, 0);
		return new RingBuffer<>(new Object[capacity], true);
	}

	/* ------------ Buffer API ------------ */

	/**
	 * Writes {@code item} one slot ahead of the current head, overwriting whatever was there.
	 *
	 * @throws IllegalStateException if the buffer has no storage
	 */
	public void put(T item) {
		int cap = requireCapacity();
		if (initialised) {
			head = (head + 1) % cap;
		} else {
			initialised = true;
		}
		buf[head] = item;
		tail = head;
		caughtUp = true;
	}

	/**
	 * Most recently written element, or the element {@link #popFront()} has walked back to.
	 *
	 * @throws IllegalStateException if the buffer has no storage
	 */
	public T front() {
		requireCapacity();
		return castElement(buf[head]);
	}

	/**
	 * Steps one element back in time.
	 *
	 * @throws IllegalStateException if the buffer is empty or has no storage
	 */
	public void popFront() {
		int cap = requireCapacity();
		if (isEmpty()) throw new IllegalStateException("RingBuffer underrun");
		if (head == 0) {
			head = cap - 1;
			caughtUp = false;
		} else {
			head--;
		}
	}

	public boolean isEmpty() {
		return !caughtUp && head == tail;
	}

	public int capacity() {
		return buf.length;
	}

	public boolean isGrowable() {
		return growable;
	}

	/**
	 * Changes the number of slots, keeping the contents of those that survive. Cursors past the
	 * new end are clamped to the last slot.
	 *
	 * @throws UnsupportedOperationException on a fixed buffer
	 */
	public void resize(int capacity) {
		if (!growable) throw new UnsupportedOperationException("resize on a fixed RingBuffer");
		Growth.validateCapacity(capacity, 0);
		buf = Arrays.copyOf(buf, capacity);
		int last = Math.max(0, capacity - 1);
		if (head >= capacity) head = last;
		if (tail >= capacity) tail = last;
	}

	/**
	 * Snapshot of the cursors. A growable buffer's snapshot shares storage with this buffer; a
	 * fixed buffer's snapshot gets its own copy, as a fixed buffer behaves like a value.
	 */
	public RingBuffer<T> save() {
		return new RingBuffer<>(this, growable ? buf : buf.clone());
	}

	/**
	 * Fully independent copy of storage and cursors.
	 */
	public RingBuffer<T> dup() {
		return new RingBuffer<>(this, buf.clone());
	}

	/**
	 * Rewinds the cursors without touching stored elements.
	 */
	public void reset() {
		head = 0;
		tail = 0;
		caughtUp = false;
		initialised = false;
	}

	/**
	 * Rewinds the cursors and nulls out every slot.
	 */
	public void clear() {
		reset();
		Arrays.fill(buf, null);
	}

	/**
	 * Youngest-first walk over a cursor snapshot sharing this buffer's storage; this buffer is
	 * not consumed.
	 */
	@Override
	public Iterator<T> iterator() {
		RingBuffer<T> cursor = new RingBuffer<>(this, buf);
		return new Iterator<>() {
			@Override
			public boolean hasNext() {
				return cursor.capacity() > 0 && !cursor.isEmpty();
			}

			@Override
			public T next() {
				if (!hasNext()) throw new NoSuchElementException();
				T element = cursor.front();
				cursor.popFront();
				return element;
			}
		};
	}

	@Override
	public String toString() {
		return "RingBuffer{capacity=" + buf.length + ", head=" + head + ", tail=" + tail
			+ ", caughtUp=" + caughtUp + ", storage=" + Arrays.toString(buf) + '}';
	}

	/* Internal helpers */
	private int requireCapacity() {
		int cap = buf.length;
		if (cap == 0) throw new IllegalStateException("RingBuffer has zero capacity");
		return cap;
	}

	@SuppressWarnings("unchecked")
	private T castElement(Object element) {
		return (T) element;
	}
}
