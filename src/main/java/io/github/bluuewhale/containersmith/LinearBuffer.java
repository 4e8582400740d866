package io.github.bluuewhale.containersmith;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Single-ended FIFO buffer over a flat array (null elements allowed).
 *
 * <p>A fixed buffer allocates its storage up front and refuses to grow; a growable buffer starts
 * empty, jumps to {@code originalCapacity} on the first {@link #put} and then grows by a factor
 * of 1.5. Draining the last element rewinds both cursors to zero without touching storage, so a
 * buffer that is filled and drained in cycles never reallocates.
 *
 * <p>Not thread-safe.
 */
public final class LinearBuffer<T> implements Iterable<T> {

	/* Defaults */
	static final int DEFAULT_ORIGINAL_CAPACITY = 128;

	/* Storage */
	private Object[] buf;
	private int capacity;
	private final int originalCapacity;
	private final boolean growable;

	/* Cursors: 0 <= pos <= end <= capacity */
	private int pos;
	private int end;

	private LinearBuffer(int capacity, int originalCapacity, boolean growable) {
		this.buf = new Object[capacity];
		this.capacity = capacity;
		this.originalCapacity = originalCapacity;
		this.growable = growable;
	}

	/**
	 * Buffer with a hard limit of {@code capacity} elements between two resets.
	 */
	public static <T> LinearBuffer<T> fixed(int capacity) {
		Growth.validateCapacity(capacity, 1);
		return new LinearBuffer<>(capacity, capacity, false);
	}

	public static <T> LinearBuffer<T> growable() {
		return growable(DEFAULT_ORIGINAL_CAPACITY);
	}

	/**
	 * Growable buffer that allocates nothing until the first {@link #put}, then
	 * {@code originalCapacity} slots.
	 */
	public static <T> LinearBuffer<T> growable(int originalCapacity) {
		Growth.validateCapacity(originalCapacity, 1);
		return new LinearBuffer<>(0, originalCapacity, true);
	}

	/* ------------ Buffer API ------------ */

	/**
	 * Appends {@code item} at the end of the buffer.
	 *
	 * @throws IllegalStateException if this is a fixed buffer and it is full
	 */
	public void put(T item) {
		if (end == capacity) {
			if (!growable) {
				throw new IllegalStateException("LinearBuffer overflow: capacity " + capacity);
			}
			grow(Growth.nextCapacity(capacity, originalCapacity));
		}
		buf[end++] = item;
	}

	/**
	 * @throws IllegalStateException if the buffer is empty
	 */
	public T front() {
		if (end == 0) throw new IllegalStateException("LinearBuffer underrun");
		return castElement(buf[pos]);
	}

	/**
	 * Advances past the front element. Consuming the last element soft-empties the buffer.
	 *
	 * @throws IllegalStateException if the buffer is empty
	 */
	public void popFront() {
		if (end == 0) throw new IllegalStateException("LinearBuffer underrun");
		if (++pos == end) reset();
	}

	public int length() {
		return end - pos;
	}

	public boolean isEmpty() {
		return end == 0;
	}

	public int capacity() {
		return capacity;
	}

	public boolean isGrowable() {
		return growable;
	}

	/**
	 * Grows storage to {@code size} slots if it is currently smaller.
	 *
	 * @throws UnsupportedOperationException on a fixed buffer
	 */
	public void reserve(int size) {
		if (!growable) throw new UnsupportedOperationException("reserve on a fixed LinearBuffer");
		if (capacity < size) grow(size);
	}

	/**
	 * Rewinds both cursors. Old elements stay in storage until overwritten.
	 */
	public void reset() {
		pos = 0;
		end = 0;
	}

	/**
	 * Rewinds both cursors and nulls out every slot. Capacity is kept.
	 */
	public void clear() {
		reset();
		Arrays.fill(buf, null);
	}

	@Override
	public Iterator<T> iterator() {
		return new Iterator<>() {
			private int next = pos;
			private final int stop = end;

			@Override
			public boolean hasNext() {
				return next < stop;
			}

			@Override
			public T next() {
				if (next >= stop) throw new NoSuchElementException();
				return castElement(buf[next++]);
			}
		};
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("[");
		for (int i = pos; i < end; i++) {
			if (i > pos) sb.append(", ");
			sb.append(buf[i]);
		}
		return sb.append(']').toString();
	}

	/* Internal helpers */
	private void grow(int newCapacity) {
		buf = Arrays.copyOf(buf, newCapacity);
		capacity = newCapacity;
	}

	@SuppressWarnings("unchecked")
	private T castElement(Object element) {
		return (T) element;
	}
}
