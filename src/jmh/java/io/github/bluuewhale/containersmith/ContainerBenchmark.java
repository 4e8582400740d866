package io.github.bluuewhale.containersmith;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class ContainerBenchmark {

	@State(Scope.Thread)
	public static class BufferState {
		@Param({ "16", "128", "1024" })
		int size;

		LinearBuffer<Integer> fixed;
		LinearBuffer<Integer> growable;
		RingBuffer<Integer> ring;
		ArrayDeque<Integer> deque;
		Integer[] items;

		@Setup(Level.Trial)
		public void setup() {
			var rnd = new Random(123);
			items = IntStream.range(0, size).map(i -> rnd.nextInt()).boxed().toArray(Integer[]::new);
			fixed = LinearBuffer.fixed(size);
			growable = LinearBuffer.growable();
			ring = RingBuffer.fixed(Math.max(2, size / 4));
			deque = new ArrayDeque<>(size);
		}
	}

	@State(Scope.Benchmark)
	public static class MapState {
		@Param({ "100", "1000", "10000" })
		int size;

		int[] keys;
		Random rnd;
		MutexedMap<Integer, Integer> mutexed;
		ConcurrentHashMap<Integer, Integer> chm;

		@Setup(Level.Trial)
		public void setup() {
			rnd = new Random(456);
			keys = IntStream.range(0, size).map(i -> rnd.nextInt()).toArray();
			mutexed = new MutexedMap<>();
			mutexed.setup();
			chm = new ConcurrentHashMap<>();
			for (int i = 0; i < size; i++) {
				mutexed.put(keys[i], i);
				chm.put(keys[i], i);
			}
		}

		int nextKey() { return keys[rnd.nextInt(keys.length)]; }
	}

	@State(Scope.Thread)
	public static class InsertState {
		@Param({ "1000", "100000" })
		int size;

		int[] keys;

		@Setup(Level.Trial)
		public void setup() {
			var rnd = new Random(789);
			keys = IntStream.range(0, size).map(i -> rnd.nextInt()).toArray();
		}
	}

	// ------- fill then drain -------
	@Benchmark
	public long fixedLinearFillDrain(BufferState s) {
		long sum = 0;
		for (Integer item : s.items) s.fixed.put(item);
		while (!s.fixed.isEmpty()) {
			sum += s.fixed.front();
			s.fixed.popFront();
		}
		return sum;
	}

	@Benchmark
	public long growableLinearFillDrain(BufferState s) {
		long sum = 0;
		for (Integer item : s.items) s.growable.put(item);
		while (!s.growable.isEmpty()) {
			sum += s.growable.front();
			s.growable.popFront();
		}
		return sum;
	}

	@Benchmark
	public long dequeFillDrain(BufferState s) {
		long sum = 0;
		for (Integer item : s.items) s.deque.addLast(item);
		while (!s.deque.isEmpty()) sum += s.deque.pollFirst();
		return sum;
	}

	@Benchmark
	public int ringPut(BufferState s) {
		for (Integer item : s.items) s.ring.put(item);
		return s.ring.front();
	}

	// ------- rehashing vs plain insert -------
	@Benchmark
	public int selfRehashingInsert(InsertState s) {
		var m = new SelfRehashingMap<Integer, Integer>();
		for (int k : s.keys) m.put(k, k);
		return m.size();
	}

	@Benchmark
	public int jdkInsert(InsertState s) {
		var m = new HashMap<Integer, Integer>();
		for (int k : s.keys) m.put(k, k);
		return m.size();
	}

	// ------- guarded reads and get-or-create -------
	@Benchmark
	public int mutexedGet(MapState s) {
		return s.mutexed.get(s.nextKey());
	}

	@Benchmark
	public int chmGet(MapState s) {
		return s.chm.get(s.nextKey());
	}

	@Benchmark
	public int mutexedRequireOrInsert(MapState s) {
		return s.mutexed.requireOrInsert(s.nextKey(), () -> -1);
	}

	@Benchmark
	public int chmComputeIfAbsent(MapState s) {
		return s.chm.computeIfAbsent(s.nextKey(), k -> -1);
	}
}
