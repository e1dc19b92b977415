// Part of Signals
package com.machinezoo.signals;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.lang.ref.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;

public class SignalGraphTest extends TestBase {
	@Test
	public void endToEnd() {
		AtomicInteger n = new AtomicInteger();
		SignalVariable<Integer> x = new SignalVariable<>(0, integer());
		SignalFunction<Integer> y = SignalFunction.of(x, v -> {
			n.incrementAndGet();
			return v + 1;
		}, integer());
		assertEquals(1, y.get());
		// Eager mode recomputes before the write returns, without any read.
		x.set(5);
		assertEquals(2, n.get());
		assertFalse(y.dirty());
		assertEquals(6, y.get());
		// Deferred mode recomputes at most once for the whole scope.
		DeferredScope.run(() -> {
			x.set(1);
			x.set(2);
			assertEquals(2, n.get());
		});
		assertEquals(3, n.get());
		assertEquals(3, y.get());
		assertEquals(3, n.get());
	}
	@Test
	public void eagerImmediacy() {
		SignalVariable<Integer> d = new SignalVariable<>(1, integer());
		List<Integer> seen = new ArrayList<>();
		SignalFunction<Integer> f = SignalFunction.of(d, v -> {
			seen.add(v);
			return v;
		}, integer());
		d.set(7);
		// Computation ran exactly once with the new value.
		assertEquals(List.of(1, 7), seen);
		assertEquals(7, f.get());
	}
	@Test
	public void transitive() {
		SignalVariable<Integer> x = new SignalVariable<>(1, integer());
		SignalFunction<Integer> a = SignalFunction.of(x, v -> v + 1, integer());
		SignalFunction<Integer> b = SignalFunction.of(a, v -> v * 2, integer());
		SignalFunction<Integer> c = SignalFunction.of(b, v -> v - 3, integer());
		x.set(10);
		assertFalse(a.dirty());
		assertFalse(b.dirty());
		assertFalse(c.dirty());
		assertEquals(19, c.get());
	}
	@Test
	public void diamondWithoutGlitches() {
		SignalVariable<Integer> x = new SignalVariable<>(1, integer());
		SignalFunction<Integer> a = SignalFunction.of(x, v -> v * 2, integer());
		SignalFunction<Integer> b = SignalFunction.of(x, v -> v * 3, integer());
		// Longer path to the bottom of the diamond.
		SignalFunction<Integer> c = SignalFunction.of(b, v -> v + 0, integer());
		List<String> seen = new ArrayList<>();
		SignalFunction<Integer> d = SignalFunction.of(a, c, (p, q) -> {
			seen.add(p + "/" + q);
			return p + q;
		}, integer());
		seen.clear();
		x.set(2);
		// Bottom of the diamond ran once and never observed a mix of old and new values.
		assertEquals(List.of("4/6"), seen);
		assertEquals(10, d.get());
		// Same in deferred mode.
		seen.clear();
		DeferredScope.run(() -> x.set(3));
		assertEquals(List.of("6/9"), seen);
	}
	@Test
	public void noRedundantRecompute() {
		SignalVariable<Integer> d1 = new SignalVariable<>(1, integer());
		SignalVariable<Integer> d2 = new SignalVariable<>(2, integer());
		AtomicInteger n = new AtomicInteger();
		SignalFunction<Integer> f = SignalFunction.of(d1, d2, (p, q) -> {
			n.incrementAndGet();
			return p + q;
		}, integer());
		DeferredScope.run(() -> {
			d1.set(10);
			d2.set(20);
			assertEquals(1, n.get());
		});
		assertEquals(2, n.get());
		assertEquals(30, f.get());
	}
	@Test
	public void eagerFailure() {
		SignalVariable<Integer> x = new SignalVariable<>(1, integer());
		// Constructed first, so it is recomputed before the failing function.
		SignalFunction<Integer> before = SignalFunction.of(x, v -> v * 10, integer());
		SignalFunction<Integer> failing = SignalFunction.of(x, v -> {
			if (v < 0)
				throw new ArithmeticException("negative");
			return v;
		}, integer());
		AtomicInteger n = new AtomicInteger();
		SignalFunction<Integer> after = SignalFunction.of(failing, v -> {
			n.incrementAndGet();
			return v;
		}, integer());
		SignalComputeException ex = assertThrows(SignalComputeException.class, () -> x.set(-1));
		assertThat(ex.getCause(), instanceOf(ArithmeticException.class));
		// The variable keeps the new value and functions already recomputed keep theirs.
		assertEquals(-1, x.get());
		assertFalse(before.dirty());
		assertEquals(-10, before.get());
		// The failing function and its dependents keep old values and stay dirty.
		assertTrue(failing.dirty());
		assertTrue(after.dirty());
		assertEquals(1, failing.value);
		assertEquals(1, after.value);
		assertEquals(1, n.get());
		// Reading reproduces the failure deterministically.
		assertThrows(SignalComputeException.class, after::get);
		// Fixing the input heals the graph.
		x.set(4);
		assertFalse(failing.dirty());
		assertEquals(4, after.get());
	}
	@Test
	public void failureSparesUnrelatedFunctions() {
		SignalVariable<Integer> x = new SignalVariable<>(1, integer());
		SignalFunction<Integer> failing = SignalFunction.of(x, v -> {
			if (v < 0)
				throw new ArithmeticException("negative");
			return v;
		}, integer());
		// Constructed after the failing function, but it doesn't depend on it.
		SignalFunction<Integer> sibling = SignalFunction.of(x, v -> v * 10, integer());
		SignalFunction<Integer> downstream = SignalFunction.of(failing, v -> v + 1, integer());
		assertThrows(SignalComputeException.class, () -> x.set(-1));
		assertFalse(sibling.dirty());
		assertEquals(-10, sibling.value);
		assertTrue(failing.dirty());
		assertTrue(downstream.dirty());
		assertEquals(2, downstream.value);
		// Unrelated flush retries the failing function without throwing at its caller.
		SignalVariable<Integer> y = new SignalVariable<>(0, integer());
		assertDoesNotThrow(() -> DeferredScope.run(() -> y.set(1)));
		assertTrue(failing.dirty());
		assertFalse(sibling.dirty());
	}
	@Test
	public void flushDrainsFunctionsLeftStale() {
		AtomicBoolean broken = new AtomicBoolean(true);
		SignalVariable<Integer> x = new SignalVariable<>(1, integer());
		SignalFunction<Integer> failing = SignalFunction.of(x, v -> {
			if (broken.get() && v < 0)
				throw new ArithmeticException("negative");
			return v;
		}, integer());
		SignalFunction<Integer> downstream = SignalFunction.of(failing, v -> v * 100, integer());
		assertThrows(SignalComputeException.class, () -> x.set(-1));
		assertTrue(downstream.dirty());
		broken.set(false);
		// Outermost flush settles everything left stale, even functions the scope didn't touch.
		SignalVariable<Integer> y = new SignalVariable<>(0, integer());
		DeferredScope.run(() -> y.set(1));
		assertFalse(failing.dirty());
		assertFalse(downstream.dirty());
		assertEquals(-100, downstream.value);
	}
	@Test
	public void computedTypeMismatch() {
		SignalVariable<Integer> x = new SignalVariable<>(1, integer());
		SignalFunction<Integer> f = SignalFunction.of(x, v -> v - 5, SignalType.of(Integer.class).where(v -> v < 0, "negative"));
		assertThrows(TypeMismatchException.class, () -> x.set(10));
		// Previous value is kept and the function stays dirty.
		assertTrue(f.dirty());
		assertEquals(-4, f.value);
		x.set(3);
		assertEquals(-2, f.get());
		assertFalse(f.dirty());
	}
	@Test
	public void failureDoesNotWrapTwice() {
		SignalVariable<Integer> x = new SignalVariable<>(1, integer());
		SignalFunction<Integer> a = SignalFunction.of(x, v -> 10 / v, integer());
		SignalFunction<Integer> b = SignalFunction.of(a, v -> v + 1, integer());
		DeferredScope.run(() -> {
			x.set(0);
			// Failure of the dependency passes through the dependent unchanged.
			SignalComputeException ex = assertThrows(SignalComputeException.class, b::get);
			assertThat(ex.getCause(), instanceOf(ArithmeticException.class));
			x.set(5);
		});
		assertEquals(3, b.get());
	}
	@Test
	public void collectUnreferencedFunctions() {
		SignalVariable<Integer> x = new SignalVariable<>(1, integer());
		AtomicInteger n = new AtomicInteger();
		WeakReference<SignalFunction<Integer>> ref = new WeakReference<>(SignalFunction.of(x, v -> n.incrementAndGet(), integer()));
		collect(ref);
		// Collected function silently drops out of the graph.
		assertThat(x.dependents(), empty());
		x.set(2);
		assertEquals(1, n.get());
	}
	@Test
	public void dependenciesStayReachable() {
		AtomicInteger n = new AtomicInteger();
		SignalVariable<Integer> x = new SignalVariable<>(1, integer());
		// Only the leaf is referenced. Intermediate function is kept alive by the leaf.
		SignalFunction<Integer> leaf = SignalFunction.of(SignalFunction.of(x, v -> v * 2, integer()), v -> {
			n.incrementAndGet();
			return v + 1;
		}, integer());
		for (int i = 0; i < 3; ++i)
			System.gc();
		x.set(5);
		assertEquals(2, n.get());
		assertEquals(11, leaf.get());
	}
	@Test
	public void concurrentReadersSeeConsistentValues() throws Exception {
		SignalVariable<Integer> x = new SignalVariable<>(0, integer());
		SignalFunction<Integer> doubled = SignalFunction.of(x, v -> v * 2, integer());
		SignalFunction<Integer> check = SignalFunction.of(x, doubled, (v, d) -> d - 2 * v, integer());
		ExecutorService executor = Executors.newFixedThreadPool(2);
		try {
			Future<?> writer = executor.submit(() -> {
				for (int i = 1; i <= 1000; ++i) {
					if (i % 2 == 0)
						x.set(i);
					else
						DeferredScope.run(() -> x.set(-x.get()));
				}
			});
			Future<?> reader = executor.submit(() -> {
				for (int i = 0; i < 1000; ++i)
					assertEquals(0, check.get());
			});
			writer.get(10, TimeUnit.SECONDS);
			reader.get(10, TimeUnit.SECONDS);
		} finally {
			executor.shutdown();
		}
		assertEquals(0, check.get());
	}
}
