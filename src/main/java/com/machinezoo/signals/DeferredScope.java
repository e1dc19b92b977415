// Part of Signals
package com.machinezoo.signals;

import java.util.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.signals.util.*;
import com.machinezoo.stagean.*;

/*
 * Deferred scope batches related writes, so that dependent functions are recomputed once for the whole batch
 * instead of once per write. It is a dynamically scoped flag kept in a thread-local context object.
 * 
 * Scopes nest. The context object only needs to count markers, because markers carry no data.
 * Only the outermost exit flushes. Context object is removed from the thread when the outermost scope exits,
 * so idle threads don't carry any state.
 * 
 * Scopes are designed for try-with-resources, which guarantees the flush even when the body throws.
 * Staleness thus never leaks past the outermost scope. If the flush itself fails while the body is throwing,
 * try-with-resources attaches the flush failure to the body's exception as a suppressed exception.
 */
/**
 * Thread-local batching boundary for signal updates.
 * While any deferred scope is open on the current thread, writes only mark dependent {@link SignalFunction}s dirty.
 * Dirty functions are recomputed when read or when the outermost scope exits, whichever comes first.
 * 
 * <pre>{@code
 * try (CloseableScope deferred = DeferredScope.enter()) {
 *     x.set(1);
 *     y.set(2);
 * }
 * }</pre>
 */
public class DeferredScope {
	private static final ThreadLocal<DeferredScope> current = new ThreadLocal<>();
	static DeferredScope current() {
		return current.get();
	}
	private int depth;
	/*
	 * Functions invalidated on this thread while the scope is open. Weak, so that batching doesn't keep garbage alive.
	 * Only the owning thread touches the set and it does so while holding the graph lock.
	 */
	private final Set<SignalFunction<?>> invalidated = Collections.newSetFromMap(new WeakHashMap<>());
	void defer(Collection<SignalFunction<?>> functions) {
		invalidated.addAll(functions);
	}
	private DeferredScope() {
		OwnerTrace.of(this)
			.alias("deferred")
			.tag("thread", Thread.currentThread().getName());
	}
	/**
	 * Opens deferred scope on the current thread.
	 * The returned {@link CloseableScope} exits the scope when closed.
	 * It must be closed exactly once and on the same thread.
	 * 
	 * @return handle that exits the scope when closed
	 */
	public static CloseableScope enter() {
		DeferredScope scope = current.get();
		if (scope == null) {
			scope = new DeferredScope();
			current.set(scope);
		}
		++scope.depth;
		return new Marker(scope);
	}
	private static class Marker implements CloseableScope {
		final DeferredScope scope;
		boolean closed;
		Marker(DeferredScope scope) {
			this.scope = scope;
		}
		@Override
		public void close() {
			if (closed)
				throw new IllegalStateException("Deferred scope was already exited.");
			if (current.get() != scope)
				throw new IllegalStateException("Deferred scope must be exited on the thread that entered it.");
			closed = true;
			scope.exit();
		}
	}
	/*
	 * Flush runs with the scope already removed, so that writes performed by computations during flush propagate eagerly.
	 */
	private void exit() {
		--depth;
		if (depth == 0) {
			current.remove();
			SignalGraph.flush(this, invalidated);
		}
	}
	/**
	 * Checks whether any deferred scope is open on the current thread.
	 * 
	 * @return {@code true} if writes on this thread are currently deferred
	 */
	public static boolean active() {
		return current.get() != null;
	}
	/**
	 * Gets nesting depth of deferred scopes on the current thread.
	 * 
	 * @return number of open deferred scopes, zero if there are none
	 */
	public static int depth() {
		DeferredScope scope = current.get();
		return scope != null ? scope.depth : 0;
	}
	public static void run(Runnable runnable) {
		Objects.requireNonNull(runnable);
		try (CloseableScope deferred = enter()) {
			runnable.run();
		}
	}
	public static <T> T supply(Supplier<T> supplier) {
		Objects.requireNonNull(supplier);
		try (CloseableScope deferred = enter()) {
			return supplier.get();
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " depth " + depth;
	}
}
