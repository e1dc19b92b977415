// Part of Signals
package com.machinezoo.signals;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.google.common.collect.*;
import com.machinezoo.signals.util.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * Propagation engine. It is a static singleton, because signals from different "graphs" can be freely mixed.
 * 
 * Locking: single global monitor guards edge registration, the registry of unsettled functions, and value/flag pairs of all signals.
 * Computations run while the lock is held. This serializes all graph activity,
 * but it guarantees that no thread ever observes value and dirty flag belonging to two different waves.
 * The monitor is reentrant, which is essential, because computations read other signals
 * and change filters write into the graph from within computations.
 * 
 * Propagation has two steps:
 * - invalidation walks everything reachable from the changed signal and marks it dirty (or pending behind change filters)
 * - stabilization recomputes stale functions in construction order, which is a topological order
 * In deferred mode, only invalidation is performed. Stabilization happens on read or in flush at the end of deferred scope.
 * Flush drains every unsettled function in the graph, including those left stale by failed waves elsewhere.
 * 
 * Invalidation walks the whole reachable subgraph even through already dirty functions.
 * Dirtiness from deferred scope on another thread must not prevent this thread's writes from being applied eagerly.
 */
final class SignalGraph {
	private static final Logger logger = LoggerFactory.getLogger(SignalGraph.class);
	private static final Timer flushes = Metrics.timer("signals.flushes");
	static final Object lock = new Object();
	private SignalGraph() {
	}
	private static long sequence;
	/*
	 * Every invalidated function lands here and stays until flush finds it clean.
	 * Weak, so that functions left stale by failures don't leak.
	 */
	private static final Set<SignalFunction<?>> unsettled = Collections.newSetFromMap(new WeakHashMap<>());
	static long register(SignalFunction<?> function) {
		for (SignalDependency<?> dependency : function.dependencies())
			dependency.signal().subscribe(function);
		return ++sequence;
	}
	static void changed(Signal<?> signal) {
		List<SignalFunction<?>> reached = invalidate(signal);
		if (reached.isEmpty())
			return;
		DeferredScope deferred = DeferredScope.current();
		if (deferred != null)
			deferred.defer(reached);
		else
			stabilize(reached, f -> true);
	}
	private static List<SignalFunction<?>> invalidate(Signal<?> source) {
		/*
		 * Breadth-first walk. Every function is visited at most twice, once as tentative and once as definitive.
		 * Definitive invalidation always wins, so it is allowed to revisit functions reached tentatively before.
		 */
		Set<SignalFunction<?>> definitive = Sets.newIdentityHashSet();
		Set<SignalFunction<?>> tentative = Sets.newIdentityHashSet();
		List<SignalFunction<?>> reached = new ArrayList<>();
		Deque<SignalFunction<?>> queue = new ArrayDeque<>();
		Deque<Boolean> modes = new ArrayDeque<>();
		for (SignalFunction<?> dependent : source.dependents()) {
			queue.add(dependent);
			modes.add(false);
		}
		while (!queue.isEmpty()) {
			SignalFunction<?> function = queue.poll();
			boolean weak = modes.poll();
			if (definitive.contains(function) || weak && tentative.contains(function))
				continue;
			if (!definitive.contains(function) && !tentative.contains(function)) {
				reached.add(function);
				unsettled.add(function);
			}
			(weak ? tentative : definitive).add(function);
			function.invalidate(weak);
			for (SignalFunction<?> dependent : function.dependents()) {
				queue.add(dependent);
				modes.add(weak);
			}
			if (function.forwarding != null) {
				for (SignalFunction<?> dependent : function.forwarding.dependents()) {
					queue.add(dependent);
					modes.add(true);
				}
			}
		}
		return reached;
	}
	/*
	 * Recomputes stale functions in construction order. Every function is computed at most once,
	 * because by the time we get to it, all its dependencies have been already settled.
	 * Functions that are in the middle of computation are skipped. They read their inputs before
	 * computing and they will notice the invalidation themselves.
	 * 
	 * Failure doesn't stop stabilization. Functions downstream of the failed one are skipped and keep their previous values.
	 * Construction order guarantees that failed dependencies are known before their dependents are visited.
	 * The first failure the caller is responsible for is rethrown once all other functions are settled.
	 * Repeated failures of functions the caller didn't touch were already reported to whoever broke them, so they are only logged.
	 */
	private static int stabilize(Collection<SignalFunction<?>> functions, Predicate<SignalFunction<?>> reported) {
		List<SignalFunction<?>> ordered = new ArrayList<>(functions);
		ordered.sort(Comparator.comparingLong(f -> f.sequence));
		Set<Signal<?>> failed = Sets.newIdentityHashSet();
		RuntimeException failure = null;
		int settled = 0;
		for (SignalFunction<?> function : ordered) {
			if (!function.stale() || function.computing)
				continue;
			if (downstream(function, failed)) {
				failed.add(function);
				continue;
			}
			try {
				function.settle();
				++settled;
			} catch (RuntimeException ex) {
				failed.add(function);
				if (function.forwarding != null)
					failed.add(function.forwarding);
				if (!reported.test(function))
					logger.warn("Stale {} failed again during flush.", function, ex);
				else if (failure == null)
					failure = ex;
				else if (failure != ex)
					failure.addSuppressed(ex);
			}
			if (!function.stale())
				unsettled.remove(function);
		}
		if (failure != null)
			throw failure;
		return settled;
	}
	private static boolean downstream(SignalFunction<?> function, Set<Signal<?>> failed) {
		for (SignalDependency<?> dependency : function.dependencies())
			if (failed.contains(dependency.signal()))
				return true;
		return false;
	}
	/*
	 * Flush drains the whole registry of unsettled functions, so no stale function survives the outermost scope
	 * unless its computation keeps failing. Only failures of functions invalidated within the scope propagate.
	 */
	static void flush(DeferredScope scope, Set<SignalFunction<?>> invalidated) {
		synchronized (lock) {
			unsettled.removeIf(f -> !f.stale());
			List<SignalFunction<?>> pending = new ArrayList<>(unsettled);
			if (pending.isEmpty())
				return;
			Span span = GlobalTracer.get().buildSpan("signals.flush")
				.withTag("component", "signals")
				.withTag("stale", pending.size())
				.start();
			OwnerTrace.of(scope).fill(span);
			Timer.Sample sample = Timer.start();
			try (Scope trace = GlobalTracer.get().activateSpan(span)) {
				int settled = stabilize(pending, invalidated::contains);
				logger.debug("Flushed {} of {} stale signal functions.", settled, pending.size());
			} finally {
				sample.stop(flushes);
				span.finish();
			}
		}
	}
}
