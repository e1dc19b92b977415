// Part of Signals
package com.machinezoo.signals;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.signals.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/*
 * Dependencies are declared explicitly and they never change.
 * We don't trace reads during computation, so there is no "current computation" context to maintain
 * and the graph is fully determined at construction time.
 * 
 * Function state is a value plus two staleness flags:
 * - dirty: some dependency has changed and the value must be recomputed before it can be trusted
 * - pending: some upstream change filter may or may not change, so dependencies must be settled first
 *   and the function is recomputed only if that turns some of them dirty
 * Pending state exists only to let change filters stop propagation. Without filters, functions are either clean or dirty.
 * 
 * Functions are numbered in order of construction. Since dependencies must exist before the function is constructed,
 * construction order is a topological order of the graph, which is how the propagation engine orders recomputation.
 */
/**
 * {@link Signal} derived from a fixed list of other signals by a {@link SignalComputation}.
 * The function is evaluated once during construction and then again whenever its dependencies change,
 * either immediately or, inside {@link DeferredScope}, on the next read or at the end of the outermost scope.
 * <p>
 * Functions hold strong references to their dependencies, but dependencies refer to functions only weakly.
 * Function that is no longer referenced by application code is garbage-collected and stops being recomputed.
 * 
 * @param <T>
 *            type of the computed value
 */
@DraftDocs("explain propagation modes with examples")
public class SignalFunction<T> extends Signal<T> {
	private static final Logger logger = LoggerFactory.getLogger(SignalFunction.class);
	private static final Counter computations = Metrics.counter("signals.computations");
	private static final Counter failures = Metrics.counter("signals.failures");
	private final List<SignalDependency<?>> dependencies;
	/**
	 * Gets dependencies of this function in declaration order.
	 * 
	 * @return immutable list of dependencies
	 */
	public List<SignalDependency<?>> dependencies() {
		return dependencies;
	}
	private final SignalComputation<T> computation;
	final long sequence;
	boolean dirty;
	boolean pending;
	/*
	 * Incremented on every invalidation, so that refresh can detect invalidations that arrived during computation.
	 */
	private long stamp;
	boolean computing;
	/*
	 * Change filter's updater forwards changes to dependents of the filter.
	 * Dependents of the filter become only pending, because the filter might decide to suppress the change.
	 */
	Signal<?> forwarding;
	/**
	 * Creates new function, evaluates it, and registers it in the graph.
	 * The function is registered only after successful evaluation, so failed construction leaves no trace in the graph.
	 * 
	 * @param dependencies
	 *            ordered dependencies with unique binding names
	 * @param computation
	 *            compute step
	 * @param type
	 *            type constraint for computed values
	 * @param documentation
	 *            optional documentation, may be {@code null}
	 * @throws IllegalArgumentException
	 *             if binding names are not unique
	 * @throws TypeMismatchException
	 *             if the computed value does not conform to {@code type}
	 * @throws SignalComputeException
	 *             if the computation throws
	 */
	public SignalFunction(List<? extends SignalDependency<?>> dependencies, SignalComputation<T> computation, SignalType<T> type, String documentation) {
		super(type, documentation, "fn");
		Objects.requireNonNull(dependencies);
		Objects.requireNonNull(computation);
		Set<String> names = new HashSet<>();
		for (SignalDependency<?> dependency : dependencies) {
			Objects.requireNonNull(dependency);
			if (!names.add(dependency.name()))
				throw new IllegalArgumentException("Duplicate dependency name: " + dependency.name());
		}
		this.dependencies = List.copyOf(dependencies);
		this.computation = computation;
		synchronized (SignalGraph.lock) {
			/*
			 * Eager initialization. There is no such thing as an unevaluated function.
			 * Registration is the last step, so that the function isn't reachable from dependencies if evaluation fails.
			 */
			value = evaluate(read());
			sequence = SignalGraph.register(this);
		}
	}
	public SignalFunction(List<? extends SignalDependency<?>> dependencies, SignalComputation<T> computation, SignalType<T> type) {
		this(dependencies, computation, type, null);
	}
	/**
	 * Creates function of a single signal. The dependency is bound to name {@code "a"}.
	 * 
	 * @param <A>
	 *            type of the source signal
	 * @param <T>
	 *            type of the computed value
	 * @param a
	 *            source signal
	 * @param function
	 *            compute step
	 * @param type
	 *            type constraint for computed values
	 * @return new function
	 */
	public static <A, T> SignalFunction<T> of(Signal<A> a, Function<? super A, ? extends T> function, SignalType<T> type) {
		Objects.requireNonNull(function);
		SignalDependency<A> da = SignalDependency.of("a", a);
		return new SignalFunction<>(List.of(da), args -> function.apply(args.get(da)), type);
	}
	/**
	 * Creates function of two signals. Dependencies are bound to names {@code "a"} and {@code "b"}.
	 * 
	 * @param <A>
	 *            type of the first source signal
	 * @param <B>
	 *            type of the second source signal
	 * @param <T>
	 *            type of the computed value
	 * @param a
	 *            first source signal
	 * @param b
	 *            second source signal
	 * @param function
	 *            compute step
	 * @param type
	 *            type constraint for computed values
	 * @return new function
	 */
	public static <A, B, T> SignalFunction<T> of(Signal<A> a, Signal<B> b, BiFunction<? super A, ? super B, ? extends T> function, SignalType<T> type) {
		Objects.requireNonNull(function);
		SignalDependency<A> da = SignalDependency.of("a", a);
		SignalDependency<B> db = SignalDependency.of("b", b);
		return new SignalFunction<>(List.of(da, db), args -> function.apply(args.get(da), args.get(db)), type);
	}
	/**
	 * Returns {@code true} if the stored value is stale and will be recomputed on next read.
	 * Values that merely wait for an upstream change filter to settle are reported as dirty too.
	 * 
	 * @return {@code true} if the function needs recomputation
	 */
	public boolean dirty() {
		synchronized (SignalGraph.lock) {
			return stale();
		}
	}
	boolean stale() {
		return dirty || pending;
	}
	/**
	 * Gets current value of this function, recomputing it first if it is dirty.
	 * 
	 * @return current value
	 * @throws SignalComputeException
	 *             if recomputation fails
	 * @throws TypeMismatchException
	 *             if the recomputed value does not conform to {@link #type()}
	 * @throws IllegalStateException
	 *             if the function is read from within its own computation
	 */
	@Override
	public T get() {
		synchronized (SignalGraph.lock) {
			if (stale())
				settle();
			return value;
		}
	}
	void invalidate(boolean tentative) {
		if (tentative)
			pending = true;
		else
			dirty = true;
		++stamp;
	}
	/*
	 * Brings the function up to date. Pending functions first settle their dependencies,
	 * which might make them dirty if some upstream change filter lets the change through.
	 */
	void settle() {
		if (computing)
			throw new IllegalStateException("Signal depends on itself: " + this);
		if (!dirty) {
			computing = true;
			try {
				read();
			} finally {
				computing = false;
			}
			if (!dirty) {
				pending = false;
				return;
			}
		}
		refresh();
	}
	private void refresh() {
		computing = true;
		T next;
		long start;
		try {
			/*
			 * Reading dependencies may recompute them and that may invalidate this function again.
			 * We capture the stamp only after all inputs are settled. Any later invalidation keeps the function dirty.
			 */
			Object[] values = read();
			start = stamp;
			next = evaluate(values);
		} finally {
			computing = false;
		}
		value = next;
		if (start == stamp) {
			dirty = false;
			pending = false;
		}
		logger.trace("Recomputed {}.", this);
	}
	private Object[] read() {
		Object[] values = new Object[dependencies.size()];
		for (int i = 0; i < values.length; ++i)
			values[i] = dependencies.get(i).signal().get();
		return values;
	}
	/*
	 * Failures that already describe a signal are passed through unwrapped, so that callers see the original failure point.
	 */
	private T evaluate(Object[] values) {
		computations.increment();
		Object computed;
		try {
			computed = computation.compute(new SignalArguments(dependencies, values));
		} catch (SignalComputeException | TypeMismatchException ex) {
			failures.increment();
			throw ex;
		} catch (RuntimeException ex) {
			failures.increment();
			throw new SignalComputeException("Computation of " + OwnerTrace.of(this) + " failed.", ex);
		}
		try {
			return type().check(computed);
		} catch (TypeMismatchException ex) {
			failures.increment();
			throw ex;
		}
	}
}
