// Part of Signals
package com.machinezoo.signals;

import java.util.*;
import java.util.function.*;
import com.machinezoo.signals.util.*;
import com.machinezoo.stagean.*;

/*
 * Change filter is made of two parts:
 * - the filter itself, which is a cell holding the last distinct value, written only by the updater
 * - the updater, which is a function subscribed to the source that writes into the filter when equality test fails
 * 
 * Source refers to the updater only weakly. The filter must therefore hold strong reference to the updater,
 * otherwise the updater would be collected and the filter would silently stop following the source.
 * Dependents of the filter hold the filter and thus transitively the updater.
 * 
 * The updater forwards invalidations to dependents of the filter as tentative (pending) invalidations.
 * Dependents are recomputed only if the updater actually writes into the filter.
 * This keeps deferred reads consistent while equal writes to the source still stop at the filter.
 */
/**
 * {@link Signal} that follows its source, but only reports changes that the equality test considers real changes.
 * Instances are created by {@link Signals#onChange(Signal, BiPredicate, String)}.
 * 
 * @param <T>
 *            type of the value
 */
@StubDocs
public class SignalFilter<T> extends Signal<T> {
	private final Signal<T> source;
	public Signal<T> source() {
		return source;
	}
	private final BiPredicate<? super T, ? super T> equality;
	private final SignalFunction<Boolean> updater;
	SignalFilter(Signal<T> source, BiPredicate<? super T, ? super T> equality, String documentation) {
		super(source.type(), documentation, "filter");
		Objects.requireNonNull(equality);
		this.source = source;
		this.equality = equality;
		synchronized (SignalGraph.lock) {
			value = source.get();
			SignalDependency<T> input = SignalDependency.of("source", source);
			updater = new SignalFunction<>(List.of(input), args -> update(args.get(input)), SignalType.of(Boolean.class));
			updater.forwarding = this;
			OwnerTrace.of(updater)
				.alias("updater")
				.parent(this);
		}
	}
	private boolean update(T next) {
		if (equality.test(value, next))
			return false;
		assign(next);
		return true;
	}
	/**
	 * Gets the last value of the source that differed from its predecessor.
	 * Pending source changes are applied first, so the value is current even inside {@link DeferredScope}.
	 * 
	 * @return current filtered value
	 */
	@Override
	public T get() {
		synchronized (SignalGraph.lock) {
			/*
			 * Dependents read the filter from within the updater's own computation when the updater writes a change eagerly.
			 * The filter already holds the new value at that point.
			 */
			if (!updater.computing)
				updater.get();
			return value;
		}
	}
}
