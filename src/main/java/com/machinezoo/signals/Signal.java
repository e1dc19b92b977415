// Part of Signals
package com.machinezoo.signals;

import java.util.*;
import com.machinezoo.signals.util.*;
import com.machinezoo.stagean.*;

/*
 * Strong references in the graph only go from dependents to their dependencies (via SignalDependency).
 * Signals point back to their dependents through weak references.
 * Derived signals are therefore collected as soon as application code stops referencing them
 * and they silently drop out of the graph. There is no unsubscribe API, because none is needed.
 * 
 * The set of dependents is WeakHashMap-backed. Signals don't override equals() and hashCode(),
 * so the map effectively uses identity, which is what we want.
 * 
 * All mutable state, including the set of dependents, is guarded by the single graph lock.
 * Value field is additionally volatile, so that toString() can be safely called from a debugger without locking.
 */
/**
 * Value cell participating in the signal graph.
 * Every signal has a current value, a {@link SignalType} that constrains the value, and optional documentation.
 * Signals are either set directly ({@link SignalVariable}) or derived from other signals ({@link SignalFunction}).
 * <p>
 * All signals are thread-safe.
 * 
 * @param <T>
 *            type of the value
 * 
 * @see SignalVariable
 * @see SignalFunction
 * @see Signals#onChange(Signal)
 */
@DraftDocs("link to overview of the propagation model")
public abstract class Signal<T> {
	private final SignalType<T> type;
	/**
	 * Gets runtime type constraint of this signal. Every new value is checked against this type.
	 * 
	 * @return type of this signal
	 */
	public SignalType<T> type() {
		return type;
	}
	private final String documentation;
	/**
	 * Gets documentation that was passed to the constructor.
	 * 
	 * @return documentation of this signal or {@code null} if there is none
	 */
	public String documentation() {
		return documentation;
	}
	Signal(SignalType<T> type, String documentation, String alias) {
		Objects.requireNonNull(type);
		this.type = type;
		this.documentation = documentation;
		OwnerTrace.of(this)
			.alias(alias)
			.tag("doc", documentation);
	}
	volatile T value;
	/**
	 * Gets current value of this signal.
	 * 
	 * @return current value
	 */
	public T get() {
		synchronized (SignalGraph.lock) {
			return value;
		}
	}
	/*
	 * Stores checked value and lets the graph propagate the change.
	 * If the type check fails, nothing is changed. If propagation fails, the new value is kept.
	 */
	void assign(Object next) {
		value = type.check(next);
		SignalGraph.changed(this);
	}
	private final Set<SignalFunction<?>> dependents = Collections.newSetFromMap(new WeakHashMap<>());
	void subscribe(SignalFunction<?> dependent) {
		dependents.add(dependent);
	}
	/*
	 * Returns strong snapshot of live dependents, so that they cannot be collected while the graph walks them.
	 */
	List<SignalFunction<?>> dependents() {
		return new ArrayList<>(dependents);
	}
	/**
	 * Returns diagnostic string representation of this signal including its current value.
	 * No recomputation is performed, so the value shown may be stale.
	 * 
	 * @return string representation of this signal
	 */
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + value;
	}
}
