// Part of Signals
package com.machinezoo.signals;

import com.machinezoo.stagean.*;

/*
 * Variables perform no equality check on writes. Every write propagates to dependents.
 * Applications wanting deduplication can wrap the variable with Signals.onChange(),
 * which keeps the core propagation rules simple and predictable.
 */
/**
 * {@link Signal} whose value is set directly by application code.
 * Every {@link #set(Object)} propagates to dependent {@link SignalFunction}s,
 * either immediately or, inside {@link DeferredScope}, by marking them dirty.
 * 
 * @param <T>
 *            type of the stored value
 */
@DraftDocs("examples")
public class SignalVariable<T> extends Signal<T> {
	/**
	 * Creates new variable holding the initial value.
	 * 
	 * @param initial
	 *            initial value
	 * @param type
	 *            type constraint for all values of this variable
	 * @param documentation
	 *            optional documentation, may be {@code null}
	 * @throws TypeMismatchException
	 *             if {@code initial} does not conform to {@code type}
	 */
	public SignalVariable(T initial, SignalType<T> type, String documentation) {
		super(type, documentation, "var");
		value = type.check(initial);
	}
	public SignalVariable(T initial, SignalType<T> type) {
		this(initial, type, null);
	}
	/**
	 * Sets new value and propagates the change to dependent signals.
	 * Outside of {@link DeferredScope}, all dependent {@link SignalFunction}s are recomputed before this method returns.
	 * Inside {@link DeferredScope}, they are only marked dirty.
	 * 
	 * @param value
	 *            new value
	 * @return the written value
	 * @throws TypeMismatchException
	 *             if {@code value} does not conform to {@link #type()}, in which case the variable is unchanged
	 * @throws SignalComputeException
	 *             if recomputation of some dependent signal fails, in which case the variable keeps the new value
	 */
	public T set(T value) {
		synchronized (SignalGraph.lock) {
			assign(value);
			return this.value;
		}
	}
}
