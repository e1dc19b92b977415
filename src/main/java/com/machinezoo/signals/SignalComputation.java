// Part of Signals
package com.machinezoo.signals;

/**
 * Compute step of {@link SignalFunction}.
 * It should be a pure function of its arguments.
 * 
 * @param <T>
 *            type of the computed value
 */
@FunctionalInterface
public interface SignalComputation<T> {
	T compute(SignalArguments arguments);
}
