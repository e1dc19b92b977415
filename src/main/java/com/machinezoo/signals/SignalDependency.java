// Part of Signals
package com.machinezoo.signals;

import java.util.*;

/**
 * Named input of {@link SignalFunction}.
 * The name identifies the input in {@link SignalArguments}.
 * 
 * @param <T>
 *            type of the source signal's value
 */
public class SignalDependency<T> {
	private final String name;
	public String name() {
		return name;
	}
	private final Signal<T> signal;
	public Signal<T> signal() {
		return signal;
	}
	private SignalDependency(String name, Signal<T> signal) {
		this.name = name;
		this.signal = signal;
	}
	/**
	 * Binds source signal to a name.
	 * 
	 * @param <T>
	 *            type of the source signal's value
	 * @param name
	 *            binding name, unique within one {@link SignalFunction}
	 * @param signal
	 *            source signal
	 * @return new dependency
	 * @throws NullPointerException
	 *             if {@code name} or {@code signal} is {@code null}
	 */
	public static <T> SignalDependency<T> of(String name, Signal<T> signal) {
		Objects.requireNonNull(name);
		Objects.requireNonNull(signal);
		return new SignalDependency<>(name, signal);
	}
	@Override
	public String toString() {
		return name + " <- " + signal;
	}
}
