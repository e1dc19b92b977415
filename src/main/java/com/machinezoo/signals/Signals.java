// Part of Signals
package com.machinezoo.signals;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/**
 * Combinators over {@link Signal}s.
 */
@StubDocs
public class Signals {
	private Signals() {
	}
	/**
	 * Wraps the source in a change filter. Dependents of the returned signal are recomputed only
	 * when the source changes to a value that {@code equality} considers different from the last one.
	 * 
	 * @param <T>
	 *            type of the value
	 * @param source
	 *            signal to filter
	 * @param equality
	 *            equality test called with the last recorded value and the new value
	 * @param documentation
	 *            optional documentation, may be {@code null}
	 * @return filtered signal
	 */
	public static <T> SignalFilter<T> onChange(Signal<T> source, BiPredicate<? super T, ? super T> equality, String documentation) {
		Objects.requireNonNull(source);
		return new SignalFilter<>(source, equality, documentation);
	}
	public static <T> SignalFilter<T> onChange(Signal<T> source, BiPredicate<? super T, ? super T> equality) {
		return onChange(source, equality, null);
	}
	/*
	 * Structural equality is the default, because it is what most applications expect.
	 */
	public static <T> SignalFilter<T> onChange(Signal<T> source) {
		return onChange(source, Objects::equals);
	}
	public static <T> SignalWatcher<T> watch(Signal<T> signal, Consumer<? super T> callback) {
		return new SignalWatcher<>(signal, callback);
	}
}
