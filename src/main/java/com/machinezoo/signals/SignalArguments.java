// Part of Signals
package com.machinezoo.signals;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Arguments are snapshots taken right before the computation runs.
 * Computations thus never read dependencies directly and they cannot observe a half-updated graph.
 */
/**
 * Current values of {@link SignalFunction}'s dependencies, addressable by position or by binding name.
 */
@StubDocs
public class SignalArguments {
	private final List<SignalDependency<?>> dependencies;
	private final Object[] values;
	SignalArguments(List<SignalDependency<?>> dependencies, Object[] values) {
		this.dependencies = dependencies;
		this.values = values;
	}
	public int size() {
		return values.length;
	}
	public Object get(int index) {
		Objects.checkIndex(index, values.length);
		return values[index];
	}
	public Object get(String name) {
		Objects.requireNonNull(name);
		for (int i = 0; i < values.length; ++i)
			if (dependencies.get(i).name().equals(name))
				return values[i];
		throw new IllegalArgumentException("No dependency is bound to name '" + name + "'.");
	}
	public <V> V get(String name, Class<V> clazz) {
		return clazz.cast(get(name));
	}
	/*
	 * Values were type-checked when they were stored in the source signal, which makes the unchecked cast safe.
	 */
	@SuppressWarnings("unchecked")
	public <V> V get(SignalDependency<V> dependency) {
		Objects.requireNonNull(dependency);
		for (int i = 0; i < values.length; ++i)
			if (dependencies.get(i) == dependency)
				return (V)values[i];
		throw new IllegalArgumentException("Not a dependency of this function: " + dependency.name());
	}
	@Override
	public String toString() {
		StringBuilder text = new StringBuilder("{");
		for (int i = 0; i < values.length; ++i) {
			if (i > 0)
				text.append(", ");
			text.append(dependencies.get(i).name()).append('=').append(values[i]);
		}
		return text.append('}').toString();
	}
}
