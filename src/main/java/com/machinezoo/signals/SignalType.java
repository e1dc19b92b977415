// Part of Signals
package com.machinezoo.signals;

import java.util.*;
import java.util.function.*;
import com.google.common.primitives.*;
import com.machinezoo.stagean.*;

/*
 * Generics are erased at runtime and computations are arbitrary lambdas,
 * so the compiler alone cannot guarantee what ends up stored in a signal.
 * Every signal therefore carries a runtime type that is checked on every assignment and every computation.
 * 
 * Types can be narrower than Java classes. A refinement predicate can restrict values to a range,
 * a pattern, or anything else that can be decided by looking at the value alone.
 * 
 * Types reject null unless explicitly made nullable. Null is a frequent source of confusing failures
 * deep in derived computations and it is better to fail at the point of assignment.
 */
/**
 * Runtime constraint on values stored in a {@link Signal}.
 * Values violating the constraint are rejected with {@link TypeMismatchException}.
 * {@code SignalType} is immutable.
 * 
 * @param <T>
 *            Java type of accepted values
 */
@DraftDocs("show refinement examples")
public class SignalType<T> {
	private final Class<T> clazz;
	private final boolean nullable;
	private final Predicate<? super T> refinement;
	private final String description;
	private SignalType(Class<T> clazz, boolean nullable, Predicate<? super T> refinement, String description) {
		this.clazz = clazz;
		this.nullable = nullable;
		this.refinement = refinement;
		this.description = description;
	}
	private static final SignalType<Object> any = new SignalType<>(Object.class, true, null, "any");
	/**
	 * Returns type that accepts any value including {@code null}.
	 * 
	 * @return unconstrained type
	 */
	public static SignalType<Object> any() {
		return any;
	}
	/**
	 * Creates type accepting non-{@code null} instances of the given class.
	 * Primitive classes are treated as their wrappers, so {@code of(int.class)} accepts {@link Integer}.
	 * 
	 * @param <T>
	 *            Java type of accepted values
	 * @param clazz
	 *            class of accepted values
	 * @return new type
	 * @throws NullPointerException
	 *             if {@code clazz} is {@code null}
	 */
	public static <T> SignalType<T> of(Class<T> clazz) {
		Objects.requireNonNull(clazz);
		Class<T> wrapped = Primitives.wrap(clazz);
		return new SignalType<>(wrapped, false, null, wrapped.getSimpleName());
	}
	/**
	 * Returns variant of this type that additionally accepts {@code null}.
	 * Refinements are not applied to {@code null}.
	 * 
	 * @return nullable type
	 */
	public SignalType<T> nullable() {
		if (nullable)
			return this;
		return new SignalType<>(clazz, true, refinement, description + "?");
	}
	/**
	 * Narrows this type with a predicate. The predicate is only ever called with non-{@code null} instances of {@link #type()}.
	 * 
	 * @param predicate
	 *            additional condition accepted values must satisfy
	 * @param description
	 *            human-readable description of the condition used in error messages
	 * @return refined type
	 */
	public SignalType<T> where(Predicate<? super T> predicate, String description) {
		Objects.requireNonNull(predicate);
		Objects.requireNonNull(description);
		Predicate<? super T> previous = refinement;
		Predicate<T> combined = previous == null ? predicate::test : v -> previous.test(v) && predicate.test(v);
		return new SignalType<>(clazz, nullable, combined, this.description + " where " + description);
	}
	public Class<T> type() {
		return clazz;
	}
	public boolean isNullable() {
		return nullable;
	}
	/**
	 * Tests whether the value conforms to this type. Exceptions thrown by refinement predicates propagate.
	 * 
	 * @param value
	 *            value to test
	 * @return {@code true} if the value is accepted
	 */
	public boolean accepts(Object value) {
		if (value == null)
			return nullable;
		if (!clazz.isInstance(value))
			return false;
		return refinement == null || refinement.test(clazz.cast(value));
	}
	/**
	 * Casts the value to this type after checking it.
	 * 
	 * @param value
	 *            value to check
	 * @return the same value
	 * @throws TypeMismatchException
	 *             if the value does not conform to this type
	 */
	public T check(Object value) {
		if (!accepts(value))
			throw new TypeMismatchException(value, this);
		return clazz.cast(value);
	}
	@Override
	public String toString() {
		return description;
	}
}
