// Part of Signals
package com.machinezoo.signals;

/**
 * Thrown when a value assigned to or computed for a {@link Signal} does not conform to its {@link SignalType}.
 * The signal keeps its previous value when this exception is thrown.
 * 
 * @see SignalType#check(Object)
 */
public class TypeMismatchException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;
	/*
	 * Both fields are informational. They are transient, because neither values nor types are generally serializable.
	 */
	private final transient Object value;
	/**
	 * Gets the rejected value.
	 * 
	 * @return rejected value, possibly {@code null}
	 */
	public Object value() {
		return value;
	}
	private final transient SignalType<?> expected;
	/**
	 * Gets the type that rejected the value.
	 * 
	 * @return expected type
	 */
	public SignalType<?> expected() {
		return expected;
	}
	/**
	 * Constructs new {@code TypeMismatchException} describing the rejected value and the expected type.
	 * 
	 * @param value
	 *            rejected value
	 * @param expected
	 *            type that rejected the value
	 */
	public TypeMismatchException(Object value, SignalType<?> expected) {
		super("Value " + describe(value) + " does not conform to type " + expected + ".");
		this.value = value;
		this.expected = expected;
	}
	private static String describe(Object value) {
		if (value == null)
			return "null";
		return value + " (" + value.getClass().getSimpleName() + ")";
	}
}
