// Part of Signals
package com.machinezoo.signals;

/*
 * Computations are plain lambdas and they can throw anything unchecked.
 * We wrap such exceptions once, at the signal where they were thrown, so that the message names the failing signal.
 * Exceptions already describing a signal failure pass through dependent signals unwrapped.
 * Otherwise a failure deep in the graph would arrive wrapped in as many layers as there are signals on the way.
 */
/**
 * Thrown when computation of a {@link SignalFunction} fails.
 * The original exception is available via {@link #getCause()}.
 * The failing function keeps its previous value and remains dirty.
 */
public class SignalComputeException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	/**
	 * Constructs new {@code SignalComputeException} with the specified message and cause.
	 * 
	 * @param message
	 *            informative message describing the failing signal
	 * @param cause
	 *            exception thrown by the computation
	 */
	public SignalComputeException(String message, Throwable cause) {
		super(message, cause);
	}
}
