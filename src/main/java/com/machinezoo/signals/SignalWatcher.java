// Part of Signals
package com.machinezoo.signals;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.signals.util.*;
import com.machinezoo.stagean.*;

/*
 * Watcher is the bridge from the signal graph to event-driven code.
 * It is a function of the watched signal whose computation calls the callback instead of computing anything.
 * 
 * Callbacks are application code with side effects. A failing callback must not abort the propagation wave,
 * because that would leave unrelated signals stale, so callback exceptions are logged instead of propagated.
 * Failures of the watched signal itself propagate as usual, because they happen before the callback is called.
 * 
 * Like every other function, the watcher is referenced from the graph only weakly.
 * Callers must hold a reference to it for as long as they want to receive callbacks.
 */
/**
 * Callback invoked with the new value whenever the watched {@link Signal} propagates a change.
 * Inside {@link DeferredScope}, callbacks are invoked once at the end of the outermost scope.
 * <p>
 * Callbacks run synchronously on the thread that triggered propagation and they run while the global graph lock is held.
 * Every read and write of any signal on any thread waits for the callback to return.
 * Callbacks should therefore be short and they must not block or perform slow I/O.
 * Callbacks that need to do expensive work should hand it off to an executor.
 * Callbacks may read signals, but a callback that waits for another thread that reads signals deadlocks.
 *
 * @param <T>
 *            type of the watched value
 */
@StubDocs
public class SignalWatcher<T> implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(SignalWatcher.class);
	private final Signal<T> signal;
	public Signal<T> signal() {
		return signal;
	}
	private volatile Consumer<? super T> callback;
	private volatile boolean started;
	private final SignalFunction<Object> function;
	public SignalWatcher(Signal<T> signal, Consumer<? super T> callback) {
		Objects.requireNonNull(signal);
		Objects.requireNonNull(callback);
		this.signal = signal;
		this.callback = callback;
		OwnerTrace.of(this).alias("watcher");
		SignalDependency<T> input = SignalDependency.of("signal", signal);
		function = new SignalFunction<>(List.of(input), args -> deliver(args.get(input)), SignalType.any());
		OwnerTrace.of(function).parent(this);
		started = true;
	}
	/*
	 * The initial evaluation during construction only subscribes the function. It doesn't notify anyone.
	 */
	private Object deliver(T value) {
		Consumer<? super T> callback = this.callback;
		if (started && callback != null)
			ExceptionLogging.log(logger).run(() -> callback.accept(value));
		return value;
	}
	public boolean closed() {
		return callback == null;
	}
	/**
	 * Stops callbacks. The watcher stays in the graph until it is garbage-collected, but it no longer calls the callback.
	 */
	@Override
	public void close() {
		callback = null;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
