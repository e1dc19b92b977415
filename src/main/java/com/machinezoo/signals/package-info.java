// Part of Signals
/*
 * Conventions followed by all signal classes:
 * - Null check is performed on method parameters. Null values are allowed only where SignalType allows them.
 * - Exceptions thrown by computations propagate to whoever triggered the computation. Only watcher callbacks are logged.
 * - Metrics are exposed by the propagation engine only.
 * - Opentracing spans are created only for flushes at the end of deferred scopes.
 * - Every object has OwnerTrace alias and internal objects have their OwnerTrace parent set.
 * - Method toString() uses OwnerTrace and never triggers recomputation.
 */
/**
 * Signal variables, signal functions with explicitly declared dependencies, deferred update scopes, and change filters.
 */
package com.machinezoo.signals;
