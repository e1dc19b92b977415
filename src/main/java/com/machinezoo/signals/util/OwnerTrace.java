// Part of Signals
package com.machinezoo.signals.util;

import static java.util.stream.Collectors.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Signals form long chains of derived values and an exception thrown deep in the chain
 * is much easier to read when every signal can describe itself and its owner.
 * Signals cannot carry this information as a member, because some of it is attached by owners
 * (the change filter names its internal updater, the watcher names its function).
 * We therefore associate trace data with arbitrary objects via a map with weak keys.
 * 
 * Guava's weak-keyed cache compares keys by identity, which is what we want here,
 * because signals may one day override equals() and we don't want traces to merge.
 * The cache values must not reference the keys, otherwise entries would never be collected.
 * That's why the public OwnerTrace is only a short-lived builder over private data.
 */
/**
 * Alias, tags, and owner of an object for diagnostic output and tracing spans.
 * 
 * @param <T>
 *            type of the traced object
 */
@NoTests
@StubDocs
@DraftApi("should be shared with other libraries")
public class OwnerTrace<T> {
	private static final LoadingCache<Object, Data> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(Data::new));
	public static <T> OwnerTrace<T> of(T target) {
		Objects.requireNonNull(target);
		return new OwnerTrace<>(target, all.getUnchecked(target));
	}
	private final T target;
	public T target() {
		return target;
	}
	private final Data data;
	private OwnerTrace(T target, Data data) {
		this.target = target;
		this.data = data;
	}
	private static class Data {
		/*
		 * Volatile fields let toString() run without locking, which matters when it is called from a debugger.
		 */
		volatile String alias;
		volatile Map<String, Object> tags = Collections.emptyMap();
		volatile Data parent;
		Data(Object target) {
			alias = target.getClass().getSimpleName();
		}
	}
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	public String alias() {
		return data.alias;
	}
	/*
	 * Tags are rare and small, so we rebuild the whole map on every change and keep reads lock-free.
	 * Null values are ignored to spare callers a null check for optional properties like documentation.
	 */
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		if (value != null) {
			synchronized (data) {
				Map<String, Object> tags = new LinkedHashMap<>(data.tags);
				tags.put(key, value);
				data.tags = Collections.unmodifiableMap(tags);
			}
		}
		return this;
	}
	private static final AtomicLong counter = new AtomicLong();
	public OwnerTrace<T> generateId() {
		return tag("id", counter.incrementAndGet());
	}
	public OwnerTrace<T> parent(Object parent) {
		if (parent == null)
			data.parent = null;
		else if (parent instanceof OwnerTrace)
			data.parent = ((OwnerTrace<?>)parent).data;
		else
			data.parent = of(parent).data;
		return this;
	}
	/*
	 * Ancestors are stored child-first, but they are displayed owner-first.
	 * Repeated aliases in the chain are numbered, so that their tags don't overwrite each other.
	 */
	private List<Map.Entry<String, Data>> chain() {
		List<Data> ancestors = new ArrayList<>();
		for (Data ancestor = data; ancestor != null; ancestor = ancestor.parent)
			ancestors.add(ancestor);
		Collections.reverse(ancestors);
		Object2IntMap<String> seen = new Object2IntOpenHashMap<>();
		List<Map.Entry<String, Data>> chain = new ArrayList<>();
		for (Data ancestor : ancestors) {
			String alias = ancestor.alias;
			int count = seen.getInt(alias) + 1;
			seen.put(alias, count);
			chain.add(new AbstractMap.SimpleImmutableEntry<>(count == 1 ? alias : alias + count, ancestor));
		}
		return chain;
	}
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		List<Map.Entry<String, Data>> chain = chain();
		span.setTag("owner", chain.stream().map(Map.Entry::getKey).collect(joining(".")));
		for (Map.Entry<String, Data> link : chain) {
			for (Map.Entry<String, Object> tag : link.getValue().tags.entrySet()) {
				String key = link.getKey() + "." + tag.getKey();
				Object value = tag.getValue();
				if (value instanceof Number)
					span.setTag(key, (Number)value);
				else if (value instanceof Boolean)
					span.setTag(key, (Boolean)value);
				else
					span.setTag(key, value.toString());
			}
		}
		return span;
	}
	@Override
	public String toString() {
		List<Map.Entry<String, Data>> chain = chain();
		Map<String, Object> sorted = new TreeMap<>();
		for (Map.Entry<String, Data> link : chain)
			for (Map.Entry<String, Object> tag : link.getValue().tags.entrySet())
				sorted.put(link.getKey() + "." + tag.getKey(), tag.getValue());
		return chain.stream().map(Map.Entry::getKey).collect(joining(".")) + (sorted.isEmpty() ? "" : sorted.toString());
	}
}
