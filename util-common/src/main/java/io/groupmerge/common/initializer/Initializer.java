package io.groupmerge.common.initializer;

@FunctionalInterface
public interface Initializer<T> {
	void initialize(T instance);
}
