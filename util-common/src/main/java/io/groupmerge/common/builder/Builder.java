package io.groupmerge.common.builder;

public interface Builder<T> {
	T build();
}
