package io.groupmerge.common.initializer;

public interface WithInitializer<T extends WithInitializer<T>> {
	@SuppressWarnings("unchecked")
	default T initialize(Initializer<? super T> initializer) {
		initializer.initialize((T) this);
		return (T) this;
	}
}
