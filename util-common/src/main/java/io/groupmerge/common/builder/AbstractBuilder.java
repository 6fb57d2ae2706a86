package io.groupmerge.common.builder;

import io.groupmerge.common.initializer.WithInitializer;

import static io.groupmerge.common.Checks.checkNotNull;
import static io.groupmerge.common.Checks.checkState;

/**
 * Single-use builder: every {@code withXxx} method must call {@link #checkNotBuilt(AbstractBuilder)}
 * and {@link #build()} may be invoked only once.
 */
public abstract class AbstractBuilder<B extends WithInitializer<B>, T> implements Builder<T>, WithInitializer<B> {
	private boolean built;

	public final boolean isBuilt() {
		return built;
	}

	protected static void checkNotBuilt(AbstractBuilder<?, ?> self) {
		checkState(!self.built, "Builder has already been used");
	}

	@Override
	public final T build() {
		checkNotBuilt(this);
		built = true;
		T instance = doBuild();
		checkNotNull(instance);
		return instance;
	}

	protected abstract T doBuild();
}
