package org.stance.github;

import org.jspecify.annotations.Nullable;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * A lazily fetched value that is kept until {@link #clear()} is called.
 *
 * <p>
 * Only successful loads are kept: when the loader yields nothing, the state stays
 * {@link State#UNFETCHED} and the next {@link #get(Supplier)} calls the loader again.
 *
 * @param <T> the cached value type
 */
public final class Memoized<T> {

	/**
	 * Lifecycle of a memoized value.
	 */
	public enum State {

		UNFETCHED, FETCHED

	}

	private State state = State.UNFETCHED;

	@Nullable
	private T value;

	/**
	 * Returns the cached value, loading it first when nothing is cached.
	 * @param loader produces the value, or empty when the fetch failed
	 * @return the cached or freshly loaded value, or empty when loading failed
	 */
	public Optional<T> get(Supplier<Optional<T>> loader) {
		if (state == State.FETCHED) {
			return Optional.ofNullable(value);
		}
		Optional<T> loaded = loader.get();
		loaded.ifPresent(v -> {
			this.value = v;
			this.state = State.FETCHED;
		});
		return loaded;
	}

	/**
	 * Forgets the cached value. Safe to call in any state.
	 */
	public void clear() {
		this.value = null;
		this.state = State.UNFETCHED;
	}

	public State state() {
		return state;
	}

	public boolean isFetched() {
		return state == State.FETCHED;
	}

}
