package org.springaicommunity.scvs;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a repository operation: either a {@link Success} carrying a payload or a
 * {@link Failure} carrying an {@link ErrorKind} and a human readable message.
 *
 * <p>
 * Repository operations never throw across their boundary; every expected failure is
 * returned as a value so callers can branch on it.
 *
 * @param <T> the payload type
 */
public sealed interface OperationResult<T> permits OperationResult.Success, OperationResult.Failure {

	/**
	 * Create a successful result.
	 * @param value the payload
	 * @param <T> the payload type
	 * @return a success
	 */
	static <T> OperationResult<T> success(T value) {
		return new Success<>(value);
	}

	/**
	 * Create a failed result.
	 * @param kind the failure kind
	 * @param message description of the failure
	 * @param <T> the payload type the caller expected
	 * @return a failure
	 */
	static <T> OperationResult<T> failure(ErrorKind kind, String message) {
		return new Failure<>(kind, message);
	}

	default boolean isSuccess() {
		return this instanceof Success;
	}

	/**
	 * Returns the failure kind, empty for a success.
	 * @return the failure kind
	 */
	default Optional<ErrorKind> errorKind() {
		if (this instanceof Failure<T> failure) {
			return Optional.of(failure.kind());
		}
		return Optional.empty();
	}

	/**
	 * Transform the payload of a success; failures pass through unchanged.
	 */
	default <U> OperationResult<U> map(Function<? super T, ? extends U> mapper) {
		if (this instanceof Success<T> success) {
			return new Success<>(mapper.apply(success.value()));
		}
		return ((Failure<T>) this).retype();
	}

	/**
	 * Chain another operation on a success; failures short-circuit.
	 */
	default <U> OperationResult<U> flatMap(Function<? super T, OperationResult<U>> next) {
		if (this instanceof Success<T> success) {
			return next.apply(success.value());
		}
		return ((Failure<T>) this).retype();
	}

	/**
	 * Returns the payload of a success.
	 * @return the payload
	 * @throws IllegalStateException if this result is a failure
	 */
	default T orElseThrow() {
		if (this instanceof Success<T> success) {
			return success.value();
		}
		Failure<T> failure = (Failure<T>) this;
		throw new IllegalStateException(failure.kind().label() + ": " + failure.message());
	}

	/**
	 * Successful outcome.
	 *
	 * @param value the payload
	 */
	record Success<T>(T value) implements OperationResult<T> {
	}

	/**
	 * Failed (or informational) outcome.
	 *
	 * @param kind the failure kind
	 * @param message description of what went wrong
	 */
	record Failure<T>(ErrorKind kind, String message) implements OperationResult<T> {

		/**
		 * Re-type this failure for a different expected payload.
		 */
		public <U> Failure<U> retype() {
			return new Failure<>(kind, message);
		}

		@Override
		public String toString() {
			return kind.label() + ": " + message;
		}

	}

}
