package com.streamfirst.mindmap.retention.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Either a successful value or a typed retention failure.
 * Used at the pipeline boundary so callers never have to catch generic exceptions.
 *
 * @param <T> the type of data returned on success
 */
@Value
@EqualsAndHashCode
public class Result<T> {

    boolean success;
    T data;
    String errorMessage;
    Optional<RetentionErrorCode> errorCode;

    private Result(boolean success, T data, String errorMessage, Optional<RetentionErrorCode> errorCode) {
        this.success = success;
        this.data = data;
        this.errorMessage = errorMessage;
        this.errorCode = errorCode;
    }

    /**
     * Creates a successful result with data.
     */
    public static <T> Result<T> success(@NonNull T data) {
        return new Result<>(true, data, null, Optional.empty());
    }

    /**
     * Creates a failure result with error message and no code.
     */
    public static <T> Result<T> failure(String errorMessage) {
        return new Result<>(false, null, errorMessage, Optional.empty());
    }

    /**
     * Creates a failure result carrying a retention error code.
     */
    public static <T> Result<T> failure(String errorMessage, @NonNull RetentionErrorCode errorCode) {
        return new Result<>(false, null, errorMessage, Optional.of(errorCode));
    }

    /**
     * Returns the data if successful, or throws if failed.
     */
    public T orElseThrow() {
        if (success) {
            return data;
        }
        throw new IllegalStateException(errorMessage + errorCode.map(code -> " (code: " + code + ")").orElse(""));
    }

    /**
     * Returns the data if successful, or the provided default value if failed.
     */
    public T orElse(T defaultValue) {
        return success ? data : defaultValue;
    }

    public T orElseGet(Supplier<T> supplier) {
        return success ? data : supplier.get();
    }

    /**
     * Maps the data to another type if successful, preserves failure if failed.
     */
    public <U> Result<U> map(Function<T, U> mapper) {
        if (success) {
            return Result.success(mapper.apply(data));
        }
        return new Result<>(false, null, errorMessage, errorCode);
    }

    /**
     * Flat maps the data to another Result if successful, preserves failure if failed.
     */
    public <U> Result<U> flatMap(Function<T, Result<U>> mapper) {
        if (success) {
            return mapper.apply(data);
        }
        return new Result<>(false, null, errorMessage, errorCode);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Gets the data if successful, empty otherwise.
     */
    public Optional<T> getData() {
        return success ? Optional.ofNullable(data) : Optional.empty();
    }

    /**
     * Gets the error message if failed, empty otherwise.
     */
    public Optional<String> getErrorMessage() {
        return success ? Optional.empty() : Optional.ofNullable(errorMessage);
    }

    /**
     * True when this is a failure tagged with the given code.
     */
    public boolean hasErrorCode(RetentionErrorCode code) {
        return !success && errorCode.filter(code::equals).isPresent();
    }

    @Override
    public String toString() {
        if (success) {
            return "Result.success(" + data + ")";
        } else {
            return "Result.failure(" + errorMessage +
                   errorCode.map(code -> ", code=" + code).orElse("") + ")";
        }
    }
}
