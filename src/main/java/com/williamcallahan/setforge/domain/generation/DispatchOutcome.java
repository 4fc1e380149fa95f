package com.williamcallahan.setforge.domain.generation;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of dispatching one generation request to one provider.
 *
 * Provider failures are reported as values so the retry layer can decide what to do; only
 * faults that fit no category escape as exceptions.
 */
public sealed interface DispatchOutcome
        permits DispatchOutcome.Success,
                DispatchOutcome.SoftFailure,
                DispatchOutcome.Retryable,
                DispatchOutcome.Fatal {

    /**
     * Name of the provider that handled the call.
     */
    String providerName();

    /**
     * Short label used for logging and metrics tags.
     */
    String outcomeTag();

    /**
     * Returns true only for a usable generation.
     */
    default boolean succeeded() {
        return false;
    }

    /**
     * Returns the failure category for unsuccessful outcomes.
     */
    Optional<FailureCategory> failureCategory();

    record Success(String content, String providerName, String model, Duration latency) implements DispatchOutcome {
        public Success {
            Objects.requireNonNull(content, "content");
            Objects.requireNonNull(providerName, "providerName");
            Objects.requireNonNull(model, "model");
            Objects.requireNonNull(latency, "latency");
        }

        @Override
        public String outcomeTag() {
            return "success";
        }

        @Override
        public boolean succeeded() {
            return true;
        }

        @Override
        public Optional<FailureCategory> failureCategory() {
            return Optional.empty();
        }
    }

    /**
     * Provider answered without a usable generation; logged, not raised.
     */
    record SoftFailure(String providerName, String detail) implements DispatchOutcome {
        public SoftFailure {
            Objects.requireNonNull(providerName, "providerName");
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public String outcomeTag() {
            return "malformed";
        }

        @Override
        public Optional<FailureCategory> failureCategory() {
            return Optional.of(FailureCategory.MALFORMED_RESPONSE);
        }
    }

    record Retryable(String providerName, FailureCategory category, String detail) implements DispatchOutcome {
        public Retryable {
            Objects.requireNonNull(providerName, "providerName");
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(detail, "detail");
            if (!category.isRetryable()) {
                throw new IllegalArgumentException("Category is not retryable: " + category);
            }
        }

        @Override
        public String outcomeTag() {
            return category == FailureCategory.RATE_LIMITED ? "rate_limited" : "transient";
        }

        @Override
        public Optional<FailureCategory> failureCategory() {
            return Optional.of(category);
        }
    }

    record Fatal(String providerName, String detail, Throwable cause) implements DispatchOutcome {
        public Fatal {
            Objects.requireNonNull(providerName, "providerName");
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public String outcomeTag() {
            return "fatal";
        }

        @Override
        public Optional<FailureCategory> failureCategory() {
            return Optional.of(FailureCategory.FATAL);
        }
    }
}
