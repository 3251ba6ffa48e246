package com.example.prr.service;

import com.example.prr.config.PrrProperties;
import com.example.prr.inference.InferenceGateway;
import com.example.prr.inference.InferenceRequest;
import com.example.prr.inference.InferenceResult;
import com.example.prr.model.ErrorCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Applies the per-stage retry policy around the inference gateway.
 * <p>
 * A stage gets at most {@value #MAX_ATTEMPTS} gateway calls:
 * <ul>
 *   <li>timeout / unavailable: the same request is retried once after a backoff</li>
 *   <li>malformed output or schema violation: one corrective re-prompt carrying the errors</li>
 * </ul>
 * If the last attempt still fails, the failure is returned (never thrown) so the stage can fall back.
 */
@Service
public class ResilientInferenceCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientInferenceCaller.class);
    static final int MAX_ATTEMPTS = 2;

    private final InferenceGateway gateway;
    private final Duration retryBackoff;

    public ResilientInferenceCaller(InferenceGateway gateway, PrrProperties properties) {
        this.gateway = gateway;
        this.retryBackoff = properties.inference().retryBackoff();
    }

    /**
     * Calls the gateway and validates the answer, retrying according to the policy.
     *
     * @param request    initial request
     * @param outputType target type for parsing
     * @param validator  schema check applied to every parsed answer
     * @param <T>        target type
     * @return validated payload or the last failure
     */
    public <T> InferenceOutcome<T> call(InferenceRequest request, Class<T> outputType,
                                        Function<T, ValidationResult<T>> validator) {
        String label = request.stage() + "/" + request.schema();
        InferenceRequest current = request;
        ErrorCategory lastCategory = null;
        List<String> lastErrors = List.of();

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            InferenceResult<T> result = gateway.infer(current, outputType);

            if (!result.isSuccess()) {
                lastErrors = List.of(result.failure() + ": " + result.detail());
                if (result.failure().isTransient()) {
                    lastCategory = ErrorCategory.INFERENCE_TRANSIENT;
                    if (attempt < MAX_ATTEMPTS && !backoff(label, attempt, result.detail())) {
                        return InferenceOutcome.failure(lastCategory, lastErrors, attempt);
                    }
                } else {
                    lastCategory = ErrorCategory.VALIDATION;
                    log.warn("{}: attempt {}/{} returned malformed output ({})",
                            label, attempt, MAX_ATTEMPTS, result.detail());
                    current = request.withCorrection("- " + result.detail());
                }
                continue;
            }

            ValidationResult<T> validation = validator.apply(result.payload());
            if (validation.isValid()) {
                if (!validation.notes().isEmpty()) {
                    log.debug("{}: coerced output: {}", label, String.join("; ", validation.notes()));
                }
                log.info("{}: valid output on attempt {}/{}", label, attempt, MAX_ATTEMPTS);
                return InferenceOutcome.success(validation.payload(), validation.notes(), attempt);
            }

            lastCategory = ErrorCategory.VALIDATION;
            lastErrors = validation.errors();
            log.warn("{}: attempt {}/{} failed schema validation ({} errors)",
                    label, attempt, MAX_ATTEMPTS, lastErrors.size());
            current = request.withCorrection("- " + String.join("\n- ", lastErrors));
        }

        log.warn("{}: giving up after {} attempts: {}", label, MAX_ATTEMPTS, String.join("; ", lastErrors));
        return InferenceOutcome.failure(lastCategory, lastErrors, MAX_ATTEMPTS);
    }

    /** Sleeps before a transient retry; returns {@code false} if interrupted. */
    private boolean backoff(String label, int attempt, String detail) {
        long delay = retryBackoff.toMillis() * attempt;
        log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                label, attempt, MAX_ATTEMPTS, detail, delay);
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
