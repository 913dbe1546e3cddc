package io.github.jakubt4.kaal.panchang;

import io.github.jakubt4.kaal.error.NoRiseOrSetException;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.analysis.solvers.AllowedSolution;
import org.hipparchus.analysis.solvers.BracketingNthOrderBrentSolver;
import org.hipparchus.exception.MathRuntimeException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Finds the instant at which a body's altitude crosses a threshold. Element
 * transitions reuse it with a signed angular distance in place of the altitude.
 *
 * <p>The search window is scanned at a fixed step for a sign change of
 * {@code altitude - h0}; the first bracket in the requested direction is refined
 * with a Brent solver to one second. A window without a bracket is retried
 * through the {@link RetryTemplate}, each attempt extending the window's end;
 * once attempts are exhausted the failure surfaces as {@link NoRiseOrSetException}.
 */
@Slf4j
@Component
public class RiseSetSolver {

    private static final double ABSOLUTE_ACCURACY_SECONDS = 1.0;
    private static final double RELATIVE_ACCURACY = 1e-12;
    private static final double FUNCTION_ACCURACY = 1e-9;
    private static final int MAXIMAL_ORDER = 5;

    private final RetryTemplate retryTemplate;
    private final Duration scanStep;
    private final Duration extension;
    private final int maxEvaluations;
    private final BracketingNthOrderBrentSolver solver =
            new BracketingNthOrderBrentSolver(RELATIVE_ACCURACY, ABSOLUTE_ACCURACY_SECONDS, FUNCTION_ACCURACY,
                    MAXIMAL_ORDER);

    public RiseSetSolver(@Qualifier("riseSetRetryTemplate") final RetryTemplate retryTemplate,
                         @Value("${kaal.rise-set.scan-step:PT10M}") final Duration scanStep,
                         @Value("${kaal.rise-set.extension:PT6H}") final Duration extension,
                         @Value("${kaal.rise-set.max-evaluations:100}") final int maxEvaluations) {
        if (scanStep.isZero() || scanStep.isNegative()) {
            throw new IllegalArgumentException("kaal.rise-set.scan-step must be positive: " + scanStep);
        }
        this.retryTemplate = retryTemplate;
        this.scanStep = scanStep;
        this.extension = extension;
        this.maxEvaluations = maxEvaluations;
    }

    /**
     * Retry policy for bracket searches: up to {@code maxAttempts} scans, no
     * back-off, retrying only {@link BracketNotFoundException}.
     */
    public static RetryTemplate retryTemplate(final int maxAttempts) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .retryOn(BracketNotFoundException.class)
                .noBackoff()
                .build();
    }

    /**
     * Thrown by a single scan that found no bracket; triggers a retry.
     */
    public static class BracketNotFoundException extends RuntimeException {

        public BracketNotFoundException(final String message) {
            super(message);
        }
    }

    /**
     * @param heightAboveThreshold {@code altitude(t) - h0} in degrees
     * @param context              reproduction details attached to a failure
     * @throws NoRiseOrSetException if no crossing is found after every retry
     */
    public Instant solve(final Instant windowStart,
                         final Duration window,
                         final Crossing crossing,
                         final ToDoubleFunction<Instant> heightAboveThreshold,
                         final Map<String, ?> context) {
        return retryTemplate.execute(retryContext -> {
            final var extended = window.plus(extension.multipliedBy(retryContext.getRetryCount()));
            if (retryContext.getRetryCount() > 0) {
                log.debug("Retrying {} search with window {} — {}", crossing, extended, context);
            }
            return scan(windowStart, extended, crossing, heightAboveThreshold);
        }, retryContext -> {
            final var last = retryContext.getLastThrowable();
            if (last instanceof RuntimeException && !(last instanceof BracketNotFoundException)) {
                throw (RuntimeException) last;
            }
            final var details = new LinkedHashMap<String, Object>(context);
            details.put("crossing", crossing);
            details.put("windowStart", windowStart);
            details.put("attempts", retryContext.getRetryCount());
            throw new NoRiseOrSetException("No " + crossing.name().toLowerCase(Locale.ROOT) + " found", details);
        });
    }

    private Instant scan(final Instant windowStart,
                         final Duration window,
                         final Crossing crossing,
                         final ToDoubleFunction<Instant> f) {
        final var stepSeconds = scanStep.toSeconds();
        final var windowSeconds = window.toSeconds();
        var lower = 0L;
        var previous = f.applyAsDouble(windowStart);
        while (lower < windowSeconds) {
            final var upper = Math.min(lower + stepSeconds, windowSeconds);
            final var current = f.applyAsDouble(windowStart.plusSeconds(upper));
            if (crossing.matches(previous, current)) {
                return current == 0.0 ? windowStart.plusSeconds(upper) : refine(windowStart, lower, upper, f);
            }
            previous = current;
            lower = upper;
        }
        throw new BracketNotFoundException("No " + crossing + " bracket in " + window + " from " + windowStart);
    }

    private Instant refine(final Instant origin, final long lower, final long upper,
                           final ToDoubleFunction<Instant> f) {
        try {
            final var root = solver.solve(maxEvaluations,
                    x -> f.applyAsDouble(origin.plusMillis(Math.round(x * 1000.0))),
                    lower, upper, AllowedSolution.ANY_SIDE);
            return origin.plusMillis(Math.round(root * 1000.0));
        } catch (final MathRuntimeException e) {
            throw new NoRiseOrSetException("Root refinement did not converge",
                    Map.of("lower", origin.plusSeconds(lower), "upper", origin.plusSeconds(upper),
                            "reason", String.valueOf(e.getMessage())));
        }
    }
}
