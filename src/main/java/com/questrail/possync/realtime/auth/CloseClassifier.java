package com.questrail.possync.realtime.auth;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * CloseClassifier
 * -----------------------------------------------------------------------------
 * Pure mapping of {@code (closeCode, reason, elapsedMillis)} to a
 * {@link FailureKind}.
 *
 * <h2>Rules</h2>
 * A closure is an {@link FailureKind#AUTH_FAILURE} when any of the following hold:
 * <ul>
 *   <li>the code is 1008 (policy violation)</li>
 *   <li>the code is in the application range 4000..4999</li>
 *   <li>the reason contains, ignoring case, one of {@code auth},
 *       {@code unauthorized}, {@code forbidden}, {@code 401}, {@code 403},
 *       {@code invalid token}, {@code token expired}</li>
 *   <li>the code is 1006, the reason is blank and the socket died within the
 *       quick-failure threshold of the open attempt</li>
 * </ul>
 * Everything else is {@link FailureKind#TRANSIENT}.
 *
 * <p>The quick-failure rule is a heuristic. Some backends drop unauthenticated
 * sockets without a close frame, which surfaces as an abnormal 1006 within a
 * few hundred milliseconds. A genuine network failure that quick is
 * misclassified and parks the connection until the next credential refresh.</p>
 */
public final class CloseClassifier
{
    public static final int NORMAL_CLOSURE = 1000;
    public static final int GOING_AWAY = 1001;
    public static final int ABNORMAL_CLOSURE = 1006;
    public static final int POLICY_VIOLATION = 1008;

    public static final Duration DEFAULT_QUICK_FAILURE_THRESHOLD = Duration.ofSeconds(2);

    private static final List<String> AUTH_KEYWORDS = List.of(
            "auth",
            "unauthorized",
            "forbidden",
            "401",
            "403",
            "invalid token",
            "token expired"
    );

    private final long quickFailureThresholdMillis;

    public CloseClassifier()
    {
        this(DEFAULT_QUICK_FAILURE_THRESHOLD);
    }

    public CloseClassifier(Duration quickFailureThreshold)
    {
        Objects.requireNonNull(quickFailureThreshold, "quickFailureThreshold");
        if (quickFailureThreshold.isNegative()) {
            throw new IllegalArgumentException("quickFailureThreshold must be non-negative");
        }
        this.quickFailureThresholdMillis = quickFailureThreshold.toMillis();
    }

    /**
     * @param code          close code reported by the transport
     * @param reason        close reason, may be {@code null}
     * @param elapsedMillis time between the open attempt and the closure
     */
    public FailureKind classify(int code, String reason, long elapsedMillis)
    {
        if (code == POLICY_VIOLATION) {
            return FailureKind.AUTH_FAILURE;
        }
        if (code >= 4000 && code <= 4999) {
            return FailureKind.AUTH_FAILURE;
        }

        String text = reason == null ? "" : reason.toLowerCase(Locale.ROOT);
        for (String keyword : AUTH_KEYWORDS) {
            if (text.contains(keyword)) {
                return FailureKind.AUTH_FAILURE;
            }
        }

        if (code == ABNORMAL_CLOSURE && text.isBlank() && elapsedMillis < quickFailureThresholdMillis) {
            return FailureKind.AUTH_FAILURE;
        }

        return FailureKind.TRANSIENT;
    }

    public long quickFailureThresholdMillis()
    {
        return quickFailureThresholdMillis;
    }
}
