package com.example.ai.infra.resilience.error;

import com.example.ai.infra.resilience.AttemptTimeoutException;
import com.example.ai.infra.resilience.OperationCancelledException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Type- and message-based classifier.
 *
 * <p>Order: cancellation, timeouts, connectivity, status code (from a {@link StatusCodeAware} anywhere
 * in the cause chain, or a {@code status NNN} hint in the message), custom patterns, then message
 * keywords. Anything left is {@link ErrorType#TRANSIENT}.</p>
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    private static final long MAX_RETRY_AFTER_MS = 60_000L;
    private static final Pattern STATUS_HINT =
            Pattern.compile("(?:status(?:\\s*code)?|http)[\\s:=]*([1-5]\\d\\d)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern RETRY_AFTER_HINT =
            Pattern.compile("retry[-_ ]after[\\s:=]*(\\d+)", Pattern.CASE_INSENSITIVE);

    private final List<CustomPattern> customPatterns;
    private final Map<Integer, ErrorType> statusMappings;

    public DefaultErrorClassifier() {
        this(List.of(), Map.of());
    }

    public DefaultErrorClassifier(List<CustomPattern> customPatterns, Map<Integer, ErrorType> statusMappings) {
        this.customPatterns = new ArrayList<>(customPatterns == null ? List.of() : customPatterns);
        this.statusMappings = new HashMap<>(statusMappings == null ? Map.of() : statusMappings);
    }

    /** A message regex mapped to a type; {@code retryable} null means the type's default. */
    public record CustomPattern(Pattern pattern, ErrorType type, Boolean retryable) {
    }

    @Override
    public ErrorInfo classify(Throwable error) {
        if (error == null) {
            return ErrorInfo.of(ErrorType.UNKNOWN, "null");
        }
        Throwable root = unwrap(error);
        String message = describe(error);

        if (OperationCancelledException.isCancellation(error)) {
            return ErrorInfo.of(ErrorType.CANCELLED, message);
        }
        if (hasCause(error, AttemptTimeoutException.class) || hasCause(error, TimeoutException.class)
                || hasCause(error, SocketTimeoutException.class) || hasCause(error, HttpTimeoutException.class)) {
            return ErrorInfo.of(ErrorType.TIMEOUT, message);
        }
        if (root instanceof ConnectException || root instanceof UnknownHostException
                || root instanceof NoRouteToHostException || root instanceof SocketException) {
            return ErrorInfo.of(ErrorType.NETWORK, message);
        }

        StatusCodeAware status = findStatus(error);
        String lower = safeLower(message);
        if (status != null) {
            Long hint = status.retryAfterMs() != null ? capRetryAfter(status.retryAfterMs()) : retryAfterFromMessage(lower);
            return byStatus(status.statusCode(), message, hint);
        }

        for (CustomPattern p : customPatterns) {
            if (p.pattern().matcher(message).find()) {
                boolean retryable = p.retryable() != null ? p.retryable() : p.type().isRetryable();
                return new ErrorInfo(p.type(), retryable, null, message, null);
            }
        }

        Matcher sm = STATUS_HINT.matcher(lower);
        if (sm.find()) {
            int sc = Integer.parseInt(sm.group(1));
            if (sc >= 400) {
                return byStatus(sc, message, retryAfterFromMessage(lower));
            }
        }

        if (lower.contains("network") || lower.contains("connection reset") || lower.contains("connection refused")
                || lower.contains("econnreset") || lower.contains("econnrefused") || lower.contains("socket hang up")) {
            return ErrorInfo.of(ErrorType.NETWORK, message);
        }
        if (lower.contains("timeout") || lower.contains("timed out") || lower.contains("etimedout")) {
            return ErrorInfo.of(ErrorType.TIMEOUT, message);
        }
        if (lower.contains("unauthorized") || lower.contains("authentication")
                || lower.contains("invalid api key") || lower.contains("invalid token")) {
            return ErrorInfo.of(ErrorType.AUTHENTICATION, message);
        }
        if (lower.contains("rate limit") || lower.contains("too many requests") || lower.contains("quota exceeded")) {
            return new ErrorInfo(ErrorType.RATE_LIMIT, true, null, message, retryAfterFromMessage(lower));
        }
        if (lower.contains("validation") || lower.contains("invalid") || lower.contains("bad request")) {
            return ErrorInfo.of(ErrorType.VALIDATION, message);
        }
        if (lower.contains("cancel") || lower.contains("abort")) {
            return ErrorInfo.of(ErrorType.CANCELLED, message);
        }
        return ErrorInfo.of(ErrorType.TRANSIENT, message);
    }

    private ErrorInfo byStatus(int sc, String message, Long retryAfterMs) {
        ErrorType mapped = statusMappings.get(sc);
        if (mapped != null) {
            return new ErrorInfo(mapped, mapped.isRetryable(), sc, message, retryAfterMs);
        }
        ErrorType type;
        if (sc == 401) {
            type = ErrorType.AUTHENTICATION;
        } else if (sc == 403) {
            type = ErrorType.PERMISSION;
        } else if (sc == 404) {
            type = ErrorType.NOT_FOUND;
        } else if (sc == 408) {
            type = ErrorType.TIMEOUT;
        } else if (sc == 429) {
            type = ErrorType.RATE_LIMIT;
        } else if (sc >= 400 && sc < 500) {
            type = ErrorType.CLIENT_ERROR;
        } else if (sc >= 500) {
            type = ErrorType.SERVER_ERROR;
        } else {
            type = ErrorType.UNKNOWN;
        }
        Long hint = (type == ErrorType.RATE_LIMIT || type == ErrorType.SERVER_ERROR) ? retryAfterMs : null;
        return new ErrorInfo(type, type.isRetryable(), sc, message, hint);
    }

    private static Long retryAfterFromMessage(String lower) {
        Matcher m = RETRY_AFTER_HINT.matcher(lower);
        if (!m.find()) {
            return null;
        }
        try {
            return capRetryAfter(Long.parseLong(m.group(1)) * 1000L);
        } catch (NumberFormatException overflow) {
            return MAX_RETRY_AFTER_MS;
        }
    }

    private static Long capRetryAfter(long ms) {
        return Math.max(0L, Math.min(ms, MAX_RETRY_AFTER_MS));
    }

    private static StatusCodeAware findStatus(Throwable t) {
        Throwable cur = t;
        int guard = 0;
        while (cur != null && guard++ < 12) {
            if (cur instanceof StatusCodeAware s) {
                return s;
            }
            if (cur.getCause() == cur) {
                break;
            }
            cur = cur.getCause();
        }
        return null;
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        Throwable cur = t;
        int guard = 0;
        while (cur != null && guard++ < 12) {
            if (type.isInstance(cur)) {
                return true;
            }
            if (cur.getCause() == cur) {
                break;
            }
            cur = cur.getCause();
        }
        return false;
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        int guard = 0;
        while (cur.getCause() != null && cur.getCause() != cur && guard++ < 12) {
            cur = cur.getCause();
        }
        return cur;
    }

    private static String describe(Throwable t) {
        StringBuilder sb = new StringBuilder();
        Throwable cur = t;
        int guard = 0;
        while (cur != null && guard++ < 4) {
            if (cur.getMessage() != null) {
                if (sb.length() > 0) {
                    sb.append(" <- ");
                }
                sb.append(cur.getMessage());
            }
            if (cur.getCause() == cur) {
                break;
            }
            cur = cur.getCause();
        }
        return sb.length() == 0 ? t.getClass().getSimpleName() : sb.toString();
    }

    private static String safeLower(String s) {
        return (s == null) ? "" : s.toLowerCase(Locale.ROOT);
    }
}
