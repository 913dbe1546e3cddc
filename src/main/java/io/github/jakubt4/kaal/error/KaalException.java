package io.github.jakubt4.kaal.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type of every failure raised by the Panchang and Muhurta core.
 *
 * <p>The context map holds whatever is needed to reproduce the failure
 * (instant, location, system, body ...). It is rendered into the message so
 * that a single log line is enough.
 */
public abstract class KaalException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> context;

    protected KaalException(final ErrorKind kind, final String message, final Map<String, ?> context) {
        this(kind, message, context, null);
    }

    protected KaalException(final ErrorKind kind, final String message, final Map<String, ?> context,
                            final Throwable cause) {
        super(render(message, context), cause);
        this.kind = kind;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public ErrorKind kind() {
        return kind;
    }

    public Map<String, Object> context() {
        return context;
    }

    private static String render(final String message, final Map<String, ?> context) {
        if (context.isEmpty()) {
            return message;
        }
        final var sb = new StringBuilder(message).append(" [");
        var first = true;
        for (final var entry : context.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(']').toString();
    }
}
