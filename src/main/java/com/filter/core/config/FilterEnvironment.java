package com.filter.core.config;

import com.filter.core.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * The only environment variables the core reads directly.
 */
@Component
public class FilterEnvironment {

    static final String LOCK_TIMEOUT = "FILTER_LOCK_TIMEOUT_SECONDS";
    static final String NON_INTERACTIVE = "FILTER_NON_INTERACTIVE";

    private final Map<String, String> env;

    public FilterEnvironment() {
        this(System.getenv());
    }

    public FilterEnvironment(Map<String, String> env) {
        this.env = Map.copyOf(env);
    }

    /**
     * @return lock timeout override in seconds, or {@code null} when not set
     */
    public Integer lockTimeoutOverride() {
        String raw = env.get(LOCK_TIMEOUT);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            int seconds = Integer.parseInt(raw.trim());
            if (seconds < 0) {
                throw new ValidationException(LOCK_TIMEOUT + " must not be negative: " + raw);
            }
            return seconds;
        } catch (NumberFormatException e) {
            throw new ValidationException(LOCK_TIMEOUT + " is not a number: " + raw);
        }
    }

    public boolean nonInteractive() {
        String raw = env.get(NON_INTERACTIVE);
        return raw != null && (raw.equalsIgnoreCase("true") || raw.equals("1") || raw.equalsIgnoreCase("yes"));
    }

    ConfigLayer asLayer() {
        return new ConfigLayer(null, null, lockTimeoutOverride(), null, null, null);
    }
}
