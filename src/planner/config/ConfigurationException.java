package planner.config;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a configuration fails validation. Carries every error found, not just the first.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> errors;

    public ConfigurationException(String message) {
        this(Collections.singletonList(message));
    }

    public ConfigurationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = Collections.singletonList(message);
    }

    public List<String> getErrors() {
        return errors;
    }
}
