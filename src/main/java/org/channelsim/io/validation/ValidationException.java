package org.channelsim.io.validation;

import java.util.List;

/**
 * Thrown when a model, protocol or request document fails validation.
 */
public class ValidationException extends Exception {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super("Validation failed: " + String.join(" ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
