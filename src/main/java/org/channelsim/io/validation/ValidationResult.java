package org.channelsim.io.validation;

import java.util.List;

/**
 * Outcome of validating an input document: either a fully built value or the list of problems.
 *
 * @param <T> The type of the built value.
 */
public sealed interface ValidationResult<T> permits ValidationResult.Valid, ValidationResult.Invalid {

    /**
     * @param value The built value.
     * @param warnings Non-fatal findings, e.g. overlapping epochs.
     */
    record Valid<T>(T value, List<String> warnings) implements ValidationResult<T> {
        public Valid {
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * @param errors All problems found, in document order. Never empty.
     */
    record Invalid<T>(List<String> errors) implements ValidationResult<T> {
        public Invalid {
            errors = List.copyOf(errors);
            if (errors.isEmpty()) {
                throw new IllegalArgumentException("An invalid result needs at least one error");
            }
        }
    }

    default boolean isValid() {
        return this instanceof Valid;
    }

    /**
     * Returns the built value.
     * @throws ValidationException with all errors if the result is invalid.
     */
    default T orElseThrow() throws ValidationException {
        if (this instanceof Valid<T> valid) {
            return valid.value();
        }
        throw new ValidationException(((Invalid<T>) this).errors());
    }
}
