package org.channelsim.compiler.api;

/**
 * Thrown when a rate equation is syntactically malformed.
 */
public class RateEquationParseException extends RateEquationException {

    /**
     * @param equation The original equation string.
     * @param offset Zero-based offset of the offending character or token.
     * @param description What was expected or found.
     */
    public RateEquationParseException(String equation, int offset, String description) {
        super(equation, offset, description);
    }
}
