package org.channelsim.compiler.api;

/**
 * Thrown when a rate equation cannot be compiled.
 * <p>
 * Compilation errors are fatal for the engine being constructed and are never retried.
 * Subclasses distinguish syntax errors ({@link RateEquationParseException}) from references
 * to identifiers other than {@code V} and {@code exp} ({@link UndefinedSymbolException}).
 */
public abstract class RateEquationException extends Exception {

    private final String equation;
    private final int offset;

    /**
     * @param equation The equation that failed to compile.
     * @param offset Zero-based character offset of the error.
     * @param message Description of the failure.
     */
    protected RateEquationException(String equation, int offset, String message) {
        super(message + " at offset " + offset + " in '" + equation + "'");
        this.equation = equation;
        this.offset = offset;
    }

    public String getEquation() {
        return equation;
    }

    public int getOffset() {
        return offset;
    }
}
