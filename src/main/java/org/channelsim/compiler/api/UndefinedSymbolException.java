package org.channelsim.compiler.api;

/**
 * Thrown when a rate equation references an identifier other than the voltage {@code V}
 * or the function {@code exp}.
 */
public class UndefinedSymbolException extends RateEquationException {

    private final String symbol;

    /**
     * @param equation The original equation string.
     * @param offset Zero-based offset of the identifier.
     * @param symbol The offending identifier.
     */
    public UndefinedSymbolException(String equation, int offset, String symbol) {
        super(equation, offset, "Undefined symbol '" + symbol + "'");
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
