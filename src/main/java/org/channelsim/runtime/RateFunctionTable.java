package org.channelsim.runtime;

import org.channelsim.compiler.RateEquationCompiler;
import org.channelsim.compiler.api.RateEquationException;
import org.channelsim.compiler.api.RateFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The compiled rate functions of one channel model, keyed by rate function id.
 * <p>
 * Each equation is compiled exactly once; every transition that references the same id
 * shares the same {@link RateFunction} instance.
 */
public final class RateFunctionTable {

    private static final Logger LOG = LoggerFactory.getLogger(RateFunctionTable.class);

    private final Map<String, RateFunction> functions;

    private RateFunctionTable(Map<String, RateFunction> functions) {
        this.functions = Collections.unmodifiableMap(functions);
    }

    /**
     * Compiles all equations.
     *
     * @param equations Equation text keyed by function id.
     * @param compiler The compiler to use.
     * @return The table of compiled functions.
     * @throws RateEquationException on the first equation that fails to compile.
     */
    public static RateFunctionTable compile(Map<String, String> equations, RateEquationCompiler compiler)
            throws RateEquationException {
        Map<String, RateFunction> compiled = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : equations.entrySet()) {
            if (compiled.containsKey(entry.getKey())) {
                continue;
            }
            try {
                compiled.put(entry.getKey(), compiler.compile(entry.getValue()));
            } catch (RateEquationException e) {
                LOG.error("Failed to compile rate function '{}': {}", entry.getKey(), e.getMessage());
                throw e;
            }
        }
        LOG.debug("Compiled {} rate functions", compiled.size());
        return new RateFunctionTable(compiled);
    }

    /**
     * @param id The rate function id.
     * @return The compiled function.
     * @throws IllegalArgumentException if the id was never declared.
     */
    public RateFunction get(String id) {
        RateFunction function = functions.get(id);
        if (function == null) {
            throw new IllegalArgumentException("Undeclared rate function id '" + id + "'");
        }
        return function;
    }

    public Set<String> ids() {
        return functions.keySet();
    }

    public int size() {
        return functions.size();
    }
}
