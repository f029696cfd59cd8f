package org.channelsim.runtime.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The named stimulus variables of a protocol. The key is the name used in protocol documents
 * and in {@code Stimulus#valueAt(String, double)}.
 */
public enum StimulusVariable {
    VOLTAGE_MV("voltage_mV"),
    INTERNAL_K_MM("internal_K_mM"),
    EXTERNAL_K_MM("external_K_mM"),
    VOLUME_INTERNAL_L("volume_internal_L"),
    VOLUME_EXTERNAL_L("volume_external_L");

    private final String key;

    StimulusVariable(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Looks up a variable by its document key.
     * @param key The key, e.g. {@code "voltage_mV"}.
     * @return The variable, or empty if the key is unknown.
     */
    public static Optional<StimulusVariable> fromKey(String key) {
        for (StimulusVariable variable : values()) {
            if (variable.key.equals(key)) {
                return Optional.of(variable);
            }
        }
        return Optional.empty();
    }

    /**
     * @return All keys in declaration order.
     */
    public static List<String> keys() {
        return Arrays.stream(values()).map(StimulusVariable::key).toList();
    }
}
