package com.swaprouter.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Direction of the requested trade. Candidate routes do not depend on it; it is carried
 * through to best-trade selection.
 */
public enum TradeType {

    EXACT_INPUT,
    EXACT_OUTPUT;

    /**
     * Look up a trade type by name, case-insensitively.
     */
    public static Optional<TradeType> fromLabel(String label) {
        if (label == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(label.trim()))
                .findFirst();
    }

    public static String[] supportedLabels() {
        return Arrays.stream(values()).map(Enum::name).toArray(String[]::new);
    }
}
