package io.mcg.engine.provenance;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Physical unit vocabulary shared by result materialization and callers.
 */
public final class Units {
    public static final Map<String, String> STANDARD = standard();

    private static final Map<String, String> SUFFIXES = suffixes();

    private Units() {}

    /** Unit implied by a field name such as {@code kappa_W_per_mK} or {@code timestep_fs}. */
    public static Optional<String> inferFromName(String field) {
        if (field == null) {
            return Optional.empty();
        }
        for (Map.Entry<String, String> entry : SUFFIXES.entrySet()) {
            if (field.endsWith(entry.getKey())) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.ofNullable(STANDARD.get(field));
    }

    private static Map<String, String> standard() {
        Map<String, String> units = new LinkedHashMap<>();
        units.put("length", "angstrom");
        units.put("energy", "eV");
        units.put("force", "eV/angstrom");
        units.put("stress", "GPa");
        units.put("temperature", "K");
        units.put("time", "fs");
        units.put("thermal_conductivity", "W/(m*K)");
        units.put("frequency", "THz");
        units.put("lifetime", "ps");
        return Map.copyOf(units);
    }

    private static Map<String, String> suffixes() {
        // longest suffixes first so "_W_per_mK" wins over "_K"
        Map<String, String> suffixes = new LinkedHashMap<>();
        suffixes.put("_W_per_mK", "W/(m*K)");
        suffixes.put("_GPa", "GPa");
        suffixes.put("_THz", "THz");
        suffixes.put("_eV", "eV");
        suffixes.put("_fs", "fs");
        suffixes.put("_ps", "ps");
        suffixes.put("_ns", "ns");
        suffixes.put("_K", "K");
        suffixes.put("_A", "angstrom");
        return suffixes;
    }
}
