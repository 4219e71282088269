package io.mcg.engine.provenance;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Payload of a System asset: a periodic atomic structure.
 *
 * <pre>
 * { "atoms": [{"el": "Si", "pos": [x, y, z]}, ...],
 *   "lattice": [[ax, ay, az], [bx, by, bz], [cx, cy, cz]],
 *   "pbc": [true, true, true] }
 * </pre>
 *
 * Construction never rejects a payload; {@link #validate()} lists what is wrong with it.
 */
public record StructurePayload(Map<String, Object> fields) implements AssetPayload {
    public StructurePayload {
        fields = Payloads.freeze(fields);
    }

    @Override
    public AssetKind kind() {
        return AssetKind.SYSTEM;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        for (String key : List.of("atoms", "lattice", "pbc")) {
            if (!fields.containsKey(key)) {
                problems.add("missing field: " + key);
            }
        }
        if (!problems.isEmpty()) {
            return problems;
        }
        if (fields.get("atoms") instanceof List<?> atoms) {
            for (int i = 0; i < atoms.size(); i++) {
                if (!(atoms.get(i) instanceof Map<?, ?> atom) || !atom.containsKey("el")) {
                    problems.add("atoms[" + i + "] must be an object with 'el' and 'pos'");
                } else if (!(atom.get("pos") instanceof List<?> pos) || !isVector(pos)) {
                    problems.add("atoms[" + i + "].pos must hold 3 numbers");
                }
            }
        } else {
            problems.add("atoms must be a list");
        }
        if (fields.get("lattice") instanceof List<?> lattice && lattice.size() == 3) {
            for (int i = 0; i < 3; i++) {
                if (!(lattice.get(i) instanceof List<?> row) || !isVector(row)) {
                    problems.add("lattice[" + i + "] must hold 3 numbers");
                }
            }
        } else {
            problems.add("lattice must be a 3x3 list");
        }
        if (fields.get("pbc") instanceof List<?> pbc && pbc.size() == 3) {
            for (Object flag : pbc) {
                if (!(flag instanceof Boolean)) {
                    problems.add("pbc entries must be booleans");
                    break;
                }
            }
        } else {
            problems.add("pbc must hold 3 booleans");
        }
        return problems;
    }

    private static boolean isVector(List<?> values) {
        if (values.size() != 3) {
            return false;
        }
        for (Object value : values) {
            if (!(value instanceof Number)) {
                return false;
            }
        }
        return true;
    }
}
