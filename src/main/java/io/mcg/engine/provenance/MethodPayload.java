package io.mcg.engine.provenance;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Payload of a Method asset: which code family and program (and optionally model and device)
 * a computation uses.
 */
public record MethodPayload(Map<String, Object> fields) implements AssetPayload {
    public MethodPayload {
        fields = Payloads.freeze(fields);
    }

    @Override
    public AssetKind kind() {
        return AssetKind.METHOD;
    }

    public Optional<Family> family() {
        return parse(Family.class, fields.get("family"));
    }

    public Optional<Device> device() {
        return parse(Device.class, fields.get("device"));
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (!fields.containsKey("family")) {
            problems.add("missing field: family");
        } else if (family().isEmpty()) {
            problems.add("family must be one of " + List.of(Family.values()));
        }
        if (!fields.containsKey("code")) {
            problems.add("missing field: code");
        }
        if (fields.containsKey("device") && device().isEmpty()) {
            problems.add("device must be one of " + List.of(Device.values()));
        }
        return problems;
    }

    private static <E extends Enum<E>> Optional<E> parse(Class<E> type, Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Enum.valueOf(type, raw.toString().trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    public enum Family {
        DFT,
        MD,
        LD,
        ML,
        QM
    }

    public enum Device {
        CPU,
        GPU,
        TPU
    }
}
