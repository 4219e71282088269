package io.mcg.engine.provenance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, typed unit of data flowing through the engine. {@code units}, {@code uri} and
 * {@code hash} are optional: an absent map is empty, absent strings are {@code null}.
 */
public record Asset(AssetKind kind, String id, AssetPayload payload, Map<String, String> units, String uri, String hash) {
    public Asset {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(payload, "payload");
        if (payload.kind() != kind) {
            throw new IllegalArgumentException("Payload variant " + payload.kind() + " does not match asset kind " + kind);
        }
        units = units == null || units.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(units));
    }

    /** Creates a content-addressed asset. */
    public static Asset create(AssetKind kind, Map<String, Object> payload) {
        return create(kind, payload, Map.of());
    }

    public static Asset create(AssetKind kind, Map<String, Object> payload, Map<String, String> units) {
        AssetPayload typed = kind.payload(payload);
        return new Asset(kind, AssetIds.assetId(kind, typed.fields()), typed, units, null, null);
    }

    public Asset withLocation(String newUri, String newHash) {
        return new Asset(kind, id, payload, units, newUri, newHash);
    }

    public Map<String, Object> fields() {
        return payload.fields();
    }

    public Optional<String> uriOptional() {
        return Optional.ofNullable(uri);
    }

    public Optional<String> hashOptional() {
        return Optional.ofNullable(hash);
    }

    /** Whether {@link #id()} matches the content address of the payload. */
    public boolean isContentAddressed() {
        return id.equals(AssetIds.assetId(kind, payload.fields()));
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", kind.wireName());
        wire.put("id", id);
        wire.put("payload", payload.fields());
        if (!units.isEmpty()) {
            wire.put("units", units);
        }
        if (uri != null) {
            wire.put("uri", uri);
        }
        if (hash != null) {
            wire.put("hash", hash);
        }
        return wire;
    }

    @SuppressWarnings("unchecked")
    public static Asset fromWire(Map<String, Object> wire) {
        Objects.requireNonNull(wire, "wire");
        Object type = wire.containsKey("type") ? wire.get("type") : wire.get("kind");
        AssetKind kind = AssetKind.fromWire(type == null ? null : type.toString());
        Object id = wire.get("id");
        if (id == null) {
            throw new IllegalArgumentException("Asset is missing an id: " + wire);
        }
        Map<String, Object> payload = wire.get("payload") instanceof Map<?, ?> map
            ? (Map<String, Object>) map
            : Map.of();
        Map<String, String> units = new LinkedHashMap<>();
        if (wire.get("units") instanceof Map<?, ?> rawUnits) {
            for (Map.Entry<?, ?> entry : rawUnits.entrySet()) {
                units.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
            }
        }
        return new Asset(
            kind,
            id.toString(),
            kind.payload(payload),
            units,
            wire.get("uri") == null ? null : wire.get("uri").toString(),
            wire.get("hash") == null ? null : wire.get("hash").toString()
        );
    }
}
