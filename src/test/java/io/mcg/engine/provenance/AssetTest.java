package io.mcg.engine.provenance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mcg.engine.support.EngineTestSupport;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AssetTest {
    @Test
    void identicalPayloadsShareAnId() {
        Asset first = Asset.create(AssetKind.PARAMS, Map.of("T", 300, "mesh", List.of(8, 8, 8)));
        Asset second = Asset.create(AssetKind.PARAMS, Map.of("mesh", List.of(8, 8, 8), "T", 300));
        assertEquals(first.id(), second.id());
        assertTrue(first.isContentAddressed());
    }

    @Test
    void payloadIsCopiedAndReadOnly() {
        List<Object> mesh = new ArrayList<>(List.of(8, 8, 8));
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("mesh", mesh);
        Asset asset = Asset.create(AssetKind.PARAMS, source);
        String id = asset.id();

        mesh.add(9);
        source.put("extra", true);

        assertEquals(List.of(8, 8, 8), asset.fields().get("mesh"));
        assertFalse(asset.fields().containsKey("extra"));
        assertEquals(id, asset.id());
        assertThrows(UnsupportedOperationException.class, () -> asset.fields().put("x", 1));
    }

    @Test
    void wireFormRoundTripsUnitsAndLocation() {
        Asset asset = Asset.create(AssetKind.RESULTS, Map.of("kappa_W_per_mK", 142.5), Map.of("kappa_W_per_mK", "W/(m*K)"))
            .withLocation("file:///data/kappa.out", "abc123");
        Map<String, Object> wire = asset.toWire();
        assertEquals("Results", wire.get("type"));
        assertEquals(asset.id(), wire.get("id"));

        Asset restored = Asset.fromWire(wire);
        assertEquals(asset, restored);
        assertEquals("W/(m*K)", restored.units().get("kappa_W_per_mK"));
        assertEquals("abc123", restored.hashOptional().get());
    }

    @Test
    void rejectsMismatchedPayloadVariant() {
        AssetPayload method = AssetKind.METHOD.payload(Map.of("family", "MD", "code", "lammps"));
        assertThrows(IllegalArgumentException.class, () -> new Asset(AssetKind.SYSTEM, "S000000", method, null, null, null));
    }

    @Test
    void unknownKindIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Asset.fromWire(Map.of("type", "Blob", "id", "B1", "payload", Map.of())));
    }

    @Test
    void structurePayloadValidates() {
        Asset silicon = EngineTestSupport.silicon();
        StructurePayload structure = (StructurePayload) silicon.payload();
        assertTrue(structure.validate().isEmpty(), structure.validate().toString());

        StructurePayload broken = new StructurePayload(Map.of("atoms", List.of(Map.of("el", "Si", "pos", List.of(0, 0))),
            "lattice", List.of(), "pbc", List.of(true, true, true)));
        List<String> problems = broken.validate();
        assertTrue(problems.contains("atoms[0].pos must hold 3 numbers"), problems.toString());
        assertTrue(problems.contains("lattice must be a 3x3 list"), problems.toString());
    }

    @Test
    void methodPayloadValidates() {
        MethodPayload good = new MethodPayload(Map.of("family", "md", "code", "lammps", "device", "gpu"));
        assertTrue(good.validate().isEmpty());
        assertEquals(MethodPayload.Family.MD, good.family().get());
        assertEquals(MethodPayload.Device.GPU, good.device().get());

        MethodPayload bad = new MethodPayload(Map.of("family", "alchemy"));
        assertEquals(2, bad.validate().size());
    }

    @Test
    void unitsAreInferredFromFieldNames() {
        assertEquals("W/(m*K)", Units.inferFromName("kappa_W_per_mK").get());
        assertEquals("fs", Units.inferFromName("timestep_fs").get());
        assertEquals("K", Units.inferFromName("temperature").get());
        assertTrue(Units.inferFromName("mesh").isEmpty());
    }
}
