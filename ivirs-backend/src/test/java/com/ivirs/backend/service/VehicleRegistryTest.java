package com.ivirs.backend.service;

import com.ivirs.backend.model.EntitySnapshot;
import com.ivirs.backend.model.Position;
import com.ivirs.backend.model.VehicleRecord;
import com.ivirs.backend.model.VehicleRole;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VehicleRegistryTest {

    private static EntitySnapshot snapshot(double time, VehicleRecord... vehicles) {
        return new EntitySnapshot(time, Arrays.asList(vehicles));
    }

    @Test
    void reportsDeparturesAndReplacesPositions() {
        VehicleRegistry registry = new VehicleRegistry();
        registry.update(snapshot(1.0,
                new VehicleRecord("a", new Position(0, 0), Map.of()),
                new VehicleRecord("b", new Position(10, 0), Map.of())));

        Set<String> departed = registry.update(snapshot(2.0,
                new VehicleRecord("b", new Position(20, 0), Map.of())));

        assertEquals(Set.of("a"), departed);
        assertEquals(1, registry.activeCount());
        assertEquals(Optional.of(new Position(20, 0)), registry.positionOf("b"));
        assertTrue(registry.positionOf("a").isEmpty());
    }

    @Test
    void roleIsResolvedOnceAndKept() {
        VehicleRegistry registry = new VehicleRegistry();
        registry.update(snapshot(1.0, new VehicleRecord("v", new Position(0, 0), Map.of(VehicleRole.HONEST_FLAG, "true"))));

        registry.update(snapshot(2.0, new VehicleRecord("v", new Position(0, 0), Map.of(VehicleRole.MALICIOUS_FLAG, "true"))));

        assertEquals(VehicleRole.HONEST, registry.roleOf("v"));
    }

    @Test
    void unclassifiedVehicleIsResolvedWhenFlagsAppear() {
        VehicleRegistry registry = new VehicleRegistry();
        registry.update(snapshot(1.0, new VehicleRecord("v", new Position(0, 0), Map.of())));
        assertEquals(VehicleRole.UNCLASSIFIED, registry.roleOf("v"));

        registry.update(snapshot(2.0, new VehicleRecord("v", new Position(0, 0), Map.of(VehicleRole.EMERGENCY_FLAG, "true"))));

        assertEquals(VehicleRole.EMERGENCY, registry.roleOf("v"));
    }

    @Test
    void maliciousFlagWinsOverOtherFlags() {
        VehicleRegistry registry = new VehicleRegistry();
        registry.update(snapshot(1.0, new VehicleRecord("v", new Position(0, 0), Map.of(
                VehicleRole.HONEST_FLAG, "true",
                VehicleRole.MALICIOUS_FLAG, "true"))));

        assertEquals(VehicleRole.MALICIOUS, registry.roleOf("v"));
    }

    @Test
    void returningVehicleIsClassifiedAfresh() {
        VehicleRegistry registry = new VehicleRegistry();
        registry.update(snapshot(1.0, new VehicleRecord("v", new Position(0, 0), Map.of(VehicleRole.HONEST_FLAG, "true"))));
        registry.update(snapshot(2.0));

        registry.update(snapshot(3.0, new VehicleRecord("v", new Position(0, 0), Map.of(VehicleRole.MALICIOUS_FLAG, "true"))));

        assertEquals(VehicleRole.MALICIOUS, registry.roleOf("v"));
    }

    @Test
    void incompleteRecordsAreIgnored() {
        VehicleRegistry registry = new VehicleRegistry();

        registry.update(snapshot(1.0,
                new VehicleRecord(null, new Position(0, 0), Map.of()),
                new VehicleRecord("nowhere", null, Map.of())));

        assertEquals(0, registry.activeCount());
    }

    @Test
    void nearestWithRoleBreaksTiesById() {
        VehicleRegistry registry = new VehicleRegistry();
        registry.update(snapshot(1.0,
                new VehicleRecord("amb_2", new Position(-100, 0), Map.of(VehicleRole.EMERGENCY_FLAG, "true")),
                new VehicleRecord("amb_1", new Position(100, 0), Map.of(VehicleRole.EMERGENCY_FLAG, "true")),
                new VehicleRecord("car", new Position(1, 0), Map.of(VehicleRole.HONEST_FLAG, "true"))));

        assertEquals(Optional.of("amb_1"), registry.nearestWithRole(VehicleRole.EMERGENCY, new Position(0, 0)));
        assertEquals(List.of("amb_1", "amb_2"), List.copyOf(registry.vehiclesWithRole(VehicleRole.EMERGENCY)));
        assertTrue(registry.nearestWithRole(VehicleRole.MALICIOUS, new Position(0, 0)).isEmpty());
    }
}
