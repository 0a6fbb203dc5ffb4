package com.ivirs.backend.service;

import com.ivirs.backend.model.EntitySnapshot;
import com.ivirs.backend.model.Position;
import com.ivirs.backend.model.VehicleRecord;
import com.ivirs.backend.model.VehicleRole;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Working set of the vehicles present in the current tick.
 *
 * <p>Positions are replaced wholesale on every snapshot. Roles are resolved from the feed
 * flags the first tick a vehicle shows one and are never re-resolved while it stays. A
 * vehicle that disappears from the snapshot is forgotten entirely.
 */
@Slf4j
public class VehicleRegistry {

    private volatile Map<String, Position> positions = Map.of();
    private final Map<String, VehicleRole> roles = new HashMap<>();

    /**
     * Replaces the working set with {@code snapshot}.
     *
     * @return ids of vehicles that left since the previous snapshot
     */
    public synchronized Set<String> update(EntitySnapshot snapshot) {
        Map<String, Position> current = new HashMap<>();
        for (VehicleRecord vehicle : snapshot.getVehicles()) {
            if (vehicle.getId() == null || vehicle.getPosition() == null) {
                continue;
            }
            current.put(vehicle.getId(), vehicle.getPosition());
            VehicleRole known = roles.get(vehicle.getId());
            if (known == null || known == VehicleRole.UNCLASSIFIED) {
                VehicleRole resolved = VehicleRole.fromAttributes(vehicle.getAttributes());
                roles.put(vehicle.getId(), resolved);
                if (resolved != VehicleRole.UNCLASSIFIED) {
                    log.debug("Vehicle {} classified as {}", vehicle.getId(), resolved);
                }
            }
        }

        Set<String> departed = new HashSet<>(roles.keySet());
        departed.removeAll(current.keySet());
        roles.keySet().removeAll(departed);
        positions = Collections.unmodifiableMap(current);
        return departed;
    }

    public Optional<Position> positionOf(String vehicleId) {
        return Optional.ofNullable(positions.get(vehicleId));
    }

    public synchronized VehicleRole roleOf(String vehicleId) {
        return roles.getOrDefault(vehicleId, VehicleRole.UNCLASSIFIED);
    }

    /** Present vehicles with {@code role}, in id order. */
    public synchronized Set<String> vehiclesWithRole(VehicleRole role) {
        Set<String> ids = new TreeSet<>();
        roles.forEach((id, r) -> {
            if (r == role) {
                ids.add(id);
            }
        });
        return ids;
    }

    /** Closest present vehicle with {@code role}; ties resolve to the lowest id. */
    public Optional<String> nearestWithRole(VehicleRole role, Position point) {
        String nearest = null;
        double best = Double.MAX_VALUE;
        for (String id : vehiclesWithRole(role)) {
            Position p = positions.get(id);
            if (p == null) continue;
            double d = p.distanceTo(point);
            if (d < best) {
                best = d;
                nearest = id;
            }
        }
        return Optional.ofNullable(nearest);
    }

    public Map<String, Position> positions() {
        return positions;
    }

    public int activeCount() {
        return positions.size();
    }
}
