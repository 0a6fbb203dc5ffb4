package com.ivirs.backend.feed;

import com.ivirs.backend.config.IvirsProperties;
import com.ivirs.backend.model.EntitySnapshot;
import com.ivirs.backend.model.Position;
import com.ivirs.backend.model.ReportType;
import com.ivirs.backend.model.VehicleRecord;
import com.ivirs.backend.model.VehicleRole;
import com.ivirs.backend.service.EventScheduler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Stand-in mobility feed: a straight 10 km, four-lane highway with constant-speed traffic.
 *
 * <p>Role flags and event timers are drawn once when a vehicle enters, the same attributes an
 * external traffic simulator would attach to its vehicles.
 */
public class SyntheticHighwayFeed implements MobilityFeed {

    public static final double HIGHWAY_LENGTH = 10_000.0;
    public static final double HALF_WIDTH = 50.0;
    private static final double MIN_SPEED = 20.0;
    private static final double MAX_SPEED = 35.0;
    // timers fire well before a vehicle reaches the end of the road
    private static final double MIN_TIMER_DELAY = 5.0;
    private static final double MAX_TIMER_DELAY = 250.0;

    private final IvirsProperties.Synthetic settings;
    private final double stepSeconds;
    private final Random random;

    private final List<SimulatedVehicle> vehicles = new ArrayList<>();
    private int nextVehicleId = 1;
    private double clock;

    public SyntheticHighwayFeed(IvirsProperties.Synthetic settings, double stepSeconds, Random random) {
        this.settings = settings;
        this.stepSeconds = stepSeconds;
        this.random = random;
    }

    @Override
    public synchronized Optional<EntitySnapshot> poll() {
        clock += stepSeconds;

        Iterator<SimulatedVehicle> iterator = vehicles.iterator();
        while (iterator.hasNext()) {
            SimulatedVehicle vehicle = iterator.next();
            vehicle.x += vehicle.speed * stepSeconds;
            if (vehicle.x > HIGHWAY_LENGTH) {
                iterator.remove();
            }
        }

        if (vehicles.size() < settings.getMaxVehicles() && random.nextDouble() < settings.getSpawnProbability()) {
            vehicles.add(spawn());
        }

        List<VehicleRecord> records = new ArrayList<>(vehicles.size());
        for (SimulatedVehicle vehicle : vehicles) {
            records.add(new VehicleRecord(vehicle.id, new Position(vehicle.x, vehicle.y), vehicle.attributes));
        }
        return Optional.of(new EntitySnapshot(clock, records));
    }

    @Override
    public boolean isExhausted() {
        return false;
    }

    public synchronized int vehicleCount() {
        return vehicles.size();
    }

    private SimulatedVehicle spawn() {
        SimulatedVehicle vehicle = new SimulatedVehicle();
        vehicle.id = "veh_" + (nextVehicleId++);
        vehicle.x = 0.0;
        vehicle.y = uniform(-HALF_WIDTH, HALF_WIDTH);
        vehicle.speed = uniform(MIN_SPEED, MAX_SPEED);

        Map<String, String> attributes = new HashMap<>();
        VehicleRole role = drawRole();
        switch (role) {
            case MALICIOUS:
                attributes.put(VehicleRole.MALICIOUS_FLAG, "true");
                if (random.nextDouble() < settings.getFakeReportProbability()) {
                    attributes.put(EventScheduler.FAKE_REPORT_TIME, timer());
                    ReportType type = ReportType.values()[random.nextInt(ReportType.values().length)];
                    attributes.put(EventScheduler.FAKE_REPORT_TYPE, type.wireName());
                }
                break;
            case EMERGENCY:
                attributes.put(VehicleRole.EMERGENCY_FLAG, "true");
                break;
            case HONEST:
                attributes.put(VehicleRole.HONEST_FLAG, "true");
                break;
            default:
                break;
        }
        if (role != VehicleRole.MALICIOUS) {
            if (random.nextDouble() < settings.getBreakdownProbability()) {
                attributes.put(EventScheduler.WILL_BREAKDOWN, "true");
                attributes.put(EventScheduler.BREAKDOWN_TIME, timer());
            } else if (random.nextDouble() < settings.getCrashProbability()) {
                attributes.put(EventScheduler.WILL_CRASH, "true");
                attributes.put(EventScheduler.CRASH_TIME, timer());
            }
        }
        vehicle.attributes = Map.copyOf(attributes);
        return vehicle;
    }

    private VehicleRole drawRole() {
        double draw = random.nextDouble();
        if (draw < settings.getMaliciousRatio()) return VehicleRole.MALICIOUS;
        draw -= settings.getMaliciousRatio();
        if (draw < settings.getEmergencyRatio()) return VehicleRole.EMERGENCY;
        draw -= settings.getEmergencyRatio();
        if (draw < settings.getHonestRatio()) return VehicleRole.HONEST;
        return VehicleRole.UNCLASSIFIED;
    }

    private String timer() {
        return String.format(Locale.ROOT, "%.1f", clock + uniform(MIN_TIMER_DELAY, MAX_TIMER_DELAY));
    }

    private double uniform(double low, double high) {
        return low + (high - low) * random.nextDouble();
    }

    private static class SimulatedVehicle {
        String id;
        double x;
        double y;
        double speed;
        Map<String, String> attributes;
    }
}
