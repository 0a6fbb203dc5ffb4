package com.ivirs.backend.controller;

import com.ivirs.backend.feed.MobilityFeed;
import com.ivirs.backend.feed.PushMobilityFeed;
import com.ivirs.backend.model.EntitySnapshot;
import com.ivirs.backend.model.Position;
import com.ivirs.backend.model.VehicleRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accepts snapshots from an external mobility simulator when the feed runs in push mode.
 */
@Slf4j
@RestController
@RequestMapping("/api/feed")
@CrossOrigin(origins = "*")
public class FeedController {

    private final MobilityFeed feed;

    public FeedController(MobilityFeed feed) {
        this.feed = feed;
    }

    @PostMapping("/snapshots")
    public ResponseEntity<Map<String, Object>> pushSnapshot(@RequestBody SnapshotRequest request) {
        if (!(feed instanceof PushMobilityFeed)) {
            return error(HttpStatus.CONFLICT, "Feed is not in push mode");
        }
        PushMobilityFeed pushFeed = (PushMobilityFeed) feed;
        if (request == null || request.getTime() == null || !Double.isFinite(request.getTime())) {
            return error(HttpStatus.BAD_REQUEST, "Snapshot time is required");
        }

        List<VehicleRecord> vehicles = new ArrayList<>();
        if (request.getVehicles() != null) {
            for (VehicleEntry entry : request.getVehicles()) {
                if (entry == null || entry.getId() == null || entry.getId().isBlank()) {
                    return error(HttpStatus.BAD_REQUEST, "Every vehicle needs an id");
                }
                if (entry.getX() == null || entry.getY() == null) {
                    return error(HttpStatus.BAD_REQUEST, "Vehicle " + entry.getId() + " has no position");
                }
                vehicles.add(new VehicleRecord(entry.getId(), new Position(entry.getX(), entry.getY()), stringify(entry.getAttributes())));
            }
        }

        if (!pushFeed.offer(new EntitySnapshot(request.getTime(), vehicles))) {
            String reason = pushFeed.isEnded() ? "Feed already ended" : "Snapshot queue is full";
            log.warn("Rejected snapshot t={}: {}", request.getTime(), reason);
            return error(HttpStatus.SERVICE_UNAVAILABLE, reason);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("accepted", true);
        response.put("queued", pushFeed.queued());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @PostMapping("/end")
    public ResponseEntity<Map<String, Object>> endFeed() {
        if (!(feed instanceof PushMobilityFeed)) {
            return error(HttpStatus.CONFLICT, "Feed is not in push mode");
        }
        PushMobilityFeed pushFeed = (PushMobilityFeed) feed;
        pushFeed.end();
        log.info("Push feed ended by client, {} snapshots still queued", pushFeed.queued());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ended", true);
        response.put("queued", pushFeed.queued());
        return ResponseEntity.ok(response);
    }

    private static Map<String, String> stringify(Map<String, Object> attributes) {
        Map<String, String> result = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((key, value) -> {
                if (key != null && value != null) {
                    result.put(key, String.valueOf(value));
                }
            });
        }
        return result;
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SnapshotRequest {
        private Double time;
        private List<VehicleEntry> vehicles;
    }

    /** Attribute values may be JSON strings, numbers or booleans. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VehicleEntry {
        private String id;
        private Double x;
        private Double y;
        private Map<String, Object> attributes;
    }
}
