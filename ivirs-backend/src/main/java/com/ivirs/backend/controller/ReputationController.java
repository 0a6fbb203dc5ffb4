package com.ivirs.backend.controller;

import com.ivirs.backend.service.ReputationStore;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/reputation")
@CrossOrigin(origins = "*")
public class ReputationController {

    private final ReputationStore reputationStore;

    public ReputationController(ReputationStore reputationStore) {
        this.reputationStore = reputationStore;
    }

    @GetMapping
    public Map<String, Double> getAll() {
        return reputationStore.snapshot();
    }

    // Unknown vehicles report the default score without being added to the store
    @GetMapping("/{vehicleId}")
    public Map<String, Object> getOne(@PathVariable String vehicleId) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("vehicleId", vehicleId);
        response.put("reputation", reputationStore.peek(vehicleId));
        return response;
    }
}
