package com.ivirs.backend.controller;

import com.ivirs.backend.model.RoadsideNode;
import com.ivirs.backend.service.IncidentPipeline;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@CrossOrigin(origins = "*")
public class NodeController {

    private final IncidentPipeline pipeline;

    public NodeController(IncidentPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @GetMapping("/api/nodes")
    public List<NodeView> getNodes() {
        return pipeline.getNodes().stream().map(NodeView::of).collect(Collectors.toList());
    }

    @Data
    @AllArgsConstructor
    public static class NodeView {
        private int id;
        private double x;
        private double y;
        private double radius;
        private int pendingReports;
        private int vehiclesInRange;

        static NodeView of(RoadsideNode node) {
            return new NodeView(node.getId(), node.getPosition().getX(), node.getPosition().getY(),
                    node.getCoverageRadius(), node.pendingCount(), node.getVehiclesInRange().size());
        }
    }
}
