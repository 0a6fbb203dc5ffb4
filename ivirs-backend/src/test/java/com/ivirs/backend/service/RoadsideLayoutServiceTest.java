package com.ivirs.backend.service;

import com.ivirs.backend.model.RoadsideNode;
import com.ivirs.backend.model.xml.NodeDefinition;
import com.ivirs.backend.model.xml.RoadsideLayout;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RoadsideLayoutServiceTest {

    private static NodeDefinition definition(Integer id, double x, Double radius) {
        NodeDefinition definition = new NodeDefinition();
        definition.setId(id);
        definition.setX(x);
        definition.setRadius(radius);
        return definition;
    }

    private static RoadsideLayout layout(NodeDefinition... definitions) {
        RoadsideLayout layout = new RoadsideLayout();
        layout.setNodes(new ArrayList<>(List.of(definitions)));
        return layout;
    }

    @Test
    void defaultLayoutCoversTheHighway() {
        List<RoadsideNode> nodes = RoadsideLayoutService.load("roadside-layout.xml", 500);

        assertEquals(6, nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            RoadsideNode node = nodes.get(i);
            assertEquals(i, node.getId());
            assertEquals(i * 2000.0, node.getPosition().getX());
            assertEquals(-50.0, node.getPosition().getY());
            assertEquals(500.0, node.getCoverageRadius());
        }
    }

    @Test
    void missingRadiusFallsBackToDefaultAndNodesAreSorted() {
        List<RoadsideNode> nodes = RoadsideLayoutService.load("roadside-layout-test.xml", 250);

        assertEquals(List.of(3, 7), nodes.stream().map(RoadsideNode::getId).collect(Collectors.toList()));
        assertEquals(100.0, nodes.get(0).getCoverageRadius());
        assertEquals(250.0, nodes.get(1).getCoverageRadius());
    }

    @Test
    void missingResourceFailsStartup() {
        assertThrows(IllegalStateException.class, () -> RoadsideLayoutService.load("no-such-layout.xml", 500));
    }

    @Test
    void invalidLayoutsAreRejected() {
        assertThrows(IllegalStateException.class, () -> RoadsideLayoutService.toNodes(layout(), 500));
        assertThrows(IllegalStateException.class, () -> RoadsideLayoutService.toNodes(
                layout(definition(1, 0, null), definition(1, 100, null)), 500));
        assertThrows(IllegalStateException.class, () -> RoadsideLayoutService.toNodes(
                layout(definition(null, 0, null)), 500));
        assertThrows(IllegalStateException.class, () -> RoadsideLayoutService.toNodes(
                layout(definition(2, 0, 0.0)), 500));
    }
}
