package com.ivirs.backend.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.ivirs.backend.config.IvirsProperties;
import com.ivirs.backend.model.Position;
import com.ivirs.backend.model.RoadsideNode;
import com.ivirs.backend.model.xml.NodeDefinition;
import com.ivirs.backend.model.xml.RoadsideLayout;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the roadside node layout from an XML classpath resource at startup.
 */
@Slf4j
@Service
public class RoadsideLayoutService {

    private final List<RoadsideNode> nodes;

    public RoadsideLayoutService(IvirsProperties properties) {
        this.nodes = load(properties.getCoverage().getLayoutResource(), properties.getCoverage().getDefaultRadius());
    }

    public List<RoadsideNode> nodes() {
        return nodes;
    }

    static List<RoadsideNode> load(String resource, double defaultRadius) {
        XmlMapper xmlMapper = new XmlMapper();
        xmlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        RoadsideLayout layout;
        try (InputStream inputStream = new ClassPathResource(resource).getInputStream()) {
            layout = xmlMapper.readValue(inputStream, RoadsideLayout.class);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read roadside layout '" + resource + "'", e);
        }

        List<RoadsideNode> nodes = toNodes(layout, defaultRadius);
        log.info("Roadside layout '{}' loaded: {} nodes", resource, nodes.size());
        return nodes;
    }

    static List<RoadsideNode> toNodes(RoadsideLayout layout, double defaultRadius) {
        if (layout == null || layout.getNodes() == null || layout.getNodes().isEmpty()) {
            throw new IllegalStateException("Roadside layout defines no nodes");
        }
        List<RoadsideNode> nodes = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (NodeDefinition definition : layout.getNodes()) {
            if (definition.getId() == null) {
                throw new IllegalStateException("Roadside node without id in layout");
            }
            if (!seen.add(definition.getId())) {
                throw new IllegalStateException("Duplicate roadside node id " + definition.getId());
            }
            double radius = definition.getRadius() != null ? definition.getRadius() : defaultRadius;
            try {
                nodes.add(new RoadsideNode(definition.getId(), new Position(definition.getX(), definition.getY()), radius));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid roadside node " + definition.getId(), e);
            }
        }
        nodes.sort(Comparator.comparingInt(RoadsideNode::getId));
        return List.copyOf(nodes);
    }
}
