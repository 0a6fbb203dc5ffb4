package com.ivirs.backend.model.xml;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

@Data
public class NodeDefinition {
    @JacksonXmlProperty(isAttribute = true)
    private Integer id;

    @JacksonXmlProperty(isAttribute = true)
    private double x;

    @JacksonXmlProperty(isAttribute = true)
    private double y;

    // falls back to ivirs.coverage.default-radius when absent
    @JacksonXmlProperty(isAttribute = true)
    private Double radius;
}
