package com.ivirs.backend.model.xml;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Data;

import java.util.List;

@Data
@JacksonXmlRootElement(localName = "layout")
public class RoadsideLayout {

    @JacksonXmlProperty(isAttribute = true)
    private String description;

    @JacksonXmlElementWrapper(localName = "nodes")
    @JacksonXmlProperty(localName = "node")
    private List<NodeDefinition> nodes;
}
