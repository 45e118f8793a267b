package com.rigging.metagraph.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/** Serialized form of one scene node. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class NodeRecord {
    private String name, type, parent;
    private List<String> requirements = new ArrayList<>();
    private List<AttributeRecord> attributes = new ArrayList<>();
    private List<ConnectionRecord> connections = new ArrayList<>();
}
