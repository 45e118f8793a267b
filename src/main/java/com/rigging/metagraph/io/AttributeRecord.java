package com.rigging.metagraph.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rigging.metagraph.attr.AttributeKind;

import lombok.Data;

/**
 * Serialized form of one attribute.
 *
 * {@code value} holds the plain value: a JSON scalar, a list of numbers for
 * tuples and matrices, one entry per element for arrays (aligned with
 * {@code indices}) and one entry per child for compounds. Message attributes
 * carry no value.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AttributeRecord {
    private String name;
    private AttributeKind type;
    private Object value;
    @JsonProperty("isDynamic")
    private boolean dynamic;
    private Boolean array;
    private List<Integer> indices;
    private List<AttributeRecord> children;
    @JsonProperty("default")
    private Object defaultValue;
    private Double min, max, softMin, softMax;
    private List<String> enums;
    private boolean keyable, channelBox, locked;
}
