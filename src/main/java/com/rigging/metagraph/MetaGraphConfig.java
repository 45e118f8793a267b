package com.rigging.metagraph;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rigging.metagraph.meta.CyclePolicy;
import com.rigging.metagraph.meta.MetaRegistry;
import com.rigging.metagraph.meta.ParentPolicy;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Settings of a meta graph, read from {@code metagraph.json} on the classpath
 * and then overridden by {@code METAGRAPH_*} environment variables.
 *
 * <pre>
 * {
 *   "parentPolicy": "SINGLE",
 *   "cyclePolicy": "REJECT",
 *   "defaultDepthLimit": 256,
 *   "peerAttributeName": "metaNode",
 *   "metaVersion": "1.0.0",
 *   "metaSearchPaths": [],
 *   "lockMetaNodes": false
 * }
 * </pre>
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetaGraphConfig {
    public static final String RESOURCE = "metagraph.json";

    public static final String PARENT_POLICY_ENV = "METAGRAPH_PARENT_POLICY";
    public static final String CYCLE_POLICY_ENV = "METAGRAPH_CYCLE_POLICY";
    public static final String DEPTH_LIMIT_ENV = "METAGRAPH_DEPTH_LIMIT";
    public static final String PEER_ATTRIBUTE_ENV = "METAGRAPH_PEER_ATTRIBUTE";
    public static final String LOCK_META_NODES_ENV = "METAGRAPH_LOCK_META_NODES";

    private ParentPolicy parentPolicy = ParentPolicy.SINGLE;
    private CyclePolicy cyclePolicy = CyclePolicy.REJECT;
    private int defaultDepthLimit = 256;
    private String peerAttributeName = "metaNode";
    private String metaVersion = "1.0.0";
    private List<String> metaSearchPaths = new ArrayList<>();
    private boolean lockMetaNodes;

    /** Built-in defaults, no file or environment involved. */
    public static MetaGraphConfig defaults() {
        return new MetaGraphConfig();
    }

    /** Classpath {@value #RESOURCE} (defaults when absent) with process environment overrides. */
    public static MetaGraphConfig load() {
        try (InputStream in = MetaGraphConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            return load(in, System.getenv());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * @param in  JSON settings, or null for the defaults.
     * @param env environment variables to apply on top.
     */
    public static MetaGraphConfig load(InputStream in, Map<String, String> env) {
        MetaGraphConfig config;
        if (in == null) {
            log.debug("No {} found, using defaults", RESOURCE);
            config = defaults();
        } else {
            try {
                config = new ObjectMapper().readValue(in, MetaGraphConfig.class);
            } catch (IOException e) {
                throw new IllegalArgumentException("Invalid meta graph configuration", e);
            }
        }
        config.applyOverrides(env);
        config.validate();
        return config;
    }

    void applyOverrides(Map<String, String> env) {
        String value = env.get(PARENT_POLICY_ENV);
        if (value != null && !value.isBlank())
            parentPolicy = ParentPolicy.valueOf(value.trim().toUpperCase());
        value = env.get(CYCLE_POLICY_ENV);
        if (value != null && !value.isBlank())
            cyclePolicy = CyclePolicy.valueOf(value.trim().toUpperCase());
        value = env.get(DEPTH_LIMIT_ENV);
        if (value != null && !value.isBlank()) {
            try {
                defaultDepthLimit = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(DEPTH_LIMIT_ENV + " is not an integer: " + value, e);
            }
        }
        value = env.get(PEER_ATTRIBUTE_ENV);
        if (value != null && !value.isBlank())
            peerAttributeName = value.trim();
        value = env.get(LOCK_META_NODES_ENV);
        if (value != null && !value.isBlank())
            lockMetaNodes = Boolean.parseBoolean(value.trim());
        value = env.get(MetaRegistry.META_PATHS_ENV);
        if (value != null && !value.isBlank()) {
            List<String> paths = new ArrayList<>(metaSearchPaths);
            MetaRegistry.splitSearchPath(value).forEach(p -> paths.add(p.toString()));
            metaSearchPaths = paths;
        }
    }

    private void validate() {
        if (parentPolicy == null || cyclePolicy == null)
            throw new IllegalArgumentException("parentPolicy and cyclePolicy are required");
        if (peerAttributeName == null || peerAttributeName.isBlank())
            throw new IllegalArgumentException("peerAttributeName must not be blank");
        if (metaSearchPaths == null)
            metaSearchPaths = new ArrayList<>();
    }
}
