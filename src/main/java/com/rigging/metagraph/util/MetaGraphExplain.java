package com.rigging.metagraph.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.rigging.metagraph.meta.MetaFactory;
import com.rigging.metagraph.meta.MetaNode;
import com.rigging.metagraph.meta.MetaQueries;
import com.rigging.metagraph.scene.Connection;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;

/**
 * Diagnostic views of the meta graph: a per-node summary, an indented tree and
 * a Mermaid diagram.
 *
 * <p>
 * Intended for debugging sessions and logs. Everything here allocates strings
 * and walks the whole scene, so keep it out of tight loops.
 */
public final class MetaGraphExplain {
    private final MetaFactory factory;

    public MetaGraphExplain(MetaFactory factory) {
        this.factory = factory;
    }

    /** Dumps the attributes and connections of a single meta node. */
    public String explainNode(MetaNode meta) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Meta node: ").append(meta.fullPathName()).append('\n')
                .append("  Type: ").append(meta.typeTag()).append('\n')
                .append("  Version: ").append(meta.version()).append('\n')
                .append("  Locked: ").append(meta.isLocked()).append('\n');
        List<MetaNode> parents = meta.metaParents(false);
        sb.append("  Parents (").append(parents.size()).append("): ").append(names(parents)).append('\n');
        List<MetaNode> children = meta.metaChildren();
        sb.append("  Children (").append(children.size()).append("): ").append(names(children)).append('\n');
        sb.append("  Relations:\n");
        for (Connection c : meta.iterConnections(true, false)) {
            if (c.source().name().equals(MetaNode.CHILDREN_ATTR))
                continue;
            sb.append("    ").append(c.source().path()).append(" -> ").append(c.destination().info()).append('\n');
        }
        return sb.toString();
    }

    /** Indented tree of the meta hierarchy below each scene root. */
    public String dumpTree() {
        StringBuilder sb = new StringBuilder(1024);
        List<MetaNode> roots = MetaQueries.findSceneRoots(factory);
        sb.append("Meta graph (").append(roots.size()).append(" roots):\n");
        for (MetaNode root : roots)
            appendTree(sb, root, 1, new HashSet<>());
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, MetaNode meta, int depth, Set<MetaNode> path) {
        sb.append("  ".repeat(depth)).append(meta.name()).append(" (").append(meta.typeTag()).append(')');
        if (!path.add(meta)) {
            sb.append(" [cycle]\n");
            return;
        }
        sb.append('\n');
        if (depth <= factory.config().getDefaultDepthLimit()) {
            for (MetaNode child : meta.metaChildren())
                appendTree(sb, child, depth + 1, path);
        }
        path.remove(meta);
    }

    /**
     * Generates a Mermaid graph of every meta node, the parent/child edges
     * between them and their named relations to other scene nodes.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        List<MetaNode> metas = MetaQueries.iterSceneMetaNodes(factory);
        Set<NodeHandle> declared = new LinkedHashSet<>();

        // Meta nodes first, then the plain nodes they reference
        for (MetaNode meta : metas) {
            declared.add(meta.handle());
            sb.append("  ").append(sanitize(meta.name())).append("[\"").append(meta.name()).append("<br/><i>")
                    .append(meta.typeTag()).append("</i>\"];\n");
        }
        List<String> edges = new ArrayList<>();
        for (MetaNode meta : metas) {
            for (Connection c : meta.iterConnections(true, false)) {
                NodeHandle target = c.destination().node();
                if (declared.add(target))
                    sb.append("  ").append(sanitize(target.name())).append("(\"").append(target.name())
                            .append("\");\n");
                edges.add(edge(meta.handle(), c.source(), target));
            }
        }
        edges.forEach(sb::append);
        return sb.toString();
    }

    private static String edge(NodeHandle from, Plug source, NodeHandle to) {
        String arrow = source.name().equals(MetaNode.CHILDREN_ATTR) ? " --> "
                : " -. \"" + source.path() + "\" .-> ";
        return "  " + sanitize(from.name()) + arrow + sanitize(to.name()) + ";\n";
    }

    private static String names(Collection<MetaNode> metas) {
        List<String> out = new ArrayList<>();
        for (MetaNode m : metas)
            out.add(m.name());
        return String.join(", ", out);
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
