package com.rigging.metagraph.meta.rig;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.rigging.metagraph.attr.AttributeKind;
import com.rigging.metagraph.attr.AttributeSpec;
import com.rigging.metagraph.meta.MetaBase;
import com.rigging.metagraph.meta.MetaFactory;
import com.rigging.metagraph.meta.MetaNode;
import com.rigging.metagraph.nodes.Nodes;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;

/**
 * Meta node describing a character rig.
 *
 * Scene nodes owned by the rig hang off message attributes named
 * {@code <PREFIX>_<name>}, for example {@code CTRL_hand_L}, each feeding the
 * owned node's peer attribute. Sub systems and support systems are meta nodes
 * fed by the {@code subSystem} and {@code supportSystem} attributes through
 * their {@code mMetaParent} array.
 */
public class MetaRig extends MetaBase {
    public static final String CTRL_PREFIX = "CTRL";
    public static final String JNT_PREFIX = "JNT";
    public static final String SKIN_PREFIX = "SKIN";
    public static final String GEO_PREFIX = "GEO";
    public static final String GEO_PROXY_PREFIX = "GEO_PROXY";
    public static final String ROOT_PREFIX = "ROOT";

    public static final String RIG_NAME_ATTR = "name";
    public static final String RIG_VERSION_ATTR = "rigVersion";
    public static final String SUB_SYSTEM_ATTR = "subSystem";
    public static final String SUPPORT_SYSTEM_ATTR = "supportSystem";

    public MetaRig(MetaFactory factory) {
        super(factory);
    }

    @Override
    protected List<MetaAttribute> metaAttributes() {
        List<MetaAttribute> out = super.metaAttributes();
        out.add(new MetaAttribute(AttributeSpec.of(RIG_VERSION_ATTR, AttributeKind.STRING), "1.0.0", false));
        out.add(new MetaAttribute(AttributeSpec.of(RIG_NAME_ATTR, AttributeKind.STRING), "", false));
        return out;
    }

    public String rigName() {
        return (String) getValue(RIG_NAME_ATTR).orElse("");
    }

    public void setRigName(String name) {
        setAttribute(RIG_NAME_ATTR, name);
    }

    public String rigVersion() {
        return (String) getValue(RIG_VERSION_ATTR).orElse("");
    }

    // ── Owned scene nodes ───────────────────────────────────────────

    public Plug addRootNode(NodeHandle node, String name) {
        return connectTo(relation(ROOT_PREFIX, name), node);
    }

    public Plug addControl(NodeHandle node, String name) {
        return connectTo(relation(CTRL_PREFIX, name), node);
    }

    public Plug addJoint(NodeHandle node, String name) {
        return connectTo(relation(JNT_PREFIX, name), node);
    }

    public Plug addSkinJoint(NodeHandle node, String name) {
        return connectTo(relation(SKIN_PREFIX, name), node);
    }

    public Plug addGeo(NodeHandle node, String name) {
        return connectTo(relation(GEO_PREFIX, name), node);
    }

    public Plug addProxyGeo(NodeHandle node, String name) {
        return connectTo(relation(GEO_PROXY_PREFIX, name), node);
    }

    /** The control registered under {@code name}, looked up in sub systems too when recursive. */
    public Optional<NodeHandle> control(String name, boolean recursive) {
        List<NodeHandle> found = owned("^" + relation(CTRL_PREFIX, name) + "$",
                recursive);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public List<NodeHandle> rootNodes(boolean recursive) {
        return owned(prefixPattern(ROOT_PREFIX), recursive);
    }

    public List<NodeHandle> controls(boolean recursive) {
        return owned(prefixPattern(CTRL_PREFIX), recursive);
    }

    public List<NodeHandle> joints(boolean recursive) {
        return owned(prefixPattern(JNT_PREFIX), recursive);
    }

    public List<NodeHandle> skinJoints(boolean recursive) {
        return owned(prefixPattern(SKIN_PREFIX), recursive);
    }

    public List<NodeHandle> geo(boolean recursive) {
        return owned("^" + GEO_PREFIX + "_(?!PROXY_)", recursive);
    }

    public List<NodeHandle> proxyGeo(boolean recursive) {
        return owned(prefixPattern(GEO_PROXY_PREFIX), recursive);
    }

    /**
     * Nodes fed by the matching relations of this rig and, when recursive, of its
     * meta children and of every sub and support system below it.
     */
    public List<NodeHandle> owned(String regex, boolean recursive) {
        Set<NodeHandle> out = new LinkedHashSet<>();
        collectOwned(regex, recursive, out, new HashSet<>());
        return new ArrayList<>(out);
    }

    private void collectOwned(String regex, boolean recursive, Set<NodeHandle> out, Set<MetaRig> visited) {
        if (!visited.add(this))
            return;
        out.addAll(findConnectedNodesByAttributeName(regex, recursive));
        if (!recursive)
            return;
        for (MetaRig system : subSystems())
            system.collectOwned(regex, true, out, visited);
        for (MetaRig system : supportSystems())
            system.collectOwned(regex, true, out, visited);
    }

    static String relation(String prefix, String name) {
        return prefix + "_" + name;
    }

    private static String prefixPattern(String prefix) {
        return "^" + prefix + "_";
    }

    // ── Systems ─────────────────────────────────────────────────────

    /** Creates a sub system named {@code <name>_meta} and links it under this rig. */
    public MetaSubSystem addSubSystem(String name) {
        MetaSubSystem system = factory().create(MetaSubSystem.class, name);
        addSubSystem(system);
        return system;
    }

    public MetaSubSystem addSubSystem(MetaSubSystem system) {
        linkSystem(SUB_SYSTEM_ATTR, system);
        return system;
    }

    public MetaSupportSystem addSupportSystem(String name) {
        MetaSupportSystem system = factory().create(MetaSupportSystem.class, name);
        addSupportSystem(system);
        return system;
    }

    public MetaSupportSystem addSupportSystem(MetaSupportSystem system) {
        linkSystem(SUPPORT_SYSTEM_ATTR, system);
        return system;
    }

    // A rig may own many systems, so the relation attribute feeds several mMetaParent elements.
    private void linkSystem(String relation, MetaRig system) {
        if (systems(relation, MetaRig.class).contains(system))
            return;
        NodeHandle node = handle();
        Plug source = attribute(relation).orElseGet(
                () -> callUnlocked(() -> Nodes.addAttribute(node, relation, AttributeKind.MESSAGE, false)));
        connectToByPlug(source, system.handle(), MetaNode.PARENT_ATTR);
    }

    public List<MetaSubSystem> subSystems() {
        return systems(SUB_SYSTEM_ATTR, MetaSubSystem.class);
    }

    public List<MetaSupportSystem> supportSystems() {
        return systems(SUPPORT_SYSTEM_ATTR, MetaSupportSystem.class);
    }

    private <T extends MetaRig> List<T> systems(String relation, Class<T> type) {
        List<T> out = new ArrayList<>();
        Optional<Plug> plug = attribute(relation);
        if (plug.isEmpty())
            return out;
        for (Plug destination : plug.get().destinations()) {
            if (factory().isMetaNode(destination.node()))
                factory().tryWrap(destination.node()).filter(type::isInstance).map(type::cast).ifPresent(out::add);
        }
        return out;
    }

    /** First sub system whose rig name is {@code name}. */
    public Optional<MetaSubSystem> filterSubSystemByName(String name) {
        return subSystems().stream().filter(s -> s.rigName().equals(name)).findFirst();
    }

    public Optional<MetaSupportSystem> filterSupportSystemByName(String name) {
        return supportSystems().stream().filter(s -> s.rigName().equals(name)).findFirst();
    }

    public boolean hasSubSystemByName(String name) {
        return filterSubSystemByName(name).isPresent();
    }

    public boolean hasSupportSystemByName(String name) {
        return filterSupportSystemByName(name).isPresent();
    }

    public boolean isSubSystem() {
        return this instanceof MetaSubSystem;
    }

    public boolean isSupportSystem() {
        return this instanceof MetaSupportSystem;
    }
}
