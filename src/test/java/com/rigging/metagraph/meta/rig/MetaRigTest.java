package com.rigging.metagraph.meta.rig;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.rigging.metagraph.MetaGraph;
import com.rigging.metagraph.MetaGraphConfig;
import com.rigging.metagraph.meta.MetaFactory;
import com.rigging.metagraph.meta.MetaNode;
import com.rigging.metagraph.nodes.Nodes;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Scene;

public class MetaRigTest {
    private Scene scene;
    private MetaFactory factory;
    private MetaRig rig;

    @Before
    public void setUp() {
        scene = new Scene();
        factory = new MetaGraph(scene, MetaGraphConfig.defaults()).factory();
        rig = factory.create(MetaRig.class, "hero");
    }

    private NodeHandle transform(String name) {
        return Nodes.createDagNode(scene, name, "transform", null);
    }

    @Test
    public void testRigAttributes() {
        assertEquals("MetaRig", rig.typeTag());
        assertEquals("1.0.0", rig.rigVersion());
        assertEquals("", rig.rigName());
        rig.setRigName("hero");
        assertEquals("hero", rig.rigName());
    }

    @Test
    public void testControls() {
        NodeHandle left = transform("hand_L_ctrl");
        NodeHandle right = transform("hand_R_ctrl");
        rig.addControl(left, "hand_L");
        rig.addControl(right, "hand_R");
        assertEquals(List.of(left, right), rig.controls(false));
        assertEquals(left, rig.control("hand_L", false).orElseThrow());
        assertFalse(rig.control("foot_L", false).isPresent());
        assertTrue(rig.hasAttribute("CTRL_hand_L"));
    }

    @Test
    public void testControlSlotIsReplaced() {
        NodeHandle first = transform("hand_L_ctrl");
        NodeHandle second = transform("hand_L_ctrl_v2");
        rig.addControl(first, "hand_L");
        rig.addControl(second, "hand_L");
        assertEquals(List.of(second), rig.controls(false));
        assertFalse(Nodes.hasAttribute(first, "metaNode"));
    }

    @Test
    public void testJointsAndSkinJoints() {
        NodeHandle spine = transform("spine_jnt");
        NodeHandle spineSkin = transform("spine_skin");
        rig.addJoint(spine, "spine");
        rig.addSkinJoint(spineSkin, "spine");
        assertEquals(List.of(spine), rig.joints(false));
        assertEquals(List.of(spineSkin), rig.skinJoints(false));
    }

    @Test
    public void testGeoExcludesProxies() {
        NodeHandle body = transform("body_geo");
        NodeHandle proxy = transform("body_proxy");
        NodeHandle root = transform("hero_root");
        rig.addGeo(body, "body");
        rig.addProxyGeo(proxy, "body");
        rig.addRootNode(root, "root");
        assertEquals(List.of(body), rig.geo(false));
        assertEquals(List.of(proxy), rig.proxyGeo(false));
        assertEquals(List.of(root), rig.rootNodes(false));
    }

    @Test
    public void testSubSystems() {
        MetaSubSystem arm = rig.addSubSystem("arm_L");
        arm.setRigName("arm_L");
        MetaSubSystem leg = rig.addSubSystem("leg_L");
        leg.setRigName("leg_L");

        assertEquals(List.of(arm, leg), rig.subSystems());
        assertEquals(arm, rig.filterSubSystemByName("arm_L").orElseThrow());
        assertTrue(rig.hasSubSystemByName("leg_L"));
        assertFalse(rig.hasSubSystemByName("spine"));
        assertTrue(arm.isSubSystem());
        assertFalse(arm.isSupportSystem());
        assertEquals(List.of(rig), arm.metaParents(false));

        rig.addSubSystem(arm);
        assertEquals("Linking twice keeps one edge", 2, rig.subSystems().size());
    }

    @Test
    public void testSupportSystems() {
        MetaSupportSystem space = rig.addSupportSystem("spaceSwitch");
        space.setRigName("spaceSwitch");
        assertEquals(List.of(space), rig.supportSystems());
        assertTrue(rig.hasSupportSystemByName("spaceSwitch"));
        assertTrue(space.isSupportSystem());
        assertTrue(rig.subSystems().isEmpty());
    }

    @Test
    public void testRecursiveQueriesReachSystems() {
        NodeHandle hand = transform("hand_L_ctrl");
        NodeHandle elbow = transform("elbow_L_ctrl");
        rig.addControl(hand, "hand_L");
        MetaSubSystem arm = rig.addSubSystem("arm_L");
        arm.addControl(elbow, "elbow_L");

        assertEquals(List.of(hand), rig.controls(false));
        assertEquals(List.of(hand, elbow), rig.controls(true));
        assertEquals(elbow, rig.control("elbow_L", true).orElseThrow());
    }

    @Test
    public void testRecursiveQueriesReachMetaChildren() {
        MetaFaceRig face = factory.create(MetaFaceRig.class, "face");
        rig.addChild(face);
        NodeHandle jaw = transform("jaw_ctrl");
        face.addControl(jaw, "jaw");
        assertEquals(List.of(jaw), rig.controls(true));
        assertTrue(rig.controls(false).isEmpty());
    }

    @Test
    public void testRehydratedTypes() {
        MetaSubSystem arm = rig.addSubSystem("arm_L");
        MetaNode wrapped = factory.wrap(arm.handle());
        assertTrue(wrapped instanceof MetaSubSystem);
        assertTrue(factory.wrap(rig.handle(), MetaNode.class) instanceof MetaRig);
    }
}
