package com.rigging.metagraph;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.rigging.metagraph.meta.MetaNode;
import com.rigging.metagraph.meta.MetaScene;
import com.rigging.metagraph.meta.rig.MetaRig;
import com.rigging.metagraph.nodes.Nodes;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Scene;

public class MetaGraphTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private MetaGraph graph;

    @Before
    public void setUp() {
        graph = new MetaGraph(new Scene(), MetaGraphConfig.defaults());
    }

    @Test
    public void testCreateAndFind() {
        MetaRig rig = graph.create(MetaRig.class, "hero");
        assertEquals(rig, graph.find("hero_meta").get());
        assertTrue(graph.find("missing").isEmpty());

        Nodes.createDgNode(graph.scene(), "plain", "network");
        assertTrue(graph.find("plain").isEmpty());
        assertEquals(List.of(rig), graph.sceneMetaNodes());
        assertEquals(List.of(rig), graph.sceneRoots());
    }

    @Test
    public void testSaveAndLoad() throws IOException {
        MetaScene shot = graph.create(MetaScene.class, "shot010");
        MetaRig rig = graph.create(MetaRig.class, "hero");
        rig.setRigName("hero");
        shot.addChild(rig);
        NodeHandle ctrl = Nodes.createDagNode(graph.scene(), "hand_L_ctrl", "transform", null);
        rig.addControl(ctrl, "hand_L");

        Path file = folder.getRoot().toPath().resolve("hero.json");
        graph.save(file);
        assertTrue(Files.size(file) > 0);

        MetaGraph reloaded = new MetaGraph(new Scene(), MetaGraphConfig.defaults());
        List<MetaNode> metas = reloaded.load(file);
        assertEquals(2, metas.size());
        assertTrue(metas.get(0) instanceof MetaScene);
        assertTrue(metas.get(1) instanceof MetaRig);

        MetaRig hero = (MetaRig) reloaded.find("hero_meta").get();
        assertEquals("hero", hero.rigName());
        assertEquals(List.of(reloaded.scene().findNode("hand_L_ctrl").get()), hero.controls(false));
        assertEquals(metas.get(0), hero.metaParent().get());
        assertEquals(List.of(metas.get(0)), reloaded.sceneRoots());
    }

    @Test
    public void testWrapByType() {
        MetaRig rig = graph.create(MetaRig.class, "hero");
        MetaRig wrapped = graph.wrap(rig.handle(), MetaRig.class);
        assertEquals(rig, wrapped);
        assertEquals("MetaRig", graph.wrap(rig.handle()).typeTag());
    }
}
