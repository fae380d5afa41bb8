package cn.hjw.dev.dispatcher.config;

import cn.hjw.dev.dispatcher.compile.CapabilityGraph;
import cn.hjw.dev.dispatcher.engine.Dispatcher;
import cn.hjw.dev.dispatcher.exception.DuplicateNodeIdException;
import cn.hjw.dev.dispatcher.exception.MalformedGraphException;
import cn.hjw.dev.dispatcher.exception.UnknownNodeException;
import cn.hjw.dev.dispatcher.node.DataNode;
import cn.hjw.dev.dispatcher.node.SpecialNodes;
import cn.hjw.dev.dispatcher.processor.NodeFunction;
import cn.hjw.dev.dispatcher.processor.NodeFunctions;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

/**
 * 节点注册表测试
 * 验证：注册校验、ID 派生、批量注册与编译出的邻接关系
 */
@Slf4j
public class GraphConfigTest {

    private static final NodeFunction IDENTITY = NodeFunctions.bypass();

    /**
     * 场景 1: 数据节点与函数节点共享命名空间，显式 ID 重复直接报错
     */
    @Test
    public void testDuplicateIds() {
        GraphConfig config = new GraphConfig();
        config.addData("a");
        config.addData("b");

        Assertions.assertThrows(DuplicateNodeIdException.class, () -> config.addData("a"));
        config.addFunction("f", IDENTITY, List.of("a"), List.of("b"));
        DuplicateNodeIdException e = Assertions.assertThrows(DuplicateNodeIdException.class,
                () -> config.addFunction("f", IDENTITY, List.of("a"), List.of("b")));
        Assertions.assertEquals("f", e.getNodeId());
        Assertions.assertThrows(DuplicateNodeIdException.class, () -> config.addData("f"));
        Assertions.assertThrows(DuplicateNodeIdException.class, () -> config.addData(SpecialNodes.START));
    }

    /**
     * 场景 2: 未显式指定 ID 时由函数名派生，重名追加 <n>
     */
    @Test
    public void testDerivedFunctionIds() {
        GraphConfig config = new GraphConfig();
        config.addData("a");
        config.addData("b");
        config.addData("c");

        Assertions.assertEquals("bypass", config.addFunction(null, IDENTITY, List.of("a"), List.of("b")));
        Assertions.assertEquals("bypass<0>", config.addFunction(null, IDENTITY, List.of("b"), List.of("c")));
        Assertions.assertEquals("bypass<1>", config.addFunction(null, IDENTITY, List.of("a"), List.of("c")));
        Assertions.assertEquals(List.of("bypass", "bypass<0>", "bypass<1>"), List.copyOf(config.getFunctionNodes().keySet()));
        Assertions.assertEquals(2, config.getFunctionNodes().get("bypass<1>").getOrder());
    }

    /**
     * 场景 3: 引用未注册的数据节点
     */
    @Test
    public void testUnknownNode() {
        GraphConfig config = new GraphConfig();
        config.addData("a");

        UnknownNodeException e = Assertions.assertThrows(UnknownNodeException.class,
                () -> config.addFunction("f", IDENTITY, List.of("a"), List.of("missing")));
        Assertions.assertEquals("missing", e.getNodeId());
        Assertions.assertThrows(UnknownNodeException.class,
                () -> config.addFunction("g", IDENTITY, List.of("nope"), List.of("a")));
        Assertions.assertThrows(UnknownNodeException.class, () -> config.setDefaultValue("nope", 1));
        Assertions.assertTrue(config.getFunctionNodes().isEmpty(), "失败的注册不应留下任何节点");
    }

    /**
     * 场景 4: 非法注册
     */
    @Test
    public void testMalformedRegistrations() {
        GraphConfig config = new GraphConfig();
        config.addData("a");
        config.addData("b");

        Assertions.assertThrows(MalformedGraphException.class,
                () -> config.addFunction("noOut", IDENTITY, List.of("a"), List.of()));
        Assertions.assertThrows(MalformedGraphException.class,
                () -> config.addFunction("negative", IDENTITY, List.of("a"), List.of("b"), -1));
        Assertions.assertThrows(MalformedGraphException.class,
                () -> config.addFunction("nan", IDENTITY, List.of("a"), List.of("b"), Double.NaN));
        Assertions.assertThrows(MalformedGraphException.class,
                () -> config.addFunction("noCallable", null, List.of("a"), List.of("b")));
        Assertions.assertThrows(MalformedGraphException.class,
                () -> config.addFunction("toStart", IDENTITY, List.of("a"), List.of(SpecialNodes.START)));
        Assertions.assertThrows(MalformedGraphException.class,
                () -> config.addFunction("fromSink", IDENTITY, List.of(SpecialNodes.SINK), List.of("b")));
        Assertions.assertThrows(MalformedGraphException.class, () -> config.addData(" "));
        Assertions.assertThrows(MalformedGraphException.class, () -> config.setDefaultValue(SpecialNodes.START, 1));
    }

    /**
     * 场景 5: 批量注册 + 编译后的前驱/后继
     */
    @Test
    public void testAddFromListsAndAdjacency() {
        GraphConfig config = new GraphConfig("lists", "批量注册");
        List<String> ids = config.addFromLists(
                List.of(DataNode.of("a"), DataNode.of("b"), DataNode.builder().id("k").defaultValue(2).build()),
                List.of(FunctionSpec.builder()
                        .id("mul")
                        .function(input -> input.<Integer>get(0) * input.<Integer>get(1))
                        .input("a").input("k")
                        .output("b")
                        .weight(1.5)
                        .build()));
        Assertions.assertEquals(List.of("a", "b", "k", "mul"), ids);

        Dispatcher dispatcher = new Dispatcher(config);
        CapabilityGraph graph = dispatcher.getGraph();

        Assertions.assertEquals("lists", dispatcher.getName());
        Assertions.assertEquals("批量注册", dispatcher.getDescription());
        Assertions.assertEquals(List.of("mul"), graph.successors("a"));
        Assertions.assertEquals(List.of("a", "k"), graph.predecessors("mul"));
        Assertions.assertEquals(List.of("mul"), graph.producersOf("b"));
        Assertions.assertEquals(List.of("k"), graph.successors(SpecialNodes.START));
        Assertions.assertEquals(Map.of("k", 2), dispatcher.getDefaultValues());
        Assertions.assertEquals(1.5, graph.getFunctionNode("mul").getWeight());
    }

    /**
     * 场景 5.1: 注册表只能通过 add* 修改，对外暴露的节点表是只读的
     */
    @Test
    public void testRegistryViewsAreReadOnly() {
        GraphConfig config = new GraphConfig();
        config.addData("a");
        config.addData("b");
        config.addFunction("f", IDENTITY, List.of("a"), List.of("b"));

        Assertions.assertThrows(UnsupportedOperationException.class, () -> config.getDataNodes().remove(SpecialNodes.START));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> config.getDataNodes().put("c", DataNode.of("c")));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> config.getFunctionNodes().clear());
        Assertions.assertTrue(config.getDataNodes().containsKey(SpecialNodes.START));
        Assertions.assertEquals(1, config.getFunctionNodes().size());

        // 视图随注册表更新
        config.addData("c");
        Assertions.assertTrue(config.getDataNodes().containsKey("c"));
    }

    /**
     * 场景 6: 覆盖默认值，null 也是合法的默认值
     */
    @Test
    public void testSetDefaultValue() {
        GraphConfig config = new GraphConfig();
        config.addData("x", 1);
        config.addData("y");
        config.setDefaultValue("x", 5).setDefaultValue("y", null);

        Assertions.assertEquals(5, config.getDataNodes().get("x").getDefaultValue());
        Assertions.assertTrue(config.getDataNodes().get("y").hasDefault());
        Assertions.assertNull(config.getDataNodes().get("y").getDefaultValue());
        Assertions.assertFalse(config.getDataNodes().get(SpecialNodes.SINK).hasDefault());
    }
}
