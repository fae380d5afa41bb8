package cn.hjw.dev.dispatcher.compile;

import cn.hjw.dev.dispatcher.node.DataNode;
import cn.hjw.dev.dispatcher.node.FunctionNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 能力图：由注册表编译出的不可变二分有向图 (数据 <-> 函数)
 * <p>
 * 调度期间只读，可被多个线程的调度同时使用。
 * START 指向无输入的函数与带默认值的数据节点。
 */
@Getter
public final class CapabilityGraph {

    private final String name;

    private final String description;

    private final Map<String, DataNode> dataNodes;

    private final Map<String, FunctionNode> functionNodes;

    // 数据ID -> 消费它的函数ID (注册顺序)
    private final Map<String, List<String>> consumers;

    // 数据ID -> 生产它的函数ID (注册顺序)
    private final Map<String, List<String>> producers;

    private final Map<String, List<String>> successors;

    private final Map<String, List<String>> predecessors;

    private final List<Edge> edges;

    CapabilityGraph(String name, String description,
                    Map<String, DataNode> dataNodes,
                    Map<String, FunctionNode> functionNodes,
                    Map<String, List<String>> consumers,
                    Map<String, List<String>> producers,
                    Map<String, List<String>> successors,
                    Map<String, List<String>> predecessors,
                    List<Edge> edges) {
        this.name = name;
        this.description = description;
        this.dataNodes = Collections.unmodifiableMap(dataNodes);
        this.functionNodes = Collections.unmodifiableMap(functionNodes);
        this.consumers = Collections.unmodifiableMap(consumers);
        this.producers = Collections.unmodifiableMap(producers);
        this.successors = Collections.unmodifiableMap(successors);
        this.predecessors = Collections.unmodifiableMap(predecessors);
        this.edges = Collections.unmodifiableList(edges);
    }

    public boolean containsData(String id) {
        return dataNodes.containsKey(id);
    }

    public boolean containsFunction(String id) {
        return functionNodes.containsKey(id);
    }

    public DataNode getDataNode(String id) {
        return dataNodes.get(id);
    }

    public FunctionNode getFunctionNode(String id) {
        return functionNodes.get(id);
    }

    public List<String> consumersOf(String dataId) {
        return consumers.getOrDefault(dataId, List.of());
    }

    public List<String> producersOf(String dataId) {
        return producers.getOrDefault(dataId, List.of());
    }

    /**
     * 节点的直接后继 (数据 -> 函数，函数 -> 输出数据，START -> 无输入函数/默认值数据)
     */
    public List<String> successors(String nodeId) {
        return successors.getOrDefault(nodeId, List.of());
    }

    public List<String> predecessors(String nodeId) {
        return predecessors.getOrDefault(nodeId, List.of());
    }

    /**
     * 所有带默认值的数据节点: ID -> 默认值
     */
    public Map<String, Object> defaultValues() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        dataNodes.values().stream()
                .filter(DataNode::hasDefault)
                .forEach(node -> defaults.put(node.getId(), node.getDefaultValue()));
        return Collections.unmodifiableMap(defaults);
    }

    @Getter
    @ToString
    @EqualsAndHashCode
    @RequiredArgsConstructor
    public static final class Edge {
        private final String from;
        private final String to;
    }
}
