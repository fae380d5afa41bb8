package cn.hjw.dev.dispatcher.workflow;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 一次调度实际访问过的子图 (只读)
 * <p>
 * 与能力图相互独立：绘图、诊断工具读取它不会影响任何调度状态。
 * 调用方可以用它回答"为什么 X 没有算出来"。
 */
@Getter
public final class Workflow {

    private final Map<String, WorkflowNode> nodes;

    private final List<WorkflowEdge> edges;

    // 函数调用 (含失败的调用) 的先后顺序
    private final List<String> invocationOrder;

    Workflow(Map<String, WorkflowNode> nodes, List<WorkflowEdge> edges, List<String> invocationOrder) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);
        this.invocationOrder = List.copyOf(invocationOrder);
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public WorkflowNode getNode(String nodeId) {
        return nodes.get(nodeId);
    }

    public List<WorkflowNode> nodesOfType(NodeType type) {
        return nodes.values().stream()
                .filter(node -> node.getType() == type)
                .collect(Collectors.toUnmodifiableList());
    }

    public List<WorkflowEdge> outEdges(String nodeId) {
        return edges.stream()
                .filter(edge -> edge.getFrom().equals(nodeId))
                .collect(Collectors.toUnmodifiableList());
    }

    public List<WorkflowEdge> inEdges(String nodeId) {
        return edges.stream()
                .filter(edge -> edge.getTo().equals(nodeId))
                .collect(Collectors.toUnmodifiableList());
    }

    public List<String> successors(String nodeId) {
        return outEdges(nodeId).stream().map(WorkflowEdge::getTo).collect(Collectors.toUnmodifiableList());
    }

    public List<String> predecessors(String nodeId) {
        return inEdges(nodeId).stream().map(WorkflowEdge::getFrom).collect(Collectors.toUnmodifiableList());
    }

    /**
     * 失败的函数节点: ID -> 原因
     */
    public Map<String, Throwable> failures() {
        Map<String, Throwable> failures = new LinkedHashMap<>();
        nodes.values().stream()
                .filter(WorkflowNode::isFailed)
                .forEach(node -> failures.put(node.getId(), node.getFailure()));
        return Collections.unmodifiableMap(failures);
    }

    public Workflow getSubWorkflow(String functionId) {
        WorkflowNode node = nodes.get(functionId);
        return node != null ? node.getSubWorkflow() : null;
    }
}
