package cn.hjw.dev.dispatcher.workflow;

import cn.hjw.dev.dispatcher.node.SpecialNodes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工作流记录器：挂在一次调度上的被动观察者
 * 非线程安全，每次调度各自持有一个
 */
public class WorkflowRecorder {

    private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
    private final List<WorkflowEdge> edges = new ArrayList<>();
    private final List<String> invocationOrder = new ArrayList<>();

    /**
     * 数据节点结算
     * @param via 来源节点：输入与默认值来自 START，其余来自生产函数
     */
    public void recordSettlement(String dataId, Object value, String via, double cost, SettlementSource source) {
        ensureSpecial(via);
        nodes.put(dataId, WorkflowNode.builder()
                .id(dataId)
                .type(NodeType.DATA)
                .value(value)
                .cost(cost)
                .source(source)
                .producer(source == SettlementSource.FUNCTION ? via : null)
                .build());
        edges.add(WorkflowEdge.of(via, dataId, value));
    }

    /**
     * 函数成功调用
     * @param inputsUsed       实际传入的输入
     * @param outputsProduced  调用产生的全部输出 (未必都被采用)
     */
    public void recordInvocation(String functionId, Map<String, Object> inputsUsed, Map<String, Object> outputsProduced) {
        invocationOrder.add(functionId);
        nodes.put(functionId, WorkflowNode.builder()
                .id(functionId)
                .type(NodeType.FUNCTION)
                .inputs(freeze(inputsUsed))
                .outputs(freeze(outputsProduced))
                .build());
        linkInputs(functionId, inputsUsed);
        if (outputsProduced.containsKey(SpecialNodes.SINK)) {
            ensureSpecial(SpecialNodes.SINK);
            edges.add(WorkflowEdge.of(functionId, SpecialNodes.SINK, outputsProduced.get(SpecialNodes.SINK)));
        }
    }

    public void recordFailure(String functionId, Throwable error) {
        recordFailure(functionId, null, error);
    }

    /**
     * 函数失败 (调用异常或输入域求值异常)
     * @param inputsUsed 调用时的输入；输入域失败时为 null
     */
    public void recordFailure(String functionId, Map<String, Object> inputsUsed, Throwable error) {
        if (inputsUsed != null) {
            invocationOrder.add(functionId);
            linkInputs(functionId, inputsUsed);
        }
        nodes.put(functionId, WorkflowNode.builder()
                .id(functionId)
                .type(NodeType.FUNCTION)
                .inputs(inputsUsed != null ? freeze(inputsUsed) : null)
                .failure(error)
                .build());
    }

    /**
     * 子调度器的嵌套工作流挂到对应的函数节点上
     */
    public void recordSubWorkflow(String functionId, Workflow subWorkflow) {
        WorkflowNode node = nodes.get(functionId);
        if (node != null) {
            nodes.put(functionId, node.toBuilder().subWorkflow(subWorkflow).build());
        }
    }

    public Workflow toWorkflow() {
        return new Workflow(nodes, edges, invocationOrder);
    }

    private void linkInputs(String functionId, Map<String, Object> inputsUsed) {
        if (inputsUsed.isEmpty()) {
            ensureSpecial(SpecialNodes.START);
            edges.add(WorkflowEdge.of(SpecialNodes.START, functionId));
            return;
        }
        inputsUsed.forEach((dataId, value) -> edges.add(WorkflowEdge.of(dataId, functionId, value)));
    }

    private void ensureSpecial(String id) {
        if (SpecialNodes.START.equals(id) && !nodes.containsKey(id)) {
            nodes.put(id, WorkflowNode.builder().id(id).type(NodeType.START).build());
        } else if (SpecialNodes.SINK.equals(id) && !nodes.containsKey(id)) {
            nodes.put(id, WorkflowNode.builder().id(id).type(NodeType.SINK).build());
        }
    }

    private static Map<String, Object> freeze(Map<String, Object> values) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
