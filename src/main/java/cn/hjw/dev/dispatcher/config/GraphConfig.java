package cn.hjw.dev.dispatcher.config;

import cn.hjw.dev.dispatcher.compile.CapabilityGraph;
import cn.hjw.dev.dispatcher.exception.DuplicateNodeIdException;
import cn.hjw.dev.dispatcher.exception.MalformedGraphException;
import cn.hjw.dev.dispatcher.exception.UnknownNodeException;
import cn.hjw.dev.dispatcher.node.DataNode;
import cn.hjw.dev.dispatcher.node.FunctionKind;
import cn.hjw.dev.dispatcher.node.FunctionNode;
import cn.hjw.dev.dispatcher.node.SpecialNodes;
import cn.hjw.dev.dispatcher.processor.NodeFunction;
import cn.hjw.dev.dispatcher.processor.SubDispatcherFunction;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 图配置 (节点注册表)
 * <p>
 * 纯声明式：只登记数据节点、函数节点、子调度器以及它们之间的连线，不含任何执行逻辑。
 * 注册错误立即抛出；配置完成后交给 {@link cn.hjw.dev.dispatcher.engine.Dispatcher} 编译成不可变的能力图。
 */
@Slf4j
@Getter
public class GraphConfig {

    private final String name;

    private final String description;

    // 数据节点表 (含 START / SINK)，保持注册顺序
    @Getter(AccessLevel.NONE)
    private final Map<String, DataNode> dataNodes = new LinkedHashMap<>();

    // 函数节点表，保持注册顺序
    @Getter(AccessLevel.NONE)
    private final Map<String, FunctionNode> functionNodes = new LinkedHashMap<>();

    public GraphConfig() {
        this("Dispatcher", null);
    }

    public GraphConfig(String name) {
        this(name, null);
    }

    public GraphConfig(String name, String description) {
        this.name = name;
        this.description = description;
        dataNodes.put(SpecialNodes.START, DataNode.builder().id(SpecialNodes.START).description("Start node").build());
        dataNodes.put(SpecialNodes.SINK, DataNode.builder().id(SpecialNodes.SINK).description("Sink node").build());
    }

    /**
     * 只读视图，修改只能通过 add* 方法
     */
    public Map<String, DataNode> getDataNodes() {
        return Collections.unmodifiableMap(dataNodes);
    }

    public Map<String, FunctionNode> getFunctionNodes() {
        return Collections.unmodifiableMap(functionNodes);
    }

    // ---------------------------------------------------------------- 数据节点

    public String addData(String dataId) {
        return addData(DataNode.of(dataId));
    }

    public String addData(String dataId, Object defaultValue) {
        return addData(DataNode.builder().id(dataId).defaultValue(defaultValue).build());
    }

    /**
     * @param waitInput true: 默认值只在队列耗尽且无生产者结算时使用
     */
    public String addData(String dataId, Object defaultValue, boolean waitInput) {
        return addData(DataNode.builder().id(dataId).defaultValue(defaultValue).waitInput(waitInput).build());
    }

    public String addData(DataNode node) {
        String id = node.getId();
        if (id == null || id.isBlank()) {
            throw new MalformedGraphException("Data node id must not be blank");
        }
        requireUnused(id);
        dataNodes.put(id, node);
        return id;
    }

    /**
     * 覆盖已注册数据节点的默认值
     */
    public GraphConfig setDefaultValue(String dataId, Object defaultValue) {
        DataNode node = requireData(dataId, "default value");
        if (SpecialNodes.isReserved(dataId)) {
            throw new MalformedGraphException("Reserved node [" + dataId + "] cannot hold a default value");
        }
        dataNodes.put(dataId, node.toBuilder().defaultValue(defaultValue).build());
        return this;
    }

    // ---------------------------------------------------------------- 函数节点

    public String addFunction(String functionId, NodeFunction function, List<String> inputs, List<String> outputs) {
        return addFunction(functionId, function, inputs, outputs, 0);
    }

    public String addFunction(String functionId, NodeFunction function, List<String> inputs,
                              List<String> outputs, double weight) {
        return addFunction(FunctionSpec.builder()
                .id(functionId)
                .function(function)
                .inputs(inputs)
                .outputs(outputs)
                .weight(weight)
                .build());
    }

    //  全参数注册 (含输入域、治理)
    public String addFunction(FunctionSpec spec) {
        if (spec.getFunction() == null) {
            throw new MalformedGraphException("Function node [" + spec.getId() + "] has no callable");
        }
        checkWeight(spec.getId(), spec.getWeight());
        if (spec.getOutputs().isEmpty()) {
            throw new MalformedGraphException("Function node [" + spec.getId() + "] declares no outputs");
        }
        String id = resolveFunctionId(spec.getId(), spec.getFunction());
        String context = "function " + id;
        for (String input : spec.getInputs()) {
            requireData(input, context);
            if (SpecialNodes.isReserved(input)) {
                throw new MalformedGraphException("Function node [" + id + "] cannot consume reserved node [" + input + "]");
            }
        }
        for (String output : spec.getOutputs()) {
            requireData(output, context);
            if (SpecialNodes.START.equals(output)) {
                throw new MalformedGraphException("Function node [" + id + "] cannot produce the start node");
            }
        }

        functionNodes.put(id, FunctionNode.builder()
                .id(id)
                .function(spec.getFunction())
                .inputs(List.copyOf(spec.getInputs()))
                .outputs(List.copyOf(spec.getOutputs()))
                .weight(spec.getWeight())
                .inputDomain(spec.getInputDomain())
                .order(functionNodes.size())
                .description(spec.getDescription())
                .governance(spec.getGovernance())
                .build());
        log.debug("Registered function [{}] {} -> {}", id, spec.getInputs(), spec.getOutputs());
        return id;
    }

    // ---------------------------------------------------------------- 子调度器

    /**
     * 把一个编译好的调度器挂为本图的一个函数节点
     * @return 函数节点ID
     */
    public String addSubDispatcher(SubDispatcherSpec spec) {
        if (spec.getDispatcher() == null) {
            throw new MalformedGraphException("Sub-dispatcher [" + spec.getId() + "] has no dispatcher");
        }
        if (spec.getOutputs().isEmpty()) {
            throw new MalformedGraphException("Sub-dispatcher [" + spec.getId() + "] declares no outputs");
        }
        checkWeight(spec.getId(), spec.getWeight());
        CapabilityGraph child = spec.getDispatcher().getGraph();
        SubDispatcherFunction function = new SubDispatcherFunction(spec.getDispatcher(), spec.getInputs(), spec.getOutputs());
        String id = resolveFunctionId(spec.getId(), function);
        String context = "sub-dispatcher " + id;

        spec.getInputs().forEach((parentId, childId) -> {
            requireData(parentId, context);
            if (SpecialNodes.isReserved(parentId)) {
                throw new MalformedGraphException("Sub-dispatcher [" + id + "] cannot consume reserved node [" + parentId + "]");
            }
            if (!SpecialNodes.SINK.equals(childId) && !child.containsData(childId)) {
                throw new UnknownNodeException(childId, context + " (child input)");
            }
        });
        spec.getOutputs().forEach((childId, parentId) -> {
            if (!child.containsData(childId)) {
                throw new UnknownNodeException(childId, context + " (child output)");
            }
            requireData(parentId, context);
            if (SpecialNodes.START.equals(parentId)) {
                throw new MalformedGraphException("Sub-dispatcher [" + id + "] cannot produce the start node");
            }
        });

        if (spec.isIncludeDefaults()) {
            spec.getInputs().forEach((parentId, childId) -> {
                DataNode childNode = child.getDataNode(childId);
                if (childNode != null && childNode.hasDefault() && !dataNodes.get(parentId).hasDefault()) {
                    setDefaultValue(parentId, childNode.getDefaultValue());
                }
            });
        }

        functionNodes.put(id, FunctionNode.builder()
                .id(id)
                .function(function)
                .inputs(List.copyOf(spec.getInputs().keySet()))
                .outputs(List.copyOf(new LinkedHashSet<>(spec.getOutputs().values())))
                .weight(spec.getWeight())
                .inputDomain(spec.getInputDomain())
                .order(functionNodes.size())
                .description(spec.getDescription() != null ? spec.getDescription() : spec.getDispatcher().getDescription())
                .kind(FunctionKind.SUB_DISPATCHER)
                .build());
        log.debug("Registered sub-dispatcher [{}] over [{}]", id, spec.getDispatcher().getName());
        return id;
    }

    /**
     * 批量注册：先数据后函数
     * @return 按注册顺序返回的全部节点ID
     */
    public List<String> addFromLists(List<DataNode> dataList, List<FunctionSpec> functionList) {
        List<String> ids = new ArrayList<>();
        for (DataNode node : dataList != null ? dataList : Collections.<DataNode>emptyList()) {
            ids.add(addData(node));
        }
        for (FunctionSpec spec : functionList != null ? functionList : Collections.<FunctionSpec>emptyList()) {
            ids.add(addFunction(spec));
        }
        return ids;
    }

    // ---------------------------------------------------------------- 内部校验

    private String resolveFunctionId(String explicitId, NodeFunction function) {
        if (explicitId != null) {
            if (explicitId.isBlank()) {
                throw new MalformedGraphException("Function node id must not be blank");
            }
            requireUnused(explicitId);
            return explicitId;
        }
        // 复用同一个函数时派生 name<0>, name<1> ...
        String base = function.name();
        if (!isUsed(base)) {
            return base;
        }
        int i = 0;
        while (isUsed(base + "<" + i + ">")) {
            i++;
        }
        return base + "<" + i + ">";
    }

    private void checkWeight(String id, double weight) {
        if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0) {
            throw new MalformedGraphException("Function node [" + id + "] has an invalid weight: " + weight);
        }
    }

    private boolean isUsed(String id) {
        return dataNodes.containsKey(id) || functionNodes.containsKey(id);
    }

    private void requireUnused(String id) {
        if (isUsed(id)) {
            throw new DuplicateNodeIdException(id);
        }
    }

    private DataNode requireData(String dataId, String context) {
        DataNode node = dataNodes.get(dataId);
        if (node == null) {
            throw new UnknownNodeException(dataId, context);
        }
        return node;
    }
}
