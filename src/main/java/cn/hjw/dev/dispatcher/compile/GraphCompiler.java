package cn.hjw.dev.dispatcher.compile;

import cn.hjw.dev.dispatcher.config.GraphConfig;
import cn.hjw.dev.dispatcher.config.NodeGovernance;
import cn.hjw.dev.dispatcher.node.DataNode;
import cn.hjw.dev.dispatcher.node.FunctionNode;
import cn.hjw.dev.dispatcher.node.SpecialNodes;
import cn.hjw.dev.dispatcher.processor.ResilientNodeFunction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class GraphCompiler {

    private GraphCompiler() {
    }

    /**
     * 编译图配置为不可变的能力图
     * <p>
     * 不做环检测：能力图允许结构上的环，调度时"每个数据只结算一次"保证环上的节点要么不可达，要么只算一次。
     *
     * @param config 图配置
     * @return 能力图
     */
    public static CapabilityGraph compile(GraphConfig config) {
        Map<String, DataNode> dataNodes = new LinkedHashMap<>(config.getDataNodes());

        // 1. 包装处理器 (Governance Decorator)
        Map<String, FunctionNode> functionNodes = new LinkedHashMap<>();
        config.getFunctionNodes().forEach((id, node) -> {
            NodeGovernance governance = node.getGovernance();
            if (governance != null && governance.isEffective() && !node.isSubDispatcher()) {
                functionNodes.put(id, node.toBuilder()
                        .function(new ResilientNodeFunction(id, node.getFunction(), governance))
                        .build());
            } else {
                functionNodes.put(id, node);
            }
        });

        // 2. 构建邻接表
        Map<String, List<String>> consumers = new LinkedHashMap<>();
        Map<String, List<String>> producers = new LinkedHashMap<>();
        Map<String, List<String>> successors = new LinkedHashMap<>();
        Map<String, List<String>> predecessors = new LinkedHashMap<>();
        List<CapabilityGraph.Edge> edges = new ArrayList<>();

        for (DataNode data : dataNodes.values()) {
            if (data.hasDefault()) {
                link(SpecialNodes.START, data.getId(), successors, predecessors, edges);
            }
        }

        for (FunctionNode fn : functionNodes.values()) {
            for (String input : requiredInputs(fn)) {
                consumers.computeIfAbsent(input, k -> new ArrayList<>()).add(fn.getId());
                link(input, fn.getId(), successors, predecessors, edges);
            }
            for (String output : new LinkedHashSet<>(fn.getOutputs())) {
                producers.computeIfAbsent(output, k -> new ArrayList<>()).add(fn.getId());
                link(fn.getId(), output, successors, predecessors, edges);
            }
        }

        // 3. 结构诊断：只记日志，不可达的数据不是错误
        for (DataNode data : dataNodes.values()) {
            String id = data.getId();
            if (!SpecialNodes.isReserved(id) && !data.hasDefault()
                    && !producers.containsKey(id) && !consumers.containsKey(id)) {
                log.debug("Data node [{}] in graph [{}] is isolated", id, config.getName());
            }
        }

        log.info("Compiled graph [{}]: {} data nodes, {} function nodes, {} edges",
                config.getName(), dataNodes.size() - SpecialNodes.RESERVED.size(), functionNodes.size(), edges.size());

        return new CapabilityGraph(config.getName(), config.getDescription(), dataNodes, functionNodes,
                freeze(consumers), freeze(producers), freeze(successors), freeze(predecessors), edges);
    }

    /**
     * 函数真正需要等待的输入：去重后的输入列表；没有输入的函数挂在 START 上
     */
    public static Set<String> requiredInputs(FunctionNode fn) {
        if (fn.getInputs().isEmpty()) {
            return Set.of(SpecialNodes.START);
        }
        return new LinkedHashSet<>(fn.getInputs());
    }

    private static void link(String from, String to,
                             Map<String, List<String>> successors,
                             Map<String, List<String>> predecessors,
                             List<CapabilityGraph.Edge> edges) {
        successors.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
        predecessors.computeIfAbsent(to, k -> new ArrayList<>()).add(from);
        edges.add(new CapabilityGraph.Edge(from, to));
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> table) {
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        table.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return frozen;
    }
}
