package cn.hjw.dev.dispatcher.draw;

import cn.hjw.dev.dispatcher.compile.CapabilityGraph;
import cn.hjw.dev.dispatcher.engine.Dispatcher;
import cn.hjw.dev.dispatcher.node.DataNode;
import cn.hjw.dev.dispatcher.node.FunctionNode;
import cn.hjw.dev.dispatcher.node.SpecialNodes;
import cn.hjw.dev.dispatcher.processor.SubDispatcherFunction;
import cn.hjw.dev.dispatcher.workflow.NodeType;
import cn.hjw.dev.dispatcher.workflow.Workflow;
import cn.hjw.dev.dispatcher.workflow.WorkflowEdge;
import cn.hjw.dev.dispatcher.workflow.WorkflowNode;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Graphviz DOT 导出
 * <p>
 * 两种模式：能力图 (整张注册表，数据节点标注默认值) 与工作流 (一次调度实际走过的子图，边上标注流过的值)。
 * START 画成橙色三角，数据节点青色椭圆，函数节点绿色方框；
 * 子调度器画成灰色方框，并在灰色 cluster 里递归画出子图 (工作流模式下画子图的嵌套工作流)。
 * <p>
 * 只做文本生成，不依赖 Graphviz 安装；调试用，不要放在热路径上。
 */
@Slf4j
public final class GraphvizRenderer {

    private GraphvizRenderer() {
    }

    /**
     * 能力图
     */
    public static String render(Dispatcher dispatcher) {
        return render(dispatcher, null, dispatcher.getName());
    }

    /**
     * 工作流
     * @param workflow 该调度器某次 dispatch 返回的工作流
     */
    public static String render(Dispatcher dispatcher, Workflow workflow) {
        return render(dispatcher, workflow, dispatcher.getName());
    }

    public static String render(Dispatcher dispatcher, Workflow workflow, String title) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("digraph \"main\" {\n");
        sb.append("  node [style=filled];\n");
        new Scope("main", new int[1]).draw(dispatcher, workflow, title, sb, "  ");
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * 一层图的绘制上下文，节点 ID 加前缀避免 cluster 之间冲突
     */
    private static final class Scope {
        private final String prefix;
        // 全局 cluster 计数
        private final int[] clusters;
        private final Map<String, String> dotIds = new HashMap<>();

        Scope(String prefix, int[] clusters) {
            this.prefix = prefix;
            this.clusters = clusters;
        }

        void draw(Dispatcher dispatcher, Workflow workflow, String title, StringBuilder sb, String indent) {
            if (workflow == null) {
                drawGraph(dispatcher, title, sb, indent);
            } else {
                drawWorkflow(dispatcher, workflow, title, sb, indent);
            }
            sb.append(indent).append("label = \"").append(escape(title)).append("\";\n");
            sb.append(indent).append("splines = ortho;\n");
        }

        private void drawGraph(Dispatcher dispatcher, String title, StringBuilder sb, String indent) {
            CapabilityGraph graph = dispatcher.getGraph();
            if (!graph.successors(SpecialNodes.START).isEmpty()) {
                startNode(sb, indent);
            }
            for (DataNode data : graph.getDataNodes().values()) {
                String id = data.getId();
                if (SpecialNodes.START.equals(id)) {
                    continue;
                }
                if (SpecialNodes.SINK.equals(id) && graph.producersOf(id).isEmpty()) {
                    continue;
                }
                String label = data.hasDefault() ? id + "\n default = " + label(data.getDefaultValue()) : id;
                dataNode(id, label, sb, indent);
            }
            for (FunctionNode fn : graph.getFunctionNodes().values()) {
                functionNode(fn, null, title, sb, indent);
            }
            for (CapabilityGraph.Edge edge : graph.getEdges()) {
                edge(edge.getFrom(), edge.getTo(), null, sb, indent);
            }
        }

        private void drawWorkflow(Dispatcher dispatcher, Workflow workflow, String title, StringBuilder sb, String indent) {
            CapabilityGraph graph = dispatcher.getGraph();
            for (WorkflowNode node : workflow.getNodes().values()) {
                if (node.getType() == NodeType.START) {
                    startNode(sb, indent);
                } else if (node.getType() == NodeType.DATA || node.getType() == NodeType.SINK) {
                    dataNode(node.getId(), node.getId(), sb, indent);
                } else {
                    FunctionNode fn = graph.getFunctionNode(node.getId());
                    if (fn != null) {
                        functionNode(fn, node.getSubWorkflow(), title, sb, indent);
                    }
                }
            }
            for (WorkflowEdge edge : workflow.getEdges()) {
                edge(edge.getFrom(), edge.getTo(), edge.isValued() ? label(edge.getValue()) : null, sb, indent);
            }
        }

        private void startNode(StringBuilder sb, String indent) {
            sb.append(indent).append(dotId(SpecialNodes.START))
                    .append(" [label=\"start\", shape=triangle, fillcolor=orange];\n");
        }

        private void dataNode(String id, String label, StringBuilder sb, String indent) {
            sb.append(indent).append(dotId(id))
                    .append(" [label=\"").append(escape(label)).append("\", shape=oval, fillcolor=cyan];\n");
        }

        private void functionNode(FunctionNode fn, Workflow subWorkflow, String title, StringBuilder sb, String indent) {
            if (!fn.isSubDispatcher()) {
                sb.append(indent).append(dotId(fn.getId()))
                        .append(" [label=\"").append(escape(fn.getId())).append("\", shape=box, fillcolor=springgreen];\n");
                return;
            }
            Dispatcher child = ((SubDispatcherFunction) fn.getFunction()).getDispatcher();
            String cluster = "cluster_" + clusters[0]++;
            sb.append(indent).append("subgraph ").append(cluster).append(" {\n");
            String inner = indent + "  ";
            new Scope(cluster, clusters).draw(child, subWorkflow, title + ":" + fn.getId(), sb, inner);
            sb.append(inner).append("style = filled;\n");
            sb.append(inner).append("fillcolor = gray;\n");
            sb.append(inner).append("color = black;\n");
            sb.append(indent).append("}\n");
            sb.append(indent).append(dotId(fn.getId()))
                    .append(" [label=\"").append(escape(fn.getId())).append("\", shape=box, fillcolor=gray, color=black];\n");
        }

        private void edge(String from, String to, String label, StringBuilder sb, String indent) {
            sb.append(indent).append(dotId(from)).append(" -> ").append(dotId(to));
            if (label != null) {
                sb.append(" [label=\"").append(escape(label)).append("\"]");
            }
            sb.append(";\n");
        }

        private String dotId(String nodeId) {
            return dotIds.computeIfAbsent(nodeId, k -> prefix + "_" + dotIds.size());
        }
    }

    private static String label(Object value) {
        try {
            return String.valueOf(value);
        } catch (RuntimeException e) {
            log.debug("Value of type {} has no printable form: {}", value.getClass().getName(), e.getMessage());
            return "?";
        }
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n");
    }
}
