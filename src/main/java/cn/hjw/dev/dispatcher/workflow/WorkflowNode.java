package cn.hjw.dev.dispatcher.workflow;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * 工作流节点
 * 数据节点带结算值、代价与来源；函数节点带本次调用的输入输出，失败时带失败原因，子调度器带嵌套工作流
 */
@Getter
@ToString(exclude = "subWorkflow")
@Builder(toBuilder = true)
public final class WorkflowNode {

    private final String id;

    private final NodeType type;

    private final Object value;

    private final double cost;

    private final SettlementSource source;

    private final String producer;

    private final Map<String, Object> inputs;

    private final Map<String, Object> outputs;

    private final Throwable failure;

    private final Workflow subWorkflow;

    public boolean isFailed() {
        return failure != null;
    }
}
