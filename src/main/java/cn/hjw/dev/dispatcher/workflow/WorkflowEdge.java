package cn.hjw.dev.dispatcher.workflow;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 工作流中的一条边，数据边上带着实际流过的值
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class WorkflowEdge {

    private final String from;

    private final String to;

    private final Object value;

    // 区分"没有值的结构边"与"值为 null 的数据边"
    private final boolean valued;

    public static WorkflowEdge of(String from, String to) {
        return new WorkflowEdge(from, to, null, false);
    }

    public static WorkflowEdge of(String from, String to, Object value) {
        return new WorkflowEdge(from, to, value, true);
    }
}
