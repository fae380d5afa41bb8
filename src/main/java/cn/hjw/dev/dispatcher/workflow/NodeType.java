package cn.hjw.dev.dispatcher.workflow;

public enum NodeType {
    DATA,
    FUNCTION,
    START,
    SINK
}
