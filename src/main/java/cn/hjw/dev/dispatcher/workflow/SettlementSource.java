package cn.hjw.dev.dispatcher.workflow;

/**
 * 数据节点的值来自哪里
 */
public enum SettlementSource {
    INPUT,
    FUNCTION,
    DEFAULT
}
