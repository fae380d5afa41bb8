package cn.hjw.dev.dispatcher.node;

public enum FunctionKind {
    /** 普通函数：所有输入结算后才可执行 */
    FUNCTION,
    /** 子调度器：已结算的映射输入即可驱动一次嵌套调度 */
    SUB_DISPATCHER
}
