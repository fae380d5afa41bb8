package cn.hjw.dev.dispatcher.processor;

/**
 * 函数节点的可调用体
 * <p>
 * 单输出函数直接返回值；多输出函数返回 {@link java.util.List} 或数组，按位置对应声明的输出。
 */
@FunctionalInterface
public interface NodeFunction {

    /**
     * 执行计算
     * @param input 已结算的输入，按声明顺序排列
     * @return 计算结果
     * @throws Exception 执行异常 (由执行器捕获并记录，不会中断调度)
     */
    Object process(UpstreamInput input) throws Exception;

    /**
     * 未显式指定函数节点 ID 时用于派生 ID 的名字
     */
    default String name() {
        String simpleName = getClass().getSimpleName();
        if (simpleName.isEmpty() || simpleName.contains("$$Lambda")) {
            return "unknown";
        }
        return simpleName;
    }
}
