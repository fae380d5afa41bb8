package cn.hjw.dev.dispatcher.hook;

import cn.hjw.dev.dispatcher.processor.UpstreamInput;

/**
 * 降级策略接口
 */
@FunctionalInterface
public interface FallbackStrategy {

    /**
     * 执行降级逻辑
     * @param functionId 失败的函数节点
     * @param input 该函数的输入
     * @param cause 失败原因
     * @return 兜底结果，形状需与函数正常返回值一致
     * @throws Exception 降级本身失败，按函数调用失败处理
     */
    Object fallback(String functionId, UpstreamInput input, Throwable cause) throws Exception;
}
