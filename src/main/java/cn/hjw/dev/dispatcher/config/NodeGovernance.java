package cn.hjw.dev.dispatcher.config;

import cn.hjw.dev.dispatcher.hook.FallbackStrategy;
import lombok.Builder;
import lombok.Getter;

/**
 * 函数节点的治理方案：重试 + 降级
 * 调度器本身没有超时概念，需要限时的调用方自行包装可调用体
 */
@Getter
@Builder
public class NodeGovernance {

    // --- 重试配置 ---
    @Builder.Default
    private int maxRetries = 0; // 最大重试次数

    @Builder.Default
    private long retryBackoff = 0; // 毫秒,每次重试的退避时间

    // --- 降级配置 ---
    private FallbackStrategy fallbackStrategy;

    public boolean isEffective() {
        return maxRetries > 0 || fallbackStrategy != null;
    }
}
