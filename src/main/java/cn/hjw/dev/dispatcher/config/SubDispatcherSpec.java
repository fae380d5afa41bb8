package cn.hjw.dev.dispatcher.config;

import cn.hjw.dev.dispatcher.engine.Dispatcher;
import cn.hjw.dev.dispatcher.processor.InputDomain;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Map;

/**
 * 子调度器注册参数
 */
@Getter
@Builder
public class SubDispatcherSpec {

    private final String id;

    private final Dispatcher dispatcher;

    // 父图数据ID -> 子图数据ID (或 SINK)
    @Singular
    private final Map<String, String> inputs;

    // 子图数据ID -> 父图数据ID
    @Singular
    private final Map<String, String> outputs;

    private final InputDomain inputDomain;

    @Builder.Default
    private final double weight = 0;

    // 把子图映射输入上的默认值复制到父图
    @Builder.Default
    private final boolean includeDefaults = false;

    private final String description;
}
