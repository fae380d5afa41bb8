package cn.hjw.dev.dispatcher.config;

import cn.hjw.dev.dispatcher.processor.InputDomain;
import cn.hjw.dev.dispatcher.processor.NodeFunction;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * 函数节点注册参数
 */
@Getter
@Builder
public class FunctionSpec {

    // 为空时由函数名派生
    private final String id;

    private final NodeFunction function;

    @Singular
    private final List<String> inputs;

    @Singular
    private final List<String> outputs;

    @Builder.Default
    private final double weight = 0;

    private final InputDomain inputDomain;

    private final String description;

    private final NodeGovernance governance;
}
