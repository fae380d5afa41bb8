package cn.hjw.dev.dispatcher.node;

import cn.hjw.dev.dispatcher.config.NodeGovernance;
import cn.hjw.dev.dispatcher.engine.DispatchResult;
import cn.hjw.dev.dispatcher.exception.FunctionInvocationException;
import cn.hjw.dev.dispatcher.processor.InputDomain;
import cn.hjw.dev.dispatcher.processor.NodeFunction;
import cn.hjw.dev.dispatcher.processor.SubDispatcherFunction;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 函数节点：固定输入 (AND) 与固定输出的一次计算
 * 普通函数与子调度器通过同一个 {@link NodeFunction} 接口调用，由 {@link FunctionKind} 区分
 */
@Getter
@ToString(exclude = {"function", "inputDomain"})
@Builder(toBuilder = true)
public class FunctionNode {

    private final String id;

    private final NodeFunction function;

    private final List<String> inputs;

    private final List<String> outputs;

    private final double weight;

    // 为 null 时始终可执行
    private final InputDomain inputDomain;

    // 注册顺序，同代价时的最终裁决
    private final int order;

    private final String description;

    @Builder.Default
    private final FunctionKind kind = FunctionKind.FUNCTION;

    private final NodeGovernance governance;

    public boolean isSubDispatcher() {
        return kind == FunctionKind.SUB_DISPATCHER;
    }

    /**
     * 把一次调用的返回值展开为 输出ID -> 值
     * 普通函数按位置匹配；子调度器只返回子图实际算出的那部分输出
     *
     * @param raw 调用返回值
     * @return 输出映射 (可能包含 SINK)
     * @throws FunctionInvocationException 返回值个数与声明的输出不一致
     */
    public Map<String, Object> toOutputs(Object raw) {
        if (isSubDispatcher()) {
            return ((SubDispatcherFunction) function).toParentOutputs((DispatchResult) raw);
        }
        Map<String, Object> produced = new LinkedHashMap<>();
        if (outputs.size() == 1) {
            produced.put(outputs.get(0), raw);
            return produced;
        }
        List<?> values;
        if (raw instanceof List) {
            values = (List<?>) raw;
        } else if (raw instanceof Object[]) {
            values = Arrays.asList((Object[]) raw);
        } else {
            throw new FunctionInvocationException(id, "Function [" + id + "] declares " + outputs.size()
                    + " outputs but returned a single value");
        }
        if (values.size() != outputs.size()) {
            throw new FunctionInvocationException(id, "Function [" + id + "] returned " + values.size()
                    + " values, expected " + outputs.size());
        }
        for (int i = 0; i < outputs.size(); i++) {
            // 同一输出重复声明时保留第一个位置的值
            produced.putIfAbsent(outputs.get(i), values.get(i));
        }
        return produced;
    }
}
