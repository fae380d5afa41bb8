package cn.hjw.dev.dispatcher.engine;

import cn.hjw.dev.dispatcher.workflow.Workflow;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 一次调度的结果：解 + 工作流
 * 调用方需自行检查期望的输出是否在解里
 */
@Getter
public final class DispatchResult {

    private final Map<String, Object> solution;

    private final Workflow workflow;

    public DispatchResult(Map<String, Object> solution, Workflow workflow) {
        this.solution = Collections.unmodifiableMap(new LinkedHashMap<>(solution));
        this.workflow = workflow;
    }

    public boolean contains(String dataId) {
        return solution.containsKey(dataId);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String dataId) {
        return (T) solution.get(dataId);
    }

    public <T> T get(String dataId, Class<T> type) {
        Object value = solution.get(dataId);
        if (value != null && !type.isInstance(value)) {
            throw new ClassCastException("Data [" + dataId + "] is " + value.getClass().getName() + ", expected " + type.getName());
        }
        return type.cast(value);
    }

    /**
     * 没有算出来的期望输出
     */
    public List<String> missing(Collection<String> outputs) {
        return outputs.stream()
                .filter(id -> !solution.containsKey(id))
                .collect(Collectors.toList());
    }
}
