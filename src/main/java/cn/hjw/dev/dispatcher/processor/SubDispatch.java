package cn.hjw.dev.dispatcher.processor;

import cn.hjw.dev.dispatcher.engine.DispatchResult;
import cn.hjw.dev.dispatcher.engine.Dispatcher;
import cn.hjw.dev.dispatcher.exception.FunctionInvocationException;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把一个调度器包装成普通函数：唯一的输入是 ID -> 值 的 Map，返回指定输出
 * <p>
 * 与 {@link SubDispatcherFunction} 不同，它不做重命名，也不参与父图的代价竞争，
 * 只是一个黑盒计算。
 */
@RequiredArgsConstructor
public class SubDispatch implements NodeFunction {

    public enum Returns {
        /** 按 outputs 顺序返回 List，缺任何一个输出即视为失败 */
        LIST,
        /** 返回已算出的输出 Map */
        DICT
    }

    private final Dispatcher dispatcher;
    private final List<String> outputs;
    private final Returns returns;

    public SubDispatch(Dispatcher dispatcher, List<String> outputs) {
        this(dispatcher, outputs, Returns.DICT);
    }

    @Override
    public Object process(UpstreamInput input) {
        Map<String, Object> inputs = Collections.emptyMap();
        if (input.size() > 0) {
            inputs = input.get(0);
        }
        DispatchResult result = dispatcher.dispatch(inputs, outputs);
        Map<String, Object> solution = result.getSolution();

        if (returns == Returns.DICT) {
            Map<String, Object> selected = new LinkedHashMap<>();
            for (String output : outputs) {
                if (solution.containsKey(output)) {
                    selected.put(output, solution.get(output));
                }
            }
            return selected;
        }

        List<Object> values = new ArrayList<>(outputs.size());
        for (String output : outputs) {
            if (!solution.containsKey(output)) {
                throw new FunctionInvocationException(name(),
                        "Unreachable output [" + output + "] in dispatcher " + dispatcher.getName());
            }
            values.add(solution.get(output));
        }
        return values;
    }

    @Override
    public String name() {
        return dispatcher.getName();
    }
}
