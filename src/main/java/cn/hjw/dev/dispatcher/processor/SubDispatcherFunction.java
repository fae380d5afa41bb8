package cn.hjw.dev.dispatcher.processor;

import cn.hjw.dev.dispatcher.engine.DispatchResult;
import cn.hjw.dev.dispatcher.engine.Dispatcher;
import cn.hjw.dev.dispatcher.node.SpecialNodes;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 子调度器适配器：把一个编译好的子图当作父图中的一个函数节点
 * <p>
 * 输入重命名 父ID -> 子ID (映射到 SINK 的输入只对输入域可见，不传给子图)，
 * 输出重命名 子ID -> 父ID。每次调用只产生一次临时的嵌套调度，子图本身不可变。
 */
@Slf4j
@Getter
public class SubDispatcherFunction implements NodeFunction {

    private final Dispatcher dispatcher;

    // parent -> child | SINK
    private final Map<String, String> inputs;

    // child -> parent
    private final Map<String, String> outputs;

    public SubDispatcherFunction(Dispatcher dispatcher, Map<String, String> inputs, Map<String, String> outputs) {
        this.dispatcher = dispatcher;
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    @Override
    public Object process(UpstreamInput input) {
        Map<String, Object> childInputs = new LinkedHashMap<>();
        inputs.forEach((parentId, childId) -> {
            if (!SpecialNodes.SINK.equals(childId) && input.contains(parentId)) {
                childInputs.put(childId, input.get(parentId));
            }
        });
        log.debug("Sub-dispatching [{}] with inputs {}", dispatcher.getName(), childInputs.keySet());
        return dispatcher.dispatch(childInputs, outputs.keySet());
    }

    /**
     * 把子图的解按输出映射改回父图的 ID，子图没算出的输出不出现在结果里
     */
    public Map<String, Object> toParentOutputs(DispatchResult result) {
        Map<String, Object> produced = new LinkedHashMap<>();
        Map<String, Object> solution = result.getSolution();
        outputs.forEach((childId, parentId) -> {
            if (solution.containsKey(childId)) {
                produced.putIfAbsent(parentId, solution.get(childId));
            }
        });
        return produced;
    }

    @Override
    public String name() {
        return dispatcher.getName();
    }
}
