package cn.hjw.dev.dispatcher.engine;

import cn.hjw.dev.dispatcher.ExecutableGraph;
import cn.hjw.dev.dispatcher.compile.CapabilityGraph;
import cn.hjw.dev.dispatcher.compile.GraphCompiler;
import cn.hjw.dev.dispatcher.config.GraphConfig;
import cn.hjw.dev.dispatcher.executor.DispatchExecutor;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 调度器：编译好的能力图 + 解析执行器
 * <p>
 * 构建后不可变。每次 dispatch 都在调用栈上新建全部运行态，
 * 所以同一个实例可以被多个线程同时调度，也可以作为子调度器挂进别的图。
 */
public class Dispatcher implements ExecutableGraph {

    private final CapabilityGraph graph;

    private final DispatchExecutor executor;

    public Dispatcher(GraphConfig graphConfig) {
        // 编译
        this.graph = GraphCompiler.compile(graphConfig);
        // 创建执行器
        this.executor = new DispatchExecutor(graph);
    }

    @Override
    public DispatchResult dispatch(Map<String, ?> inputs, Collection<String> outputs) {
        return executor.execute(inputs, outputs);
    }

    /**
     * 计算所有可达的数据
     */
    public DispatchResult dispatch(Map<String, ?> inputs) {
        return executor.execute(inputs, List.of());
    }

    public String getName() {
        return graph.getName();
    }

    public String getDescription() {
        return graph.getDescription();
    }

    public CapabilityGraph getGraph() {
        return graph;
    }

    public Map<String, Object> getDefaultValues() {
        return graph.defaultValues();
    }
}
