package cn.hjw.dev.dispatcher;

import cn.hjw.dev.dispatcher.engine.DispatchResult;

import java.util.Collection;
import java.util.Map;

public interface ExecutableGraph {

    /**
     * 执行调度
     * @param inputs  已知的值 (数据节点ID -> 值)
     * @param outputs 期望的输出；为空时计算所有可达的数据
     * @return 解与工作流；算不出的输出不在解里，不会抛异常
     */
    DispatchResult dispatch(Map<String, ?> inputs, Collection<String> outputs);
}
