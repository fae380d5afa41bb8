package cn.hjw.dev.dispatcher.node;

import cn.hjw.dev.dispatcher.config.FunctionSpec;
import cn.hjw.dev.dispatcher.config.GraphConfig;
import cn.hjw.dev.dispatcher.config.NodeGovernance;
import cn.hjw.dev.dispatcher.engine.DispatchResult;
import cn.hjw.dev.dispatcher.engine.Dispatcher;
import cn.hjw.dev.dispatcher.exception.FunctionInvocationException;
import cn.hjw.dev.dispatcher.hook.FallbackStrategy;
import cn.hjw.dev.dispatcher.processor.NodeFunction;
import cn.hjw.dev.dispatcher.processor.ResilientNodeFunction;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 函数节点治理能力测试
 * 验证：重试、降级在惰性调度下是否依然有效，且每次调度只发起一次 (带重试的) 调用
 */
@Slf4j
public class GovernanceTest {

    private static Dispatcher single(NodeFunction function, NodeGovernance governance) {
        GraphConfig config = new GraphConfig("governed");
        config.addData("req");
        config.addData("resp");
        config.addFunction(FunctionSpec.builder()
                .id("nodeA")
                .function(function)
                .input("req")
                .output("resp")
                .governance(governance)
                .build());
        return new Dispatcher(config);
    }

    /**
     * 场景 1: 测试重试机制
     */
    @Test
    public void testRetrySuccess() {
        AtomicInteger callCount = new AtomicInteger(0);

        NodeFunction unstable = input -> {
            int current = callCount.incrementAndGet();
            log.info("节点执行第 {} 次调用...", current);
            if (current <= 2) {
                throw new RuntimeException("模拟网络波动异常");
            }
            return "SuccessData";
        };

        NodeGovernance governance = NodeGovernance.builder()
                .maxRetries(3)
                .retryBackoff(20)
                .build();

        Dispatcher dispatcher = single(unstable, governance);
        Assertions.assertInstanceOf(ResilientNodeFunction.class, dispatcher.getGraph().getFunctionNode("nodeA").getFunction());

        DispatchResult result = dispatcher.dispatch(Map.of("req", "r"), List.of("resp"));

        Assertions.assertEquals("SuccessData", result.get("resp"));
        Assertions.assertEquals(3, callCount.get());
        Assertions.assertTrue(result.getWorkflow().failures().isEmpty());
    }

    /**
     * 场景 2: 测试重试耗尽后降级
     */
    @Test
    public void testRetryExhaustedWithFallback() {
        AtomicInteger callCount = new AtomicInteger(0);

        NodeFunction broken = input -> {
            callCount.incrementAndGet();
            throw new IllegalStateException("DB连接失败");
        };

        FallbackStrategy mockFallback = (functionId, input, ex) -> {
            log.error("捕获异常: {}, 执行降级...", ex.getMessage());
            return "MockData:" + functionId + ":" + input.get(0);
        };

        NodeGovernance governance = NodeGovernance.builder()
                .maxRetries(2)
                .retryBackoff(10)
                .fallbackStrategy(mockFallback)
                .build();

        DispatchResult result = single(broken, governance).dispatch(Map.of("req", "r"), List.of("resp"));

        Assertions.assertEquals("MockData:nodeA:r", result.get("resp"));
        Assertions.assertEquals(3, callCount.get());
    }

    /**
     * 场景 3: 重试耗尽且没有降级，失败记录到工作流，原始异常作为 cause
     */
    @Test
    public void testRetryExhaustedWithoutFallback() {
        AtomicInteger callCount = new AtomicInteger(0);

        NodeFunction broken = input -> {
            callCount.incrementAndGet();
            throw new IllegalStateException("永久故障");
        };

        NodeGovernance governance = NodeGovernance.builder().maxRetries(1).build();

        DispatchResult result = single(broken, governance).dispatch(Map.of("req", "r"), List.of("resp"));

        Assertions.assertFalse(result.contains("resp"));
        Assertions.assertEquals(2, callCount.get());
        Throwable failure = result.getWorkflow().failures().get("nodeA");
        Assertions.assertInstanceOf(FunctionInvocationException.class, failure);
        Assertions.assertEquals("永久故障", failure.getCause().getMessage());
    }

    /**
     * 场景 4: 没有实际内容的治理方案不包装函数
     */
    @Test
    public void testIneffectiveGovernanceIsIgnored() {
        NodeFunction plain = input -> "ok";
        Dispatcher dispatcher = single(plain, NodeGovernance.builder().build());

        Assertions.assertSame(plain, dispatcher.getGraph().getFunctionNode("nodeA").getFunction());
        Assertions.assertEquals("ok", dispatcher.dispatch(Map.of("req", 1), List.of("resp")).get("resp"));
    }
}
