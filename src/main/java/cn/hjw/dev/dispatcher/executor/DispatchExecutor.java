package cn.hjw.dev.dispatcher.executor;

import cn.hjw.dev.dispatcher.compile.CapabilityGraph;
import cn.hjw.dev.dispatcher.compile.GraphCompiler;
import cn.hjw.dev.dispatcher.engine.DispatchResult;
import cn.hjw.dev.dispatcher.exception.FunctionInvocationException;
import cn.hjw.dev.dispatcher.node.DataNode;
import cn.hjw.dev.dispatcher.node.FunctionNode;
import cn.hjw.dev.dispatcher.node.SpecialNodes;
import cn.hjw.dev.dispatcher.processor.UpstreamInput;
import cn.hjw.dev.dispatcher.workflow.SettlementSource;
import cn.hjw.dev.dispatcher.workflow.WorkflowRecorder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * 解析执行器：带权 AND/OR 图上的最优优先搜索
 * <p>
 * 数据节点是 OR 语义 (任一生产者即可)，函数节点是 AND 语义 (全部输入结算)。
 * 本质是推广到二分图的 Dijkstra：
 * <ol>
 *   <li>候选按 (代价, 来源等级, 注册顺序, 入队序号) 出队，同一数据允许重复入队，出队时已结算则跳过</li>
 *   <li>函数的候选代价 = 权重 + max(各输入的结算代价)</li>
 *   <li>函数在它的某个输出第一次出队时才真正调用 (惰性)，每次调度最多调用一次</li>
 *   <li>调用失败只丢弃该函数，其他生产者仍可结算同一输出</li>
 *   <li>指定了输出时，只有能 (间接) 生产这些输出的函数才会入队</li>
 * </ol>
 * 执行器本身无状态，所有运行态都在每次调用新建的 {@link Run} 里。
 */
@Slf4j
public class DispatchExecutor {

    // 来源等级：同代价时 输入 > 函数结果 > 默认值
    private static final int RANK_INPUT = 0;
    private static final int RANK_FUNCTION = 1;
    private static final int RANK_DEFAULT = 2;

    private final CapabilityGraph graph;

    public DispatchExecutor(CapabilityGraph graph) {
        this.graph = graph;
    }

    public DispatchResult execute(Map<String, ?> inputs, Collection<String> outputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(outputs, "outputs must not be null");
        return new Run(inputs, outputs).resolve();
    }

    /**
     * 一次调度的全部运行态
     */
    private final class Run {

        private final Map<String, Object> rawInputs;
        private final Set<String> requested;
        // 已注册且本次可达、尚未结算的请求输出
        private final Set<String> targets = new LinkedHashSet<>();
        private boolean stopEarly;
        // 为 null 表示不限制 (未指定输出)
        private Set<String> relevant;

        private final PriorityQueue<Candidate> queue = new PriorityQueue<>();
        private final Map<String, Settlement> settled = new LinkedHashMap<>();

        // 函数ID -> 还没结算的等待输入个数
        private final Map<String, Integer> pending = new HashMap<>();
        // 函数ID -> 需要等待的输入
        private final Map<String, Set<String>> awaited = new HashMap<>();
        private final Set<String> ready = new HashSet<>();
        private final Set<String> discarded = new HashSet<>();
        private final Map<String, Boolean> domainCache = new HashMap<>();
        // 输入域求值异常，等函数就绪时再记录
        private final Map<String, RuntimeException> domainErrors = new HashMap<>();
        private final Map<String, Invocation> invocations = new HashMap<>();
        // 所有输入都等不到的子调度器，改挂在 START 上
        private final List<String> startConsumers = new ArrayList<>();

        private final WorkflowRecorder recorder = new WorkflowRecorder();

        private boolean deferredDefaultsPushed;
        private long sequence;

        Run(Map<String, ?> inputs, Collection<String> outputs) {
            this.rawInputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
            this.requested = new LinkedHashSet<>(outputs);
        }

        DispatchResult resolve() {
            Set<String> reachable = reachableData();
            selectTargets(reachable);
            prepareSubDispatchers(reachable);
            seed();

            while (!isSatisfied()) {
                Candidate candidate = queue.poll();
                if (candidate == null) {
                    // 队列耗尽：依次尝试延迟默认值、强制触发子调度器
                    if (flushDeferred()) {
                        continue;
                    }
                    break;
                }
                if (settled.containsKey(candidate.getDataId())) {
                    continue;
                }
                if (candidate.getProducer() == null) {
                    settle(candidate, candidate.getValue());
                    continue;
                }
                Invocation invocation = invoke(candidate.getProducer());
                if (invocation.isFailed() || !invocation.getOutputs().containsKey(candidate.getDataId())) {
                    continue;
                }
                settle(candidate, invocation.getOutputs().get(candidate.getDataId()));
            }

            Map<String, Object> solution = new LinkedHashMap<>();
            settled.forEach((id, settlement) -> {
                if (!SpecialNodes.isReserved(id)) {
                    solution.put(id, settlement.getValue());
                }
            });
            List<String> missing = new ArrayList<>();
            for (String id : requested) {
                if (!solution.containsKey(id)) {
                    missing.add(id);
                }
            }
            if (!missing.isEmpty()) {
                log.info("Dispatch on [{}] finished without {}", graph.getName(), missing);
            }
            log.debug("Dispatch on [{}] settled {} data nodes, invoked {} functions",
                    graph.getName(), solution.size(), invocations.size());
            return new DispatchResult(solution, recorder.toWorkflow());
        }

        private boolean isSatisfied() {
            return stopEarly && targets.isEmpty();
        }

        private boolean isRelevant(String fnId) {
            return relevant == null || relevant.contains(fnId);
        }

        // ------------------------------------------------------------ 初始化

        /**
         * 未注册或本次不可达的请求输出不参与停止判断，只出现在 missing 里；
         * 从可达的请求输出反向收集生产它们的函数 (含子调度器)
         */
        private void selectTargets(Set<String> reachable) {
            if (requested.isEmpty()) {
                return;
            }
            for (String id : requested) {
                if (graph.containsData(id) && !SpecialNodes.isReserved(id) && reachable.contains(id)) {
                    targets.add(id);
                } else {
                    log.debug("Requested [{}] cannot be settled in [{}]", id, graph.getName());
                }
            }
            stopEarly = !targets.isEmpty();

            relevant = new HashSet<>();
            Deque<String> open = new ArrayDeque<>(targets);
            Set<String> visited = new HashSet<>(targets);
            while (!open.isEmpty()) {
                String dataId = open.poll();
                for (String fnId : graph.producersOf(dataId)) {
                    if (!relevant.add(fnId)) {
                        continue;
                    }
                    for (String input : graph.getFunctionNode(fnId).getInputs()) {
                        if (visited.add(input)) {
                            open.add(input);
                        }
                    }
                }
            }
        }

        private void seed() {
            push(new Candidate(SpecialNodes.START, 0, RANK_INPUT, 0, nextSequence(), null, null, SettlementSource.INPUT));

            rawInputs.forEach((id, value) -> {
                if (!graph.containsData(id) || SpecialNodes.isReserved(id)) {
                    log.debug("Input [{}] is not a data node of [{}], only visible to input domains", id, graph.getName());
                    return;
                }
                push(new Candidate(id, 0, RANK_INPUT, 0, nextSequence(), null, value, SettlementSource.INPUT));
            });

            for (DataNode data : graph.getDataNodes().values()) {
                if (data.hasDefault() && !data.isWaitInput() && !rawInputs.containsKey(data.getId())) {
                    pushDefault(data);
                }
            }
        }

        /**
         * 子调度器只等待本次调度中结构上可能结算的映射输入；
         * 同时是它自身输出的输入，只有调用方提供 (或有默认值) 时才等待
         */
        private void prepareSubDispatchers(Set<String> reachable) {
            List<FunctionNode> subDispatchers = new ArrayList<>();
            for (FunctionNode fn : graph.getFunctionNodes().values()) {
                if (fn.isSubDispatcher()) {
                    subDispatchers.add(fn);
                }
            }
            if (subDispatchers.isEmpty()) {
                return;
            }

            for (FunctionNode fn : subDispatchers) {
                Set<String> waits = new LinkedHashSet<>();
                if (fn.getInputs().isEmpty()) {
                    waits.add(SpecialNodes.START);
                } else {
                    Set<String> own = new HashSet<>(fn.getOutputs());
                    for (String input : fn.getInputs()) {
                        if (!reachable.contains(input)) {
                            continue;
                        }
                        if (own.contains(input) && !isSupplied(input)) {
                            continue;
                        }
                        waits.add(input);
                    }
                    if (waits.isEmpty()) {
                        waits.add(SpecialNodes.START);
                        startConsumers.add(fn.getId());
                    }
                }
                awaited.put(fn.getId(), waits);
            }
        }

        /**
         * 不计代价的前向可达分析：输入、默认值出发，函数全部输入可达则输出可达，子调度器只要可执行即视为输出可达
         */
        private Set<String> reachableData() {
            Set<String> reach = new HashSet<>();
            reach.add(SpecialNodes.START);
            for (DataNode data : graph.getDataNodes().values()) {
                if (data.hasDefault() || rawInputs.containsKey(data.getId())) {
                    reach.add(data.getId());
                }
            }

            boolean changed = true;
            while (changed) {
                changed = false;
                for (FunctionNode fn : graph.getFunctionNodes().values()) {
                    boolean fires = fn.isSubDispatcher() || reach.containsAll(GraphCompiler.requiredInputs(fn));
                    if (!fires || !domainAllows(fn)) {
                        continue;
                    }
                    for (String output : fn.getOutputs()) {
                        changed |= reach.add(output);
                    }
                }
            }
            return reach;
        }

        private boolean isSupplied(String dataId) {
            DataNode data = graph.getDataNode(dataId);
            return rawInputs.containsKey(dataId) || (data != null && data.hasDefault());
        }

        // ------------------------------------------------------------ 结算与松弛

        private void settle(Candidate candidate, Object value) {
            String id = candidate.getDataId();
            settled.put(id, new Settlement(value, candidate.getCost(), candidate.getProducer()));
            targets.remove(id);

            if (SpecialNodes.START.equals(id)) {
                graph.consumersOf(id).forEach(fnId -> onInputSettled(fnId, id));
                startConsumers.forEach(fnId -> onInputSettled(fnId, id));
                return;
            }

            String via = candidate.getProducer() != null ? candidate.getProducer() : SpecialNodes.START;
            recorder.recordSettlement(id, value, via, candidate.getCost(), candidate.getSource());
            log.debug("Settled [{}] at cost {} via [{}]", id, candidate.getCost(), via);

            for (String fnId : graph.consumersOf(id)) {
                onInputSettled(fnId, id);
            }
        }

        private void onInputSettled(String fnId, String dataId) {
            if (!isRelevant(fnId) || discarded.contains(fnId) || ready.contains(fnId)) {
                return;
            }
            FunctionNode fn = graph.getFunctionNode(fnId);
            Set<String> waits = awaitedInputs(fn);
            if (!waits.contains(dataId)) {
                return;
            }
            int remaining = pending.getOrDefault(fnId, waits.size()) - 1;
            pending.put(fnId, remaining);
            if (remaining == 0) {
                activate(fn);
            }
        }

        private Set<String> awaitedInputs(FunctionNode fn) {
            return awaited.computeIfAbsent(fn.getId(), k -> GraphCompiler.requiredInputs(fn));
        }

        /**
         * 函数的等待输入全部结算：校验输入域，计算候选代价并把输出放入队列
         */
        private void activate(FunctionNode fn) {
            if (!isEligible(fn)) {
                discarded.add(fn.getId());
                log.debug("Function [{}] is outside its input domain, discarded", fn.getId());
                return;
            }
            ready.add(fn.getId());

            double slowest = 0;
            for (String input : awaitedInputs(fn)) {
                Settlement settlement = settled.get(input);
                if (settlement != null) {
                    slowest = Math.max(slowest, settlement.getCost());
                }
            }
            double cost = fn.getWeight() + slowest;

            for (String output : new LinkedHashSet<>(fn.getOutputs())) {
                if (SpecialNodes.SINK.equals(output) || settled.containsKey(output)) {
                    continue;
                }
                push(new Candidate(output, cost, RANK_FUNCTION, fn.getOrder(), nextSequence(),
                        fn.getId(), null, SettlementSource.FUNCTION));
            }
            log.debug("Function [{}] is ready at cost {}", fn.getId(), cost);
        }

        /**
         * 函数就绪时的输入域校验，求值异常在这里记录为失败
         */
        private boolean isEligible(FunctionNode fn) {
            if (domainAllows(fn)) {
                return true;
            }
            RuntimeException error = domainErrors.remove(fn.getId());
            if (error != null) {
                log.warn("Input domain of [{}] failed, function discarded. Cause: {}", fn.getId(), error.getMessage());
                recorder.recordFailure(fn.getId(), new FunctionInvocationException(fn.getId(), error));
            }
            return false;
        }

        // 每次调度每个输入域最多求值一次，不写工作流
        private boolean domainAllows(FunctionNode fn) {
            if (fn.getInputDomain() == null) {
                return true;
            }
            return domainCache.computeIfAbsent(fn.getId(), id -> {
                try {
                    return fn.getInputDomain().test(rawInputs);
                } catch (RuntimeException e) {
                    domainErrors.put(id, e);
                    return false;
                }
            });
        }

        /**
         * 队列耗尽时的补充工作
         * @return true: 队列里又有了候选
         */
        private boolean flushDeferred() {
            if (!deferredDefaultsPushed) {
                deferredDefaultsPushed = true;
                for (DataNode data : graph.getDataNodes().values()) {
                    if (data.hasDefault() && data.isWaitInput() && !settled.containsKey(data.getId())
                            && !rawInputs.containsKey(data.getId())) {
                        pushDefault(data);
                    }
                }
                if (!queue.isEmpty()) {
                    return true;
                }
            }

            // 有输入永远等不到的子调度器，用已结算的那部分输入强制触发
            for (FunctionNode fn : graph.getFunctionNodes().values()) {
                if (!fn.isSubDispatcher() || !isRelevant(fn.getId())
                        || ready.contains(fn.getId()) || discarded.contains(fn.getId())) {
                    continue;
                }
                boolean anySettled = awaitedInputs(fn).stream().anyMatch(settled::containsKey);
                if (anySettled) {
                    log.debug("Forcing sub-dispatcher [{}] with partially settled inputs", fn.getId());
                    activate(fn);
                }
            }
            return !queue.isEmpty();
        }

        // ------------------------------------------------------------ 惰性调用

        private Invocation invoke(String fnId) {
            Invocation cached = invocations.get(fnId);
            if (cached != null) {
                return cached;
            }
            FunctionNode fn = graph.getFunctionNode(fnId);
            SimpleUpstreamInput input = collectInputs(fn);

            Invocation invocation;
            try {
                Object raw = fn.getFunction().process(input);
                Map<String, Object> produced = fn.toOutputs(raw);
                recorder.recordInvocation(fnId, input.getData(), produced);
                if (fn.isSubDispatcher() && raw instanceof DispatchResult) {
                    recorder.recordSubWorkflow(fnId, ((DispatchResult) raw).getWorkflow());
                }
                invocation = Invocation.success(produced);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                FunctionInvocationException failure = e instanceof FunctionInvocationException
                        ? (FunctionInvocationException) e
                        : new FunctionInvocationException(fnId, e);
                log.warn("Function [{}] failed, its outputs stay unresolved. Cause: {}", fnId, e.getMessage());
                recorder.recordFailure(fnId, input.getData(), failure);
                discarded.add(fnId);
                invocation = Invocation.failure(failure);
            }
            invocations.put(fnId, invocation);
            return invocation;
        }

        /**
         * 普通函数按声明顺序取全部输入；子调度器只取已经结算的映射输入
         */
        private SimpleUpstreamInput collectInputs(FunctionNode fn) {
            List<Object> positional = new ArrayList<>();
            Map<String, Object> byId = new LinkedHashMap<>();
            for (String input : fn.getInputs()) {
                Settlement settlement = settled.get(input);
                if (settlement == null) {
                    continue;
                }
                positional.add(settlement.getValue());
                byId.putIfAbsent(input, settlement.getValue());
            }
            return new SimpleUpstreamInput(positional, byId);
        }

        private void pushDefault(DataNode data) {
            push(new Candidate(data.getId(), 0, RANK_DEFAULT, 0, nextSequence(), null,
                    data.getDefaultValue(), SettlementSource.DEFAULT));
        }

        private void push(Candidate candidate) {
            queue.add(candidate);
        }

        private long nextSequence() {
            return sequence++;
        }
    }

    // --- 内部状态封装 ---

    @Getter
    @RequiredArgsConstructor
    private static final class Candidate implements Comparable<Candidate> {
        private final String dataId;
        private final double cost;
        private final int rank;
        private final int order;
        private final long sequence;
        // 为 null 表示来自输入、默认值或 START
        private final String producer;
        private final Object value;
        private final SettlementSource source;

        @Override
        public int compareTo(Candidate other) {
            int c = Double.compare(cost, other.cost);
            if (c != 0) {
                return c;
            }
            c = Integer.compare(rank, other.rank);
            if (c != 0) {
                return c;
            }
            c = Integer.compare(order, other.order);
            if (c != 0) {
                return c;
            }
            return Long.compare(sequence, other.sequence);
        }
    }

    @Getter
    @RequiredArgsConstructor
    private static final class Settlement {
        private final Object value;
        private final double cost;
        private final String producer;
    }

    @Getter
    @RequiredArgsConstructor
    private static final class Invocation {
        private final Map<String, Object> outputs;
        private final FunctionInvocationException failure;

        static Invocation success(Map<String, Object> outputs) { return new Invocation(outputs, null); }
        static Invocation failure(FunctionInvocationException failure) { return new Invocation(Map.of(), failure); }

        boolean isFailed() {
            return failure != null;
        }
    }

    // 内部类：UpstreamInput 实现
    @RequiredArgsConstructor
    private static class SimpleUpstreamInput implements UpstreamInput {
        private final List<Object> positional;
        @Getter
        private final Map<String, Object> data;

        @Override
        @SuppressWarnings("unchecked")
        public <V> V get(int index) {
            return (V) positional.get(index);
        }

        @Override
        public <V> V get(int index, Class<V> type) {
            return cast("#" + index, positional.get(index), type);
        }

        @Override
        public <V> V get(String dataId, Class<V> type) {
            return cast(dataId, data.get(dataId), type);
        }

        @Override
        @SuppressWarnings("unchecked")
        public <V> V get(String dataId) {
            return (V) data.get(dataId);
        }

        @Override
        public boolean contains(String dataId) {
            return data.containsKey(dataId);
        }

        @Override
        public int size() {
            return positional.size();
        }

        @Override
        public List<Object> values() {
            return Collections.unmodifiableList(positional);
        }

        private static <V> V cast(String key, Object obj, Class<V> type) {
            if (obj == null) {
                return null;
            }
            if (!type.isInstance(obj)) {
                throw new ClassCastException("Input [" + key + "] is " + obj.getClass().getName() + ", expected " + type.getName());
            }
            return type.cast(obj);
        }
    }
}
