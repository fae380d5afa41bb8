package cn.hjw.dev.dispatcher.node;

import java.util.Set;

/**
 * 每个图中预留的哨兵数据节点
 */
public final class SpecialNodes {

    /** 起点：每次调度开始即以代价 0 结算，无输入函数与带默认值的数据都挂在它下面 */
    public static final String START = "start";

    /** 汇点：写入的值直接丢弃 */
    public static final String SINK = "sink";

    public static final Set<String> RESERVED = Set.of(START, SINK);

    private SpecialNodes() {
    }

    public static boolean isReserved(String id) {
        return RESERVED.contains(id);
    }
}
