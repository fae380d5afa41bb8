package cn.hjw.dev.dispatcher.processor;

import java.util.List;

/**
 * 上游数据访问器
 * 提供给函数节点的只读视图，可以按位置或按数据节点 ID 取值
 */
public interface UpstreamInput {

    /**
     * 按声明位置获取输入
     * @param index 输入位置
     * @return 输入值 (依靠泛型推断)
     * @throws IndexOutOfBoundsException 位置越界
     */
    <T> T get(int index);

    <T> T get(int index, Class<T> type);

    /**
     * 按数据节点 ID 获取输入
     * @param dataId 数据节点ID
     * @param type   期望的结果类型
     * @return 结果对象，未结算时为 null
     * @throws ClassCastException 如果类型不匹配
     */
    <T> T get(String dataId, Class<T> type);

    <T> T get(String dataId);

    /**
     * 子调度器只拿到已结算的那部分输入，用它区分"没有值"与"值为 null"
     */
    boolean contains(String dataId);

    int size();

    List<Object> values();
}
