package cn.hjw.dev.dispatcher.node;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 数据节点：图中一个具名的值槽位
 * <p>
 * 默认值是最弱的来源：同代价时函数结果优先；设置了 waitInput 的默认值只有在队列耗尽、
 * 仍没有任何生产者结算该节点时才会使用。
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class DataNode {

    /** 无默认值标记，允许 null 作为合法的默认值 */
    public static final Object NO_DEFAULT = new Object() {
        @Override
        public String toString() {
            return "<none>";
        }
    };

    private final String id;

    @Builder.Default
    private final Object defaultValue = NO_DEFAULT;

    @Builder.Default
    private final boolean waitInput = false;

    private final String description;

    public boolean hasDefault() {
        return defaultValue != NO_DEFAULT;
    }

    public static DataNode of(String id) {
        return DataNode.builder().id(id).build();
    }
}
