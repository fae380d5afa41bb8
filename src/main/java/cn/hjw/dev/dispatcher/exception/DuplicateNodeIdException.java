package cn.hjw.dev.dispatcher.exception;

import lombok.Getter;

/**
 * 注册节点时显式指定的 ID 已被占用 (数据节点与函数节点共享同一命名空间)
 */
@Getter
public class DuplicateNodeIdException extends DispatcherException {

    private final String nodeId;

    public DuplicateNodeIdException(String nodeId) {
        super("Node id already registered: " + nodeId);
        this.nodeId = nodeId;
    }
}
