package cn.hjw.dev.dispatcher.exception;

import lombok.Getter;

/**
 * 连线时引用了未注册的数据节点
 */
@Getter
public class UnknownNodeException extends DispatcherException {

    private final String nodeId;

    public UnknownNodeException(String nodeId, String context) {
        super("Unknown node [" + nodeId + "] referenced by " + context);
        this.nodeId = nodeId;
    }
}
