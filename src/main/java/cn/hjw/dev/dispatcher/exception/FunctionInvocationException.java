package cn.hjw.dev.dispatcher.exception;

import lombok.Getter;

/**
 * 函数节点调用失败的包装
 * 只在一次调度内部流转：由执行器捕获，挂到 Workflow 的失败标注上，不会抛出 dispatch
 */
@Getter
public class FunctionInvocationException extends DispatcherException {

    private final String functionId;

    public FunctionInvocationException(String functionId, String message) {
        super(message);
        this.functionId = functionId;
    }

    public FunctionInvocationException(String functionId, Throwable cause) {
        super("Function invocation failed: " + functionId, cause);
        this.functionId = functionId;
    }
}
