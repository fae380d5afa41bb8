package cn.hjw.dev.dispatcher.exception;

/**
 * 调度器异常基类 (非受检)
 * 构建期异常直接抛给调用方；运行期异常由执行器捕获并记录到 Workflow，不会穿透 dispatch
 */
public class DispatcherException extends RuntimeException {

    public DispatcherException(String message) {
        super(message);
    }

    public DispatcherException(String message, Throwable cause) {
        super(message, cause);
    }
}
