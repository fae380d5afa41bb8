package cn.hjw.dev.dispatcher.exception;

// 非法注册：无输出、权重为负、START/SINK 用错位置等
public class MalformedGraphException extends DispatcherException {

    public MalformedGraphException(String message) {
        super(message);
    }
}
