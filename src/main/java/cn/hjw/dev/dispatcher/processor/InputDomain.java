package cn.hjw.dev.dispatcher.processor;

import java.util.Map;

/**
 * 输入域谓词 (守卫)
 * 只看调用方原始提供的输入，不看中间结算结果；返回 false 时该函数节点在本次调度中被永久丢弃
 */
@FunctionalInterface
public interface InputDomain {

    /**
     * @param inputs 调用方传入的原始输入 (只读)
     * @return true: 节点可参与本次调度; false: 丢弃
     */
    boolean test(Map<String, Object> inputs);
}
