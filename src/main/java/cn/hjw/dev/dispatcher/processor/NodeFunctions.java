package cn.hjw.dev.dispatcher.processor;

/**
 * 常用函数
 */
public final class NodeFunctions {

    private NodeFunctions() {
    }

    /**
     * 原样透传：单输入返回该值，多输入返回按位置排列的 List
     */
    public static NodeFunction bypass() {
        return named("bypass", input -> input.size() == 1 ? input.<Object>get(0) : input.values());
    }

    /**
     * 给 lambda 起名，用于派生函数节点 ID
     */
    public static NodeFunction named(String name, NodeFunction function) {
        return new NodeFunction() {
            @Override
            public Object process(UpstreamInput input) throws Exception {
                return function.process(input);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
