package pipelang.runtime.interpreter;

import java.util.List;
import java.util.Map;

/**
 * 可调用对象接口
 */
public interface PipeCallable {

    /**
     * 获取函数名称
     */
    String getName();

    /**
     * 获取参数数量（-1 表示可变参数）
     */
    int getArity();

    /**
     * 调用函数
     *
     * @param interpreter 解释器实例
     * @param args 位置参数
     * @param kwargs 命名参数（无命名参数时为空 Map）
     * @return 返回值
     */
    Object call(Interpreter interpreter, List<Object> args, Map<String, Object> kwargs);
}
