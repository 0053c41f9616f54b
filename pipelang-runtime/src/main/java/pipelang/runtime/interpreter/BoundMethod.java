package pipelang.runtime.interpreter;

import java.util.List;
import java.util.Map;

/**
 * 绑定方法（接收者 + 方法名），调用时按实参重新选择重载
 */
public final class BoundMethod implements PipeCallable {

    private final Object receiver;
    private final String name;

    public BoundMethod(Object receiver, String name) {
        this.receiver = receiver;
        this.name = name;
    }

    public Object getReceiver() {
        return receiver;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getArity() {
        return -1;
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> args, Map<String, Object> kwargs) {
        if (!kwargs.isEmpty()) {
            throw new PipeRuntimeException("Java method " + name + "() does not accept keyword arguments");
        }
        return JavaInterop.invokeMethod(receiver, name, args);
    }

    @Override
    public String toString() {
        return "<bound method " + receiver.getClass().getSimpleName() + "." + name + ">";
    }
}
