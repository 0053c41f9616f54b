package pipelang.runtime.interpreter;

import java.util.List;
import java.util.Map;

/**
 * 原生（Java）函数
 */
public final class NativeFunction implements PipeCallable {

    /**
     * 原生函数接口
     */
    @FunctionalInterface
    public interface NativeFunc {
        Object apply(Interpreter interpreter, List<Object> args, Map<String, Object> kwargs);
    }

    @FunctionalInterface
    public interface NativeFunc1 {
        Object apply(Object arg);
    }

    @FunctionalInterface
    public interface NativeFunc2 {
        Object apply(Object a, Object b);
    }

    private final String name;
    private final int arity;
    private final NativeFunc function;

    public NativeFunction(String name, int arity, NativeFunc function) {
        this.name = name;
        this.arity = arity;
        this.function = function;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getArity() {
        return arity;
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> args, Map<String, Object> kwargs) {
        if (arity >= 0 && args.size() != arity) {
            throw new PipeRuntimeException(name + "() takes " + arity + " positional argument"
                    + (arity == 1 ? "" : "s") + " but " + args.size() + " were given");
        }
        return function.apply(interpreter, args, kwargs);
    }

    @Override
    public String toString() {
        return "<native function " + name + ">";
    }

    // ============ 便捷工厂方法 ============

    public static NativeFunction create(String name, NativeFunc1 func) {
        return new NativeFunction(name, 1, (interp, args, kwargs) -> func.apply(args.get(0)));
    }

    public static NativeFunction create(String name, NativeFunc2 func) {
        return new NativeFunction(name, 2, (interp, args, kwargs) -> func.apply(args.get(0), args.get(1)));
    }

    public static NativeFunction varargs(String name, NativeFunc func) {
        return new NativeFunction(name, -1, func);
    }
}
