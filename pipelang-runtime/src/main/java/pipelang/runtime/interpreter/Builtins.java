package pipelang.runtime.interpreter;

import com.pipelang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pipelang.ir.pipe.PipeRewriter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * 全局内置函数与值的字符串表示
 */
public final class Builtins {

    private Builtins() {}

    /**
     * 注册内置函数到环境
     */
    public static void register(Environment env) {
        env.define("print", NativeFunction.varargs("print", (interp, args, kwargs) -> {
            String sep = kwargs.containsKey("sep") ? str(kwargs.get("sep")) : " ";
            String end = kwargs.containsKey("end") ? str(kwargs.get("end")) : "\n";
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(sep);
                sb.append(str(args.get(i)));
            }
            sb.append(end);
            interp.getStdout().print(sb);
            interp.getStdout().flush();
            return null;
        }));

        // tap(value, fn): 以 value 调用 fn 做副作用，返回 value 本身
        env.define("tap", new NativeFunction("tap", 2, (interp, args, kwargs) -> {
            interp.callValue(args.get(1), Collections.singletonList(args.get(0)), Collections.emptyMap());
            return args.get(0);
        }));

        env.define(PipeRewriter.DEBUG_TAP_FUNCTION, new NativeFunction(PipeRewriter.DEBUG_TAP_FUNCTION, 1,
                (interp, args, kwargs) -> {
                    interp.getDebugObserver().accept(args.get(0));
                    return args.get(0);
                }));

        env.define("len", NativeFunction.create("len", Builtins::len));
        env.define("range", NativeFunction.varargs("range", (interp, args, kwargs) -> range(args)));
        env.define("sum", NativeFunction.varargs("sum", (interp, args, kwargs) -> {
            if (args.isEmpty() || args.size() > 2) {
                throw new PipeRuntimeException("sum() takes 1 or 2 arguments (" + args.size() + " given)");
            }
            Object total = args.size() == 2 ? args.get(1) : kwargs.getOrDefault("start", 0L);
            for (Object item : iterate(args.get(0))) {
                total = BinaryOps.apply(BinaryOp.ADD, total, item);
            }
            return total;
        }));
        env.define("min", NativeFunction.varargs("min", (interp, args, kwargs) -> extreme("min", args, -1)));
        env.define("max", NativeFunction.varargs("max", (interp, args, kwargs) -> extreme("max", args, 1)));
        env.define("abs", NativeFunction.create("abs", BinaryOps::abs));
        env.define("pow", NativeFunction.create("pow", BinaryOps::pow));

        env.define("str", NativeFunction.varargs("str", (interp, args, kwargs) ->
                args.isEmpty() ? "" : str(single("str", args))));
        env.define("repr", NativeFunction.create("repr", Builtins::repr));
        env.define("bool", NativeFunction.varargs("bool", (interp, args, kwargs) ->
                !args.isEmpty() && BinaryOps.isTruthy(single("bool", args))));
        env.define("int", NativeFunction.varargs("int", (interp, args, kwargs) ->
                args.isEmpty() ? 0L : toInt(single("int", args))));
        env.define("float", NativeFunction.varargs("float", (interp, args, kwargs) ->
                args.isEmpty() ? 0.0 : toFloat(single("float", args))));
        env.define("list", NativeFunction.varargs("list", (interp, args, kwargs) ->
                args.isEmpty() ? new ArrayList<>() : toList(single("list", args))));
        env.define("tuple", NativeFunction.varargs("tuple", (interp, args, kwargs) ->
                args.isEmpty() ? PipeTuple.of() : PipeTuple.copyOf(toList(single("tuple", args)))));
        env.define("set", NativeFunction.varargs("set", (interp, args, kwargs) ->
                args.isEmpty() ? new LinkedHashSet<>() : toSet(single("set", args))));
        env.define("sorted", NativeFunction.varargs("sorted", (interp, args, kwargs) -> {
            List<Object> items = toList(single("sorted", args));
            items.sort(BinaryOps::compare);
            if (BinaryOps.isTruthy(kwargs.get("reverse"))) Collections.reverse(items);
            return items;
        }));
    }

    // ============ 字符串表示 ============

    /**
     * str(value)：字符串原样输出，其余同 {@link #repr}
     */
    public static String str(Object value) {
        if (value instanceof String) return (String) value;
        return repr(value);
    }

    /**
     * repr(value)
     */
    public static String repr(Object value) {
        if (value == null) return "None";
        if (value instanceof Boolean) return (Boolean) value ? "True" : "False";
        if (value instanceof Double || value instanceof Float) return formatFloat(((Number) value).doubleValue());
        if (value instanceof String) return quote((String) value);
        if (value instanceof PipeTuple) {
            PipeTuple tuple = (PipeTuple) value;
            if (tuple.size() == 1) return "(" + repr(tuple.get(0)) + ",)";
            return join("(", tuple, ")");
        }
        if (value instanceof List) return join("[", (List<?>) value, "]");
        if (value instanceof Set) {
            Set<?> set = (Set<?>) value;
            return set.isEmpty() ? "set()" : join("{", set, "}");
        }
        if (value instanceof Map) {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!first) sb.append(", ");
                sb.append(repr(entry.getKey())).append(": ").append(repr(entry.getValue()));
                first = false;
            }
            return sb.append("}").toString();
        }
        return String.valueOf(value);
    }

    private static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e16) {
            return (long) d + ".0";
        }
        return Double.toString(d);
    }

    private static String quote(String s) {
        String quote = s.contains("'") && !s.contains("\"") ? "\"" : "'";
        StringBuilder sb = new StringBuilder(quote);
        for (char c : s.toCharArray()) {
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                default:
                    if (String.valueOf(c).equals(quote)) sb.append('\\');
                    sb.append(c);
            }
        }
        return sb.append(quote).toString();
    }

    private static String join(String open, Collection<?> items, String close) {
        StringBuilder sb = new StringBuilder(open);
        boolean first = true;
        for (Object item : items) {
            if (!first) sb.append(", ");
            sb.append(repr(item));
            first = false;
        }
        return sb.append(close).toString();
    }

    // ============ 迭代与转换 ============

    /**
     * 把值视为可迭代对象：集合、字典（键）、字符串（逐字符）
     */
    public static Iterable<Object> iterate(Object value) {
        if (value instanceof Iterable) {
            @SuppressWarnings("unchecked")
            Iterable<Object> iterable = (Iterable<Object>) value;
            return iterable;
        }
        if (value instanceof Map) {
            @SuppressWarnings("unchecked")
            Iterable<Object> keys = ((Map<Object, Object>) value).keySet();
            return keys;
        }
        if (value instanceof String) {
            String s = (String) value;
            return () -> new Iterator<Object>() {
                private int index;

                @Override
                public boolean hasNext() {
                    return index < s.length();
                }

                @Override
                public Object next() {
                    if (index >= s.length()) throw new NoSuchElementException();
                    return String.valueOf(s.charAt(index++));
                }
            };
        }
        if (value instanceof Object[]) {
            return toList(JavaInterop.normalize(value));
        }
        throw new PipeRuntimeException("'" + BinaryOps.typeName(value) + "' object is not iterable");
    }

    static List<Object> toList(Object value) {
        List<Object> list = new ArrayList<>();
        for (Object item : iterate(value)) list.add(item);
        return list;
    }

    static Set<Object> toSet(Object value) {
        Set<Object> set = new LinkedHashSet<>();
        for (Object item : iterate(value)) set.add(item);
        return set;
    }

    private static Object single(String name, List<Object> args) {
        if (args.size() != 1) {
            throw new PipeRuntimeException(name + "() takes at most 1 argument (" + args.size() + " given)");
        }
        return args.get(0);
    }

    private static Object len(Object value) {
        if (value instanceof String) return (long) ((String) value).length();
        if (value instanceof Collection) return (long) ((Collection<?>) value).size();
        if (value instanceof Map) return (long) ((Map<?, ?>) value).size();
        throw new PipeRuntimeException("object of type '" + BinaryOps.typeName(value) + "' has no len()");
    }

    private static List<Object> range(List<Object> args) {
        if (args.isEmpty() || args.size() > 3) {
            throw new PipeRuntimeException("range expected 1 to 3 arguments, got " + args.size());
        }
        for (Object arg : args) {
            if (!BinaryOps.isIntegral(arg)) {
                throw new PipeRuntimeException("'" + BinaryOps.typeName(arg) + "' object cannot be interpreted as an integer");
            }
        }
        long start = args.size() == 1 ? 0 : BinaryOps.asLong(args.get(0));
        long stop = BinaryOps.asLong(args.get(args.size() == 1 ? 0 : 1));
        long step = args.size() == 3 ? BinaryOps.asLong(args.get(2)) : 1;
        if (step == 0) throw new PipeRuntimeException("range() arg 3 must not be zero");
        List<Object> result = new ArrayList<>();
        for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
            result.add(i);
        }
        return result;
    }

    private static Object extreme(String name, List<Object> args, int sign) {
        List<Object> items = args.size() == 1 ? toList(args.get(0)) : args;
        if (items.isEmpty()) throw new PipeRuntimeException(name + "() arg is an empty sequence");
        Object best = items.get(0);
        for (Object item : items) {
            if (BinaryOps.compare(item, best) * sign > 0) best = item;
        }
        return best;
    }

    private static Object toInt(Object value) {
        if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new PipeRuntimeException("cannot convert float " + formatFloat(d) + " to integer");
            }
            return (long) d;
        }
        if (BinaryOps.isIntegral(value)) return BinaryOps.asLong(value);
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).strip().replace("_", ""));
            } catch (NumberFormatException e) {
                throw new PipeRuntimeException("invalid literal for int() with base 10: " + repr(value), e);
            }
        }
        throw new PipeRuntimeException("int() argument must be a string or a number, not '"
                + BinaryOps.typeName(value) + "'");
    }

    private static Object toFloat(Object value) {
        if (BinaryOps.isNumber(value)) return BinaryOps.asDouble(value);
        if (value instanceof String) {
            String s = ((String) value).strip().toLowerCase();
            if (s.equals("inf") || s.equals("+inf")) return Double.POSITIVE_INFINITY;
            if (s.equals("-inf")) return Double.NEGATIVE_INFINITY;
            if (s.equals("nan")) return Double.NaN;
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                throw new PipeRuntimeException("could not convert string to float: " + repr(value), e);
            }
        }
        throw new PipeRuntimeException("float() argument must be a string or a number, not '"
                + BinaryOps.typeName(value) + "'");
    }
}
