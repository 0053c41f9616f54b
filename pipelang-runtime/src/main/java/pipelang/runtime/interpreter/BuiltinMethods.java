package pipelang.runtime.interpreter;

import com.pipelang.compiler.ast.expr.BinaryExpr.BinaryOp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内置值（str / list / dict / set）上的方法
 *
 * <p>名称与脚本侧保持一致（{@code s.upper()}、{@code d.items()} ...），
 * 未命中时解释器回退到 {@link JavaInterop}。</p>
 */
final class BuiltinMethods {

    /** 未命中 */
    static final Object NOT_FOUND = new Object();

    private BuiltinMethods() {}

    /**
     * 调用内置方法
     *
     * @return 结果，未定义该方法时返回 {@link #NOT_FOUND}
     */
    static Object invoke(Object receiver, String name, List<Object> args) {
        if (receiver instanceof String) return stringMethod((String) receiver, name, args);
        if (receiver instanceof PipeTuple) return sequenceMethod((PipeTuple) receiver, name, args);
        if (receiver instanceof List) return listMethod(receiver, name, args);
        if (receiver instanceof Map) return dictMethod(receiver, name, args);
        if (receiver instanceof Set) return setMethod(receiver, name, args);
        return NOT_FOUND;
    }

    /**
     * 是否存在该内置方法（用于 {@code s.upper} 这类不立即调用的成员访问）
     */
    static boolean has(Object receiver, String name) {
        if (receiver instanceof String) return STRING_METHODS.contains(name);
        if (receiver instanceof PipeTuple) return name.equals("index") || name.equals("count");
        if (receiver instanceof List) return LIST_METHODS.contains(name);
        if (receiver instanceof Map) return DICT_METHODS.contains(name);
        if (receiver instanceof Set) return SET_METHODS.contains(name);
        return false;
    }

    private static final List<String> STRING_METHODS = List.of(
            "upper", "lower", "strip", "lstrip", "rstrip", "split", "replace",
            "startswith", "endswith", "join", "count", "find", "index", "title",
            "isdigit", "isalpha");
    private static final List<String> LIST_METHODS = List.of(
            "append", "extend", "pop", "index", "count", "copy", "reverse", "insert", "remove");
    private static final List<String> DICT_METHODS = List.of(
            "get", "keys", "values", "items", "copy", "pop", "update");
    private static final List<String> SET_METHODS = List.of(
            "add", "union", "intersection", "difference", "copy");

    // ============ str ============

    private static Object stringMethod(String s, String name, List<Object> args) {
        switch (name) {
            case "upper": arity(name, args, 0); return s.toUpperCase();
            case "lower": arity(name, args, 0); return s.toLowerCase();
            case "strip": arity(name, args, 0); return s.strip();
            case "lstrip": arity(name, args, 0); return s.stripLeading();
            case "rstrip": arity(name, args, 0); return s.stripTrailing();
            case "title": {
                arity(name, args, 0);
                StringBuilder sb = new StringBuilder(s.length());
                boolean start = true;
                for (char c : s.toCharArray()) {
                    sb.append(start ? Character.toUpperCase(c) : Character.toLowerCase(c));
                    start = !Character.isLetter(c);
                }
                return sb.toString();
            }
            case "isdigit": arity(name, args, 0); return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
            case "isalpha": arity(name, args, 0); return !s.isEmpty() && s.chars().allMatch(Character::isLetter);
            case "split": {
                List<Object> parts = new ArrayList<>();
                if (args.isEmpty()) {
                    String trimmed = s.strip();
                    if (!trimmed.isEmpty()) {
                        Collections.addAll(parts, (Object[]) trimmed.split("\\s+"));
                    }
                    return parts;
                }
                String sep = stringArg(name, args, 0);
                if (sep.isEmpty()) throw new PipeRuntimeException("empty separator");
                int from = 0;
                int at;
                while ((at = s.indexOf(sep, from)) >= 0) {
                    parts.add(s.substring(from, at));
                    from = at + sep.length();
                }
                parts.add(s.substring(from));
                return parts;
            }
            case "replace":
                arity(name, args, 2);
                return s.replace(stringArg(name, args, 0), stringArg(name, args, 1));
            case "startswith": arity(name, args, 1); return s.startsWith(stringArg(name, args, 0));
            case "endswith": arity(name, args, 1); return s.endsWith(stringArg(name, args, 0));
            case "join": {
                arity(name, args, 1);
                StringBuilder sb = new StringBuilder();
                boolean first = true;
                for (Object item : Builtins.iterate(args.get(0))) {
                    if (!(item instanceof String)) {
                        throw new PipeRuntimeException("sequence item: expected str instance, "
                                + BinaryOps.typeName(item) + " found");
                    }
                    if (!first) sb.append(s);
                    sb.append(item);
                    first = false;
                }
                return sb.toString();
            }
            case "count": {
                arity(name, args, 1);
                String sub = stringArg(name, args, 0);
                if (sub.isEmpty()) return (long) s.length() + 1;
                long n = 0;
                for (int at = s.indexOf(sub); at >= 0; at = s.indexOf(sub, at + sub.length())) n++;
                return n;
            }
            case "find": arity(name, args, 1); return (long) s.indexOf(stringArg(name, args, 0));
            case "index": {
                arity(name, args, 1);
                int at = s.indexOf(stringArg(name, args, 0));
                if (at < 0) throw new PipeRuntimeException("substring not found");
                return (long) at;
            }
            default:
                return NOT_FOUND;
        }
    }

    // ============ list / tuple ============

    private static Object sequenceMethod(List<?> list, String name, List<Object> args) {
        switch (name) {
            case "index": {
                arity(name, args, 1);
                for (int i = 0; i < list.size(); i++) {
                    if (BinaryOps.isEqual(list.get(i), args.get(0))) return (long) i;
                }
                throw new PipeRuntimeException(Builtins.repr(args.get(0)) + " is not in list");
            }
            case "count": {
                arity(name, args, 1);
                long n = 0;
                for (Object item : list) {
                    if (BinaryOps.isEqual(item, args.get(0))) n++;
                }
                return n;
            }
            default:
                return NOT_FOUND;
        }
    }

    @SuppressWarnings("unchecked")
    private static Object listMethod(Object receiver, String name, List<Object> args) {
        List<Object> list = (List<Object>) receiver;
        switch (name) {
            case "append": arity(name, args, 1); list.add(args.get(0)); return null;
            case "extend":
                arity(name, args, 1);
                for (Object item : Builtins.iterate(args.get(0))) list.add(item);
                return null;
            case "insert": {
                arity(name, args, 2);
                int index = (int) Math.max(0, Math.min(list.size(), normalizeIndex(args.get(0), list.size())));
                list.add(index, args.get(1));
                return null;
            }
            case "remove": {
                arity(name, args, 1);
                for (int i = 0; i < list.size(); i++) {
                    if (BinaryOps.isEqual(list.get(i), args.get(0))) {
                        list.remove(i);
                        return null;
                    }
                }
                throw new PipeRuntimeException("list.remove(x): x not in list");
            }
            case "pop": {
                if (list.isEmpty()) throw new PipeRuntimeException("pop from empty list");
                long index = args.isEmpty() ? list.size() - 1 : normalizeIndex(args.get(0), list.size());
                if (index < 0 || index >= list.size()) throw new PipeRuntimeException("pop index out of range");
                return list.remove((int) index);
            }
            case "copy": arity(name, args, 0); return new ArrayList<>(list);
            case "reverse": arity(name, args, 0); Collections.reverse(list); return null;
            default:
                return sequenceMethod(list, name, args);
        }
    }

    // ============ dict ============

    @SuppressWarnings("unchecked")
    private static Object dictMethod(Object receiver, String name, List<Object> args) {
        Map<Object, Object> map = (Map<Object, Object>) receiver;
        switch (name) {
            case "get":
                if (args.isEmpty() || args.size() > 2) {
                    throw new PipeRuntimeException("get expected 1 or 2 arguments, got " + args.size());
                }
                return map.containsKey(args.get(0)) ? map.get(args.get(0)) : (args.size() == 2 ? args.get(1) : null);
            case "keys": arity(name, args, 0); return new ArrayList<>(map.keySet());
            case "values": arity(name, args, 0); return new ArrayList<>(map.values());
            case "items": {
                arity(name, args, 0);
                List<Object> items = new ArrayList<>(map.size());
                for (Map.Entry<Object, Object> entry : map.entrySet()) {
                    items.add(PipeTuple.of(entry.getKey(), entry.getValue()));
                }
                return items;
            }
            case "copy": arity(name, args, 0); return new LinkedHashMap<>(map);
            case "pop":
                if (!map.containsKey(args.isEmpty() ? null : args.get(0))) {
                    if (args.size() == 2) return args.get(1);
                    throw new PipeRuntimeException("KeyError: " + (args.isEmpty() ? "None" : Builtins.repr(args.get(0))));
                }
                return map.remove(args.get(0));
            case "update":
                arity(name, args, 1);
                if (!(args.get(0) instanceof Map)) throw new PipeRuntimeException("update() argument must be a dict");
                map.putAll((Map<Object, Object>) args.get(0));
                return null;
            default:
                return NOT_FOUND;
        }
    }

    // ============ set ============

    @SuppressWarnings("unchecked")
    private static Object setMethod(Object receiver, String name, List<Object> args) {
        Set<Object> set = (Set<Object>) receiver;
        switch (name) {
            case "add": arity(name, args, 1); set.add(args.get(0)); return null;
            case "copy": arity(name, args, 0); return new LinkedHashSet<>(set);
            case "union":
                arity(name, args, 1);
                return BinaryOps.apply(BinaryOp.BIT_OR, set, Builtins.toSet(args.get(0)));
            case "intersection":
                arity(name, args, 1);
                return BinaryOps.apply(BinaryOp.BIT_AND, set, Builtins.toSet(args.get(0)));
            case "difference":
                arity(name, args, 1);
                return BinaryOps.apply(BinaryOp.SUB, set, Builtins.toSet(args.get(0)));
            default:
                return NOT_FOUND;
        }
    }

    // ============ 辅助 ============

    private static void arity(String name, List<Object> args, int expected) {
        if (args.size() != expected) {
            throw new PipeRuntimeException(name + "() takes exactly " + expected + " argument"
                    + (expected == 1 ? "" : "s") + " (" + args.size() + " given)");
        }
    }

    private static String stringArg(String name, List<Object> args, int index) {
        Object value = args.get(index);
        if (!(value instanceof String)) {
            throw new PipeRuntimeException(name + "() argument must be str, not " + BinaryOps.typeName(value));
        }
        return (String) value;
    }

    private static long normalizeIndex(Object index, int size) {
        if (!BinaryOps.isIntegral(index)) {
            throw new PipeRuntimeException("indices must be integers, not " + BinaryOps.typeName(index));
        }
        long i = BinaryOps.asLong(index);
        return i < 0 ? i + size : i;
    }
}
