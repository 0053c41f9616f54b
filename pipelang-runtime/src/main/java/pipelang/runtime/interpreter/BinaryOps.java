package pipelang.runtime.interpreter;

import com.pipelang.compiler.ast.expr.BinaryExpr.BinaryOp;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 运算符语义
 *
 * <p>整数统一为 {@link Long}，浮点统一为 {@link Double}，布尔值参与算术时视为 0/1。
 * 逻辑运算（and / or）与管道运算由解释器处理，不经过这里。</p>
 */
public final class BinaryOps {

    private BinaryOps() {}

    /**
     * 计算二元运算
     *
     * @throws PipeRuntimeException 操作数类型不支持或除零
     */
    public static Object apply(BinaryOp op, Object left, Object right) {
        try {
            return dispatch(op, left, right);
        } catch (ArithmeticException e) {
            throw new PipeRuntimeException("integer overflow in '" + op.toSourceString() + "'", e);
        }
    }

    private static Object dispatch(BinaryOp op, Object left, Object right) {
        switch (op) {
            case ADD: return add(left, right);
            case SUB: return sub(left, right);
            case MUL: return mul(left, right);
            case DIV: return div(left, right);
            case FLOOR_DIV: return floorDiv(left, right);
            case MOD: return mod(left, right);
            case POW: return pow(left, right);
            case SHL:
            case SHR: return shift(op, left, right);
            case BIT_AND:
            case BIT_OR:
            case BIT_XOR: return bitwise(op, left, right);
            case EQ: return isEqual(left, right);
            case NE: return !isEqual(left, right);
            case LT: return compare(op, left, right) < 0;
            case GT: return compare(op, left, right) > 0;
            case LE: return compare(op, left, right) <= 0;
            case GE: return compare(op, left, right) >= 0;
            default:
                throw unsupported(op, left, right);
        }
    }

    // ============ 算术 ============

    private static Object add(Object l, Object r) {
        if (isNumber(l) && isNumber(r)) {
            if (isIntegral(l) && isIntegral(r)) return Math.addExact(asLong(l), asLong(r));
            return asDouble(l) + asDouble(r);
        }
        if (l instanceof String && r instanceof String) return (String) l + r;
        if (l instanceof PipeTuple && r instanceof PipeTuple) {
            List<Object> joined = new ArrayList<>((PipeTuple) l);
            joined.addAll((PipeTuple) r);
            return PipeTuple.copyOf(joined);
        }
        if (isList(l) && isList(r)) {
            List<Object> joined = new ArrayList<>((List<?>) l);
            joined.addAll((List<?>) r);
            return joined;
        }
        throw unsupported(BinaryOp.ADD, l, r);
    }

    private static Object sub(Object l, Object r) {
        if (isNumber(l) && isNumber(r)) {
            if (isIntegral(l) && isIntegral(r)) return Math.subtractExact(asLong(l), asLong(r));
            return asDouble(l) - asDouble(r);
        }
        if (l instanceof Set && r instanceof Set) {
            Set<Object> result = new LinkedHashSet<>((Set<?>) l);
            result.removeAll((Set<?>) r);
            return result;
        }
        throw unsupported(BinaryOp.SUB, l, r);
    }

    private static Object mul(Object l, Object r) {
        if (isNumber(l) && isNumber(r)) {
            if (isIntegral(l) && isIntegral(r)) return Math.multiplyExact(asLong(l), asLong(r));
            return asDouble(l) * asDouble(r);
        }
        if (l instanceof String && isIntegral(r)) return repeat((String) l, asLong(r));
        if (r instanceof String && isIntegral(l)) return repeat((String) r, asLong(l));
        if (l instanceof List && isIntegral(r)) return repeat((List<?>) l, asLong(r));
        if (r instanceof List && isIntegral(l)) return repeat((List<?>) r, asLong(l));
        throw unsupported(BinaryOp.MUL, l, r);
    }

    private static Object div(Object l, Object r) {
        requireNumbers(BinaryOp.DIV, l, r);
        double divisor = asDouble(r);
        if (divisor == 0) throw new PipeRuntimeException("division by zero");
        return asDouble(l) / divisor;
    }

    private static Object floorDiv(Object l, Object r) {
        requireNumbers(BinaryOp.FLOOR_DIV, l, r);
        if (isIntegral(l) && isIntegral(r)) {
            long divisor = asLong(r);
            if (divisor == 0) throw new PipeRuntimeException("integer division or modulo by zero");
            return Math.floorDiv(asLong(l), divisor);
        }
        double divisor = asDouble(r);
        if (divisor == 0) throw new PipeRuntimeException("float floor division by zero");
        return Math.floor(asDouble(l) / divisor);
    }

    private static Object mod(Object l, Object r) {
        requireNumbers(BinaryOp.MOD, l, r);
        if (isIntegral(l) && isIntegral(r)) {
            long divisor = asLong(r);
            if (divisor == 0) throw new PipeRuntimeException("integer division or modulo by zero");
            return Math.floorMod(asLong(l), divisor);
        }
        double a = asDouble(l);
        double b = asDouble(r);
        if (b == 0) throw new PipeRuntimeException("float modulo");
        return a - b * Math.floor(a / b);
    }

    /**
     * 非负整数指数保持整数精度，其余情况按浮点计算
     */
    public static Object pow(Object l, Object r) {
        requireNumbers(BinaryOp.POW, l, r);
        if (isIntegral(l) && isIntegral(r) && asLong(r) >= 0) {
            long base = asLong(l);
            long exp = asLong(r);
            long result = 1;
            while (exp > 0) {
                if ((exp & 1) == 1) result = Math.multiplyExact(result, base);
                exp >>= 1;
                if (exp > 0) base = Math.multiplyExact(base, base);
            }
            return result;
        }
        if (asDouble(l) == 0 && asDouble(r) < 0) {
            throw new PipeRuntimeException("0.0 cannot be raised to a negative power");
        }
        return Math.pow(asDouble(l), asDouble(r));
    }

    // ============ 位运算 ============

    private static Object shift(BinaryOp op, Object l, Object r) {
        if (!isIntegral(l) || !isIntegral(r)) throw unsupported(op, l, r);
        long count = asLong(r);
        if (count < 0) throw new PipeRuntimeException("negative shift count");
        long value = asLong(l);
        if (op == BinaryOp.SHR) {
            return count >= 64 ? (value < 0 ? -1L : 0L) : value >> count;
        }
        if (count >= 64) {
            if (value == 0) return 0L;
            throw new PipeRuntimeException("left shift overflow");
        }
        long shifted = value << count;
        if (shifted >> count != value) {
            throw new PipeRuntimeException("left shift overflow");
        }
        return shifted;
    }

    /**
     * 一元负号；Long.MIN_VALUE 取负溢出
     */
    public static Object negate(Object operand) {
        if (operand instanceof Double) return -(Double) operand;
        if (!isIntegral(operand)) {
            throw new PipeRuntimeException("bad operand type for unary -: '" + typeName(operand) + "'");
        }
        try {
            return Math.negateExact(asLong(operand));
        } catch (ArithmeticException e) {
            throw new PipeRuntimeException("integer overflow in unary '-'", e);
        }
    }

    /**
     * abs()；Long.MIN_VALUE 取绝对值溢出
     */
    public static Object abs(Object operand) {
        if (operand instanceof Double) return Math.abs((Double) operand);
        if (!isIntegral(operand)) {
            throw new PipeRuntimeException("bad operand type for abs(): '" + typeName(operand) + "'");
        }
        try {
            return Math.absExact(asLong(operand));
        } catch (ArithmeticException e) {
            throw new PipeRuntimeException("integer overflow in abs()", e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Object bitwise(BinaryOp op, Object l, Object r) {
        if (l instanceof Boolean && r instanceof Boolean) {
            boolean a = (Boolean) l;
            boolean b = (Boolean) r;
            return op == BinaryOp.BIT_AND ? a & b : op == BinaryOp.BIT_OR ? a | b : a ^ b;
        }
        if (isIntegral(l) && isIntegral(r)) {
            long a = asLong(l);
            long b = asLong(r);
            return op == BinaryOp.BIT_AND ? a & b : op == BinaryOp.BIT_OR ? a | b : a ^ b;
        }
        if (l instanceof Set && r instanceof Set) {
            Set<Object> a = (Set<Object>) l;
            Set<Object> b = (Set<Object>) r;
            Set<Object> result = new LinkedHashSet<>(a);
            if (op == BinaryOp.BIT_AND) {
                result.retainAll(b);
            } else if (op == BinaryOp.BIT_OR) {
                result.addAll(b);
            } else {
                for (Object item : b) {
                    if (!result.remove(item)) result.add(item);
                }
            }
            return result;
        }
        if (op == BinaryOp.BIT_OR && l instanceof Map && r instanceof Map) {
            Map<Object, Object> merged = new LinkedHashMap<>((Map<Object, Object>) l);
            merged.putAll((Map<Object, Object>) r);
            return merged;
        }
        throw unsupported(op, l, r);
    }

    // ============ 比较 ============

    /**
     * 相等比较：整数与浮点按数值比较，元组与列表互不相等
     */
    public static boolean isEqual(Object l, Object r) {
        if (l == r) return true;
        if (l == null || r == null) return false;
        if (isNumber(l) && isNumber(r)) {
            if (isIntegral(l) && isIntegral(r)) return asLong(l) == asLong(r);
            return asDouble(l) == asDouble(r);
        }
        if ((l instanceof PipeTuple) != (r instanceof PipeTuple)) return false;
        if (l instanceof List && r instanceof List) {
            List<?> a = (List<?>) l;
            List<?> b = (List<?>) r;
            if (a.size() != b.size()) return false;
            for (int i = 0; i < a.size(); i++) {
                if (!isEqual(a.get(i), b.get(i))) return false;
            }
            return true;
        }
        return Objects.equals(l, r);
    }

    /**
     * 排序比较：数值、字符串、序列（逐元素）
     */
    public static int compare(Object l, Object r) {
        return compare(BinaryOp.LT, l, r);
    }

    private static int compare(BinaryOp op, Object l, Object r) {
        if (isNumber(l) && isNumber(r)) {
            if (isIntegral(l) && isIntegral(r)) return Long.compare(asLong(l), asLong(r));
            return Double.compare(asDouble(l), asDouble(r));
        }
        if (l instanceof String && r instanceof String) {
            return ((String) l).compareTo((String) r);
        }
        if (l instanceof List && r instanceof List
                && (l instanceof PipeTuple) == (r instanceof PipeTuple)) {
            Iterator<?> a = ((List<?>) l).iterator();
            Iterator<?> b = ((List<?>) r).iterator();
            while (a.hasNext() && b.hasNext()) {
                Object x = a.next();
                Object y = b.next();
                if (!isEqual(x, y)) return compare(op, x, y);
            }
            return Boolean.compare(a.hasNext(), b.hasNext());
        }
        throw new PipeRuntimeException("'" + op.toSourceString() + "' not supported between instances of '"
                + typeName(l) + "' and '" + typeName(r) + "'");
    }

    /**
     * 真值判断
     */
    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Double) return (Double) value != 0.0;
        if (value instanceof Number) return ((Number) value).longValue() != 0;
        if (value instanceof String) return !((String) value).isEmpty();
        if (value instanceof Collection) return !((Collection<?>) value).isEmpty();
        if (value instanceof Map) return !((Map<?, ?>) value).isEmpty();
        return true;
    }

    // ============ 辅助 ============

    static boolean isNumber(Object v) {
        return v instanceof Long || v instanceof Double || v instanceof Boolean
                || v instanceof Integer || v instanceof Short || v instanceof Byte || v instanceof Float;
    }

    static boolean isIntegral(Object v) {
        return v instanceof Long || v instanceof Boolean
                || v instanceof Integer || v instanceof Short || v instanceof Byte;
    }

    static long asLong(Object v) {
        if (v instanceof Boolean) return (Boolean) v ? 1L : 0L;
        return ((Number) v).longValue();
    }

    static double asDouble(Object v) {
        if (v instanceof Boolean) return (Boolean) v ? 1.0 : 0.0;
        return ((Number) v).doubleValue();
    }

    private static boolean isList(Object v) {
        return v instanceof List && !(v instanceof PipeTuple);
    }

    private static void requireNumbers(BinaryOp op, Object l, Object r) {
        if (!isNumber(l) || !isNumber(r)) throw unsupported(op, l, r);
    }

    private static String repeat(String s, long times) {
        if (times <= 0) return "";
        StringBuilder sb = new StringBuilder();
        for (long i = 0; i < times; i++) sb.append(s);
        return sb.toString();
    }

    private static List<Object> repeat(List<?> list, long times) {
        List<Object> result = new ArrayList<>();
        for (long i = 0; i < times; i++) result.addAll(list);
        return list instanceof PipeTuple ? PipeTuple.copyOf(result) : result;
    }

    static String typeName(Object v) {
        if (v == null) return "NoneType";
        if (v instanceof Boolean) return "bool";
        if (isIntegral(v)) return "int";
        if (v instanceof Double || v instanceof Float) return "float";
        if (v instanceof String) return "str";
        if (v instanceof PipeTuple) return "tuple";
        if (v instanceof List) return "list";
        if (v instanceof Set) return "set";
        if (v instanceof Map) return "dict";
        if (v instanceof PipeCallable) return "function";
        return v.getClass().getSimpleName();
    }

    private static PipeRuntimeException unsupported(BinaryOp op, Object l, Object r) {
        return new PipeRuntimeException("unsupported operand type(s) for " + op.toSourceString()
                + ": '" + typeName(l) + "' and '" + typeName(r) + "'");
    }
}
