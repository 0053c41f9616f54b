package pipelang.runtime.interpreter;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Java 互操作模块
 *
 * <p>通过反射访问宿主对象：成员查找顺序为公共字段、getter（getX / isX）、绑定方法。
 * 目标为 {@link Class} 时访问静态成员，调用 {@link Class} 即调用构造器。</p>
 */
public final class JavaInterop {

    /** 参数无法转换为目标类型 */
    private static final Object NO_MATCH = new Object();

    private JavaInterop() {}

    // ============ 成员访问 ============

    /**
     * 读取成员
     *
     * @throws PipeRuntimeException 成员不存在
     */
    public static Object getMember(Object target, String name) {
        if (target == null) {
            throw new PipeRuntimeException("'NoneType' object has no attribute '" + name + "'");
        }
        boolean isStatic = target instanceof Class;
        Class<?> clazz = isStatic ? (Class<?>) target : target.getClass();

        try {
            Field field = clazz.getField(name);
            if (Modifier.isStatic(field.getModifiers()) == isStatic) {
                return normalize(field.get(isStatic ? null : target));
            }
        } catch (NoSuchFieldException ignored) {
            // 继续查找 getter
        } catch (IllegalAccessException e) {
            throw new PipeRuntimeException("Cannot access field " + clazz.getName() + "." + name, e);
        }

        String suffix = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        for (String getter : new String[]{"get" + suffix, "is" + suffix}) {
            Method method = findMethod(clazz, getter, 0, isStatic);
            if (method != null) {
                return invoke(method, isStatic ? null : target, new Object[0]);
            }
        }

        if (hasMethod(target, name)) {
            return new BoundMethod(target, name);
        }
        throw new PipeRuntimeException("'" + clazz.getSimpleName() + "' object has no attribute '" + name + "'");
    }

    /**
     * 目标上是否存在同名公共方法
     */
    public static boolean hasMethod(Object target, String name) {
        if (target == null) return false;
        boolean isStatic = target instanceof Class;
        Class<?> clazz = isStatic ? (Class<?>) target : target.getClass();
        for (Method method : clazz.getMethods()) {
            if (method.getName().equals(name) && Modifier.isStatic(method.getModifiers()) == isStatic) {
                return true;
            }
        }
        return false;
    }

    // ============ 调用 ============

    /**
     * 调用方法，按实参选择最匹配的重载
     */
    public static Object invokeMethod(Object target, String name, List<Object> args) {
        if (target == null) {
            throw new PipeRuntimeException("'NoneType' object has no attribute '" + name + "'");
        }
        boolean isStatic = target instanceof Class;
        Class<?> clazz = isStatic ? (Class<?>) target : target.getClass();

        List<Method> candidates = new ArrayList<>();
        for (Method method : clazz.getMethods()) {
            if (method.getName().equals(name) && Modifier.isStatic(method.getModifiers()) == isStatic) {
                candidates.add(method);
            }
        }
        if (candidates.isEmpty()) {
            throw new PipeRuntimeException("'" + clazz.getSimpleName() + "' object has no attribute '" + name + "'");
        }
        Match<Method> match = select(candidates, args);
        if (match == null) {
            throw new PipeRuntimeException("No applicable overload for " + clazz.getSimpleName() + "."
                    + name + " with " + args.size() + " argument(s)");
        }
        return invoke(match.executable, isStatic ? null : target, match.arguments);
    }

    /**
     * 调用构造器
     */
    public static Object construct(Class<?> clazz, List<Object> args) {
        if (Modifier.isAbstract(clazz.getModifiers())) {
            throw new PipeRuntimeException("Cannot instantiate abstract type " + clazz.getName());
        }
        Match<Constructor<?>> match = select(Arrays.asList(clazz.getConstructors()), args);
        if (match == null) {
            throw new PipeRuntimeException("No applicable constructor for " + clazz.getSimpleName()
                    + " with " + args.size() + " argument(s)");
        }
        try {
            return match.executable.newInstance(match.arguments);
        } catch (InvocationTargetException e) {
            throw wrapTargetException(clazz.getSimpleName(), e);
        } catch (ReflectiveOperationException e) {
            throw new PipeRuntimeException("Cannot instantiate " + clazz.getName() + ": " + e.getMessage(), e);
        }
    }

    // ============ 值转换 ============

    /**
     * Java 返回值归一：整数类型转 Long，Float 转 Double，Character 转 String，对象数组转 List
     */
    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof Character) {
            return String.valueOf(value);
        }
        if (value instanceof Object[]) {
            List<Object> list = new ArrayList<>();
            for (Object item : (Object[]) value) list.add(normalize(item));
            return list;
        }
        return value;
    }

    /**
     * 把脚本值转换为参数类型
     *
     * @return 转换后的值，无法转换时返回 {@link #NO_MATCH}
     */
    private static Object coerce(Object value, Class<?> type) {
        if (value == null) {
            return type.isPrimitive() ? NO_MATCH : null;
        }
        Class<?> boxed = box(type);
        if (boxed.isInstance(value)) {
            return value;
        }
        if (value instanceof Long || value instanceof Boolean) {
            if (value instanceof Boolean && boxed != Boolean.class) return NO_MATCH;
            long n = BinaryOps.asLong(value);
            if (boxed == Integer.class && n >= Integer.MIN_VALUE && n <= Integer.MAX_VALUE) return (int) n;
            if (boxed == Short.class && n >= Short.MIN_VALUE && n <= Short.MAX_VALUE) return (short) n;
            if (boxed == Byte.class && n >= Byte.MIN_VALUE && n <= Byte.MAX_VALUE) return (byte) n;
            if (boxed == Double.class) return (double) n;
            if (boxed == Float.class) return (float) n;
            return NO_MATCH;
        }
        if (value instanceof Double && boxed == Float.class) {
            return ((Double) value).floatValue();
        }
        if (value instanceof String && boxed == Character.class && ((String) value).length() == 1) {
            return ((String) value).charAt(0);
        }
        return NO_MATCH;
    }

    /**
     * 匹配得分：精确类型 2，数值转换 1，Object 形参 0
     */
    private static int score(Object value, Class<?> type) {
        if (value == null) return 1;
        Class<?> boxed = box(type);
        if (boxed == value.getClass()) return 2;
        if (boxed == Object.class) return 0;
        return boxed.isInstance(value) ? 2 : 1;
    }

    private static <E extends Executable> Match<E> select(List<E> candidates, List<Object> args) {
        Match<E> best = null;
        for (E candidate : candidates) {
            if (candidate.isVarArgs() || candidate.getParameterCount() != args.size()) continue;
            Class<?>[] types = candidate.getParameterTypes();
            Object[] converted = new Object[args.size()];
            int total = 0;
            boolean ok = true;
            for (int i = 0; i < types.length; i++) {
                Object value = coerce(args.get(i), types[i]);
                if (value == NO_MATCH) {
                    ok = false;
                    break;
                }
                converted[i] = value;
                total += score(args.get(i), types[i]);
            }
            if (ok && (best == null || total > best.score)) {
                best = new Match<>(candidate, converted, total);
            }
        }
        return best;
    }

    private static Object invoke(Method method, Object target, Object[] args) {
        Method accessible = accessibleVariant(method);
        try {
            return normalize(accessible.invoke(target, args));
        } catch (InvocationTargetException e) {
            throw wrapTargetException(method.getName(), e);
        } catch (IllegalAccessException e) {
            throw new PipeRuntimeException("Cannot access method " + method.getDeclaringClass().getName()
                    + "." + method.getName(), e);
        }
    }

    private static PipeRuntimeException wrapTargetException(String name, InvocationTargetException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof PipeRuntimeException) {
            return (PipeRuntimeException) cause;
        }
        return new PipeRuntimeException(name + "() raised " + cause.getClass().getSimpleName()
                + ": " + cause.getMessage(), cause);
    }

    /**
     * 非公共类（匿名类、私有内部类）上的方法改为从公共父类或接口上调用
     */
    private static Method accessibleVariant(Method method) {
        Class<?> declaring = method.getDeclaringClass();
        if (Modifier.isPublic(declaring.getModifiers())) {
            return method;
        }
        Method found = findPublicDeclaration(declaring, method.getName(), method.getParameterTypes());
        if (found != null) {
            return found;
        }
        method.trySetAccessible();
        return method;
    }

    private static Method findPublicDeclaration(Class<?> clazz, String name, Class<?>[] types) {
        if (clazz == null) return null;
        if (Modifier.isPublic(clazz.getModifiers())) {
            try {
                return clazz.getMethod(name, types);
            } catch (NoSuchMethodException ignored) {
                // 继续向上查找
            }
        }
        for (Class<?> iface : clazz.getInterfaces()) {
            Method found = findPublicDeclaration(iface, name, types);
            if (found != null) return found;
        }
        return findPublicDeclaration(clazz.getSuperclass(), name, types);
    }

    private static Method findMethod(Class<?> clazz, String name, int arity, boolean isStatic) {
        for (Method method : clazz.getMethods()) {
            if (method.getName().equals(name) && method.getParameterCount() == arity
                    && Modifier.isStatic(method.getModifiers()) == isStatic) {
                return method;
            }
        }
        return null;
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == boolean.class) return Boolean.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == char.class) return Character.class;
        return Void.class;
    }

    private static final class Match<E extends Executable> {
        final E executable;
        final Object[] arguments;
        final int score;

        Match(E executable, Object[] arguments, int score) {
            this.executable = executable;
            this.arguments = arguments;
            this.score = score;
        }
    }
}
