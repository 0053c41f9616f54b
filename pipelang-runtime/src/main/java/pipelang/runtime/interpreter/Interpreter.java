package pipelang.runtime.interpreter;

import com.pipelang.compiler.ast.AstVisitor;
import com.pipelang.compiler.ast.SourceLocation;
import com.pipelang.compiler.ast.expr.*;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 树遍历解释器
 *
 * <p>对（通常已完成管道改写的）表达式树求值。实例不是线程安全的。</p>
 */
public final class Interpreter implements AstVisitor<Object, Environment> {

    private final Environment globals;
    private PrintStream stdout = System.out;
    private Consumer<Object> debugObserver;
    private String[] sourceLines;

    public Interpreter() {
        this.globals = new Environment();
        Builtins.register(globals);
    }

    // ============ 配置 ============

    public Environment getGlobals() {
        return globals;
    }

    public PrintStream getStdout() {
        return stdout;
    }

    public void setStdout(PrintStream stdout) {
        this.stdout = stdout;
    }

    /**
     * 调试观察者；未设置时把值打印到 stdout
     */
    public Consumer<Object> getDebugObserver() {
        if (debugObserver == null) {
            return value -> stdout.println(Builtins.str(value));
        }
        return debugObserver;
    }

    public void setDebugObserver(Consumer<Object> debugObserver) {
        this.debugObserver = debugObserver;
    }

    /**
     * 设置当前源码，用于错误信息中的源码行
     */
    public void setSource(String source) {
        this.sourceLines = source == null ? null : source.split("\r?\n", -1);
    }

    /**
     * 以全局环境为父创建绑定作用域
     */
    public Environment createScope(Map<String, ?> bindings) {
        Environment scope = new Environment(globals);
        scope.defineAll(bindings);
        return scope;
    }

    // ============ 求值入口 ============

    public Object evaluate(Expression tree) {
        return evaluate(tree, globals);
    }

    /**
     * 在给定作用域中求值
     *
     * @throws PipeRuntimeException 求值失败，带最内层出错节点的位置
     */
    public Object evaluate(Expression tree, Environment scope) {
        try {
            return tree.accept(this, scope);
        } catch (PipeRuntimeException e) {
            throw e.withLocation(located(tree.getLocation()), sourceLineOf(tree.getLocation()));
        } catch (StackOverflowError e) {
            throw new PipeRuntimeException("maximum recursion depth exceeded", tree.getLocation());
        }
    }

    // ============ 节点 ============

    @Override
    public Object visitIdentifier(Identifier node, Environment env) {
        return env.lookup(node.getName());
    }

    @Override
    public Object visitLiteral(Literal node, Environment env) {
        return node.getValue();
    }

    @Override
    public Object visitMemberExpr(MemberExpr node, Environment env) {
        Object target = evaluate(node.getTarget(), env);
        return getMember(target, node.getMember());
    }

    @Override
    public Object visitCallExpr(CallExpr node, Environment env) {
        Expression callee = node.getCallee();
        if (callee instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) callee;
            Object receiver = evaluate(member.getTarget(), env);
            List<Object> args = new ArrayList<>();
            Map<String, Object> kwargs = new LinkedHashMap<>();
            evaluateArgs(node, env, args, kwargs);
            return invokeMember(receiver, member.getMember(), args, kwargs);
        }
        Object function = evaluate(callee, env);
        List<Object> args = new ArrayList<>();
        Map<String, Object> kwargs = new LinkedHashMap<>();
        evaluateArgs(node, env, args, kwargs);
        return callValue(function, args, kwargs);
    }

    @Override
    public Object visitBinaryExpr(BinaryExpr node, Environment env) {
        BinaryExpr.BinaryOp op = node.getOperator();
        if (op == BinaryExpr.BinaryOp.AND) {
            Object left = evaluate(node.getLeft(), env);
            return BinaryOps.isTruthy(left) ? evaluate(node.getRight(), env) : left;
        }
        if (op == BinaryExpr.BinaryOp.OR) {
            Object left = evaluate(node.getLeft(), env);
            return BinaryOps.isTruthy(left) ? left : evaluate(node.getRight(), env);
        }
        Object left = evaluate(node.getLeft(), env);
        Object right = evaluate(node.getRight(), env);
        if (op == BinaryExpr.BinaryOp.PIPE) {
            // 未经改写的 |> ：right(left)
            return callValue(right, Collections.singletonList(left), Collections.emptyMap());
        }
        return BinaryOps.apply(op, left, right);
    }

    @Override
    public Object visitUnaryExpr(UnaryExpr node, Environment env) {
        Object operand = evaluate(node.getOperand(), env);
        switch (node.getOperator()) {
            case NOT:
                return !BinaryOps.isTruthy(operand);
            case NEG:
                return BinaryOps.negate(operand);
            case POS:
                if (operand instanceof Double) return operand;
                if (BinaryOps.isIntegral(operand)) return BinaryOps.asLong(operand);
                break;
            case INVERT:
                if (BinaryOps.isIntegral(operand)) return ~BinaryOps.asLong(operand);
                break;
            default:
                break;
        }
        throw new PipeRuntimeException("bad operand type for unary " + node.getOperator().toSourceString().trim()
                + ": '" + BinaryOps.typeName(operand) + "'");
    }

    @Override
    public Object visitIndexExpr(IndexExpr node, Environment env) {
        Object target = evaluate(node.getTarget(), env);
        Object index = evaluate(node.getIndex(), env);
        if (target instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) target;
            if (!map.containsKey(index)) {
                throw new PipeRuntimeException("KeyError: " + Builtins.repr(index));
            }
            return map.get(index);
        }
        if (target instanceof List || target instanceof String) {
            if (!BinaryOps.isIntegral(index)) {
                throw new PipeRuntimeException(BinaryOps.typeName(target) + " indices must be integers, not "
                        + BinaryOps.typeName(index));
            }
            int size = target instanceof String ? ((String) target).length() : ((List<?>) target).size();
            long i = BinaryOps.asLong(index);
            if (i < 0) i += size;
            if (i < 0 || i >= size) {
                throw new PipeRuntimeException(BinaryOps.typeName(target) + " index out of range");
            }
            return target instanceof String
                    ? String.valueOf(((String) target).charAt((int) i))
                    : ((List<?>) target).get((int) i);
        }
        throw new PipeRuntimeException("'" + BinaryOps.typeName(target) + "' object is not subscriptable");
    }

    @Override
    public Object visitCollectionLiteral(CollectionLiteral node, Environment env) {
        switch (node.getKind()) {
            case LIST: {
                List<Object> list = new ArrayList<>();
                for (Expression element : node.getElements()) list.add(evaluate(element, env));
                return list;
            }
            case TUPLE: {
                List<Object> items = new ArrayList<>();
                for (Expression element : node.getElements()) items.add(evaluate(element, env));
                return PipeTuple.copyOf(items);
            }
            case SET: {
                Set<Object> set = new LinkedHashSet<>();
                for (Expression element : node.getElements()) set.add(evaluate(element, env));
                return set;
            }
            case DICT: {
                Map<Object, Object> map = new LinkedHashMap<>();
                for (CollectionLiteral.MapEntry entry : node.getMapEntries()) {
                    map.put(evaluate(entry.getKey(), env), evaluate(entry.getValue(), env));
                }
                return map;
            }
            default:
                throw new PipeRuntimeException("Unknown collection kind: " + node.getKind());
        }
    }

    /**
     * 推导式。生成器表达式同样立即求值为列表。
     */
    @Override
    public Object visitComprehensionExpr(ComprehensionExpr node, Environment env) {
        Environment scope = new Environment(env);
        switch (node.getKind()) {
            case SET: {
                Set<Object> set = new LinkedHashSet<>();
                comprehend(node, 0, scope, () -> set.add(evaluate(node.getElement(), scope)));
                return set;
            }
            case DICT: {
                Map<Object, Object> map = new LinkedHashMap<>();
                comprehend(node, 0, scope, () -> map.put(evaluate(node.getElement(), scope),
                        evaluate(node.getValue(), scope)));
                return map;
            }
            default: {
                List<Object> list = new ArrayList<>();
                comprehend(node, 0, scope, () -> list.add(evaluate(node.getElement(), scope)));
                return list;
            }
        }
    }

    private void comprehend(ComprehensionExpr node, int depth, Environment scope, Runnable emit) {
        if (depth == node.getGenerators().size()) {
            emit.run();
            return;
        }
        ComprehensionExpr.Generator generator = node.getGenerators().get(depth);
        Object iterable = evaluate(generator.getIterable(), scope);
        for (Object item : Builtins.toList(iterable)) {
            bindTargets(generator, item, scope);
            boolean accepted = true;
            for (Expression condition : generator.getConditions()) {
                if (!BinaryOps.isTruthy(evaluate(condition, scope))) {
                    accepted = false;
                    break;
                }
            }
            if (accepted) {
                comprehend(node, depth + 1, scope, emit);
            }
        }
    }

    private void bindTargets(ComprehensionExpr.Generator generator, Object item, Environment scope) {
        List<String> targets = generator.getTargets();
        if (targets.size() == 1) {
            scope.define(targets.get(0), item);
            return;
        }
        Object unpacked = item instanceof Map.Entry
                ? PipeTuple.of(((Map.Entry<?, ?>) item).getKey(), ((Map.Entry<?, ?>) item).getValue())
                : item;
        List<Object> values = Builtins.toList(unpacked);
        if (values.size() != targets.size()) {
            throw new PipeRuntimeException("cannot unpack " + values.size() + " values into "
                    + targets.size() + " targets", generator.getLocation());
        }
        for (int i = 0; i < targets.size(); i++) {
            scope.define(targets.get(i), values.get(i));
        }
    }

    @Override
    public Object visitStringInterpolation(StringInterpolation node, Environment env) {
        StringBuilder sb = new StringBuilder();
        for (StringInterpolation.StringPart part : node.getParts()) {
            if (part instanceof StringInterpolation.LiteralPart) {
                sb.append(((StringInterpolation.LiteralPart) part).getValue());
            } else {
                Expression expression = ((StringInterpolation.ExprPart) part).getExpression();
                sb.append(Builtins.str(evaluate(expression, env)));
            }
        }
        return sb.toString();
    }

    @Override
    public Object visitLambdaExpr(LambdaExpr node, Environment env) {
        return new LambdaValue(node, env);
    }

    /**
     * 剩余标记没有运行时语义，直接求值主体
     */
    @Override
    public Object visitAnnotatedExpr(AnnotatedExpr node, Environment env) {
        return evaluate(node.getBody(), env);
    }

    // ============ 调用 ============

    /**
     * 调用任意可调用值：脚本函数、Java 类（构造）、java.util.function 接口
     */
    @SuppressWarnings("unchecked")
    public Object callValue(Object function, List<Object> args, Map<String, Object> kwargs) {
        if (function instanceof PipeCallable) {
            return ((PipeCallable) function).call(this, args, kwargs);
        }
        if (!kwargs.isEmpty()) {
            throw new PipeRuntimeException("'" + BinaryOps.typeName(function)
                    + "' does not accept keyword arguments");
        }
        if (function instanceof Class) {
            return JavaInterop.construct((Class<?>) function, args);
        }
        try {
            if (function instanceof Function && args.size() == 1) {
                return JavaInterop.normalize(((Function<Object, Object>) function).apply(args.get(0)));
            }
            if (function instanceof BiFunction && args.size() == 2) {
                return JavaInterop.normalize(((BiFunction<Object, Object, Object>) function)
                        .apply(args.get(0), args.get(1)));
            }
            if (function instanceof Supplier && args.isEmpty()) {
                return JavaInterop.normalize(((Supplier<Object>) function).get());
            }
        } catch (PipeRuntimeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PipeRuntimeException("host function raised " + e.getClass().getSimpleName()
                    + ": " + e.getMessage(), e);
        }
        if (function instanceof Function || function instanceof BiFunction || function instanceof Supplier) {
            throw new PipeRuntimeException("host function does not accept " + args.size() + " argument(s)");
        }
        throw new PipeRuntimeException("'" + BinaryOps.typeName(function) + "' object is not callable");
    }

    private Object invokeMember(Object receiver, String name, List<Object> args, Map<String, Object> kwargs) {
        if (kwargs.isEmpty()) {
            Object result = BuiltinMethods.invoke(receiver, name, args);
            if (result != BuiltinMethods.NOT_FOUND) {
                return result;
            }
            if (!(receiver instanceof PipeCallable) && JavaInterop.hasMethod(receiver, name)) {
                return JavaInterop.invokeMethod(receiver, name, args);
            }
        }
        return callValue(getMember(receiver, name), args, kwargs);
    }

    private Object getMember(Object target, String name) {
        if (BuiltinMethods.has(target, name)) {
            return NativeFunction.varargs(name, (interp, args, kwargs) -> {
                Object result = BuiltinMethods.invoke(target, name, args);
                if (result == BuiltinMethods.NOT_FOUND) {
                    throw new PipeRuntimeException("'" + BinaryOps.typeName(target)
                            + "' object has no attribute '" + name + "'");
                }
                return result;
            });
        }
        return JavaInterop.getMember(target, name);
    }

    private void evaluateArgs(CallExpr node, Environment env, List<Object> args, Map<String, Object> kwargs) {
        for (CallExpr.Argument arg : node.getArgs()) {
            Object value = evaluate(arg.getValue(), env);
            if (arg.isNamed()) {
                if (kwargs.containsKey(arg.getName())) {
                    throw new PipeRuntimeException("keyword argument repeated: " + arg.getName(),
                            arg.getLocation());
                }
                kwargs.put(arg.getName(), value);
            } else {
                args.add(value);
            }
        }
    }

    // ============ 位置 ============

    private static SourceLocation located(SourceLocation location) {
        return location == null || !location.isKnown() ? null : location;
    }

    private String sourceLineOf(SourceLocation location) {
        if (sourceLines == null || location == null) return null;
        int line = location.getLine();
        return line >= 1 && line <= sourceLines.length ? sourceLines[line - 1] : null;
    }
}
