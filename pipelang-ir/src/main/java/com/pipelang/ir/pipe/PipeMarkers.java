package com.pipelang.ir.pipe;

import com.pipelang.compiler.ast.AstTransformer;
import com.pipelang.compiler.ast.expr.AnnotatedExpr;
import com.pipelang.compiler.ast.expr.CallExpr;
import com.pipelang.compiler.ast.expr.Expression;
import com.pipelang.compiler.ast.expr.Literal;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@code @pipes(...)} 标记的读取与剥离
 *
 * <p>改写前先剥离标记，已改写并重新标记的树再次进入改写时不会重复展开。
 * 只有根部（外层 {@link AnnotatedExpr} 链上）的标记参与配置。</p>
 */
public final class PipeMarkers {

    public static final String MARKER_NAME = "pipes";

    private PipeMarkers() {
    }

    /**
     * 移除所有 {@code @pipes} 标记，其它标记保留
     */
    public static Expression strip(Expression tree) {
        return STRIPPER.transform(tree);
    }

    /**
     * 根部是否带有 {@code @pipes} 标记
     */
    public static boolean isMarked(Expression tree) {
        return findRootMarker(tree) != null;
    }

    /**
     * 以 defaults 为基础，叠加根部标记中的命名参数。
     * 没有标记时原样返回 defaults。
     *
     * @throws PipeConfigurationException 参数名未知、参数不是字面量或取值非法
     */
    public static PipeConfig configure(Expression tree, PipeConfig defaults) {
        AnnotatedExpr.Annotation marker = findRootMarker(tree);
        if (marker == null || !marker.hasArgs()) {
            return defaults;
        }
        PipeConfig.Builder builder = defaults.toBuilder();
        for (CallExpr.Argument arg : marker.getArgs()) {
            if (!arg.isNamed()) {
                throw new PipeConfigurationException("@" + MARKER_NAME
                        + " only accepts named arguments", arg.getLocation());
            }
            Object value = literalValue(arg);
            switch (arg.getName()) {
                case "operator":
                    builder.operator(stringValue(arg, value));
                    break;
                case "placeholder":
                    builder.placeholder(stringValue(arg, value));
                    break;
                case "lambdaVar":
                case "lambda_var":
                    builder.lambdaVar(stringValue(arg, value));
                    break;
                case "direction":
                    builder.direction(directionValue(arg, stringValue(arg, value)));
                    break;
                case "debug":
                    if (!(value instanceof Boolean)) {
                        throw new PipeConfigurationException("@" + MARKER_NAME
                                + " argument `debug` must be True or False", arg.getLocation());
                    }
                    builder.debug((Boolean) value);
                    break;
                default:
                    throw new PipeConfigurationException("Unknown @" + MARKER_NAME
                            + " argument: " + arg.getName(), arg.getLocation());
            }
        }
        try {
            return builder.build();
        } catch (PipeConfigurationException e) {
            PipeConfigurationException located = new PipeConfigurationException(e.getMessage(), marker.getLocation());
            located.initCause(e);
            throw located;
        }
    }

    private static AnnotatedExpr.Annotation findRootMarker(Expression tree) {
        Expression node = tree;
        while (node instanceof AnnotatedExpr) {
            AnnotatedExpr annotated = (AnnotatedExpr) node;
            AnnotatedExpr.Annotation marker = annotated.findAnnotation(MARKER_NAME);
            if (marker != null) return marker;
            node = annotated.getBody();
        }
        return null;
    }

    private static Object literalValue(CallExpr.Argument arg) {
        if (!(arg.getValue() instanceof Literal)) {
            throw new PipeConfigurationException("@" + MARKER_NAME + " argument `" + arg.getName()
                    + "` must be a literal", arg.getLocation());
        }
        return ((Literal) arg.getValue()).getValue();
    }

    private static String stringValue(CallExpr.Argument arg, Object value) {
        if (!(value instanceof String)) {
            throw new PipeConfigurationException("@" + MARKER_NAME + " argument `" + arg.getName()
                    + "` must be a string", arg.getLocation());
        }
        return (String) value;
    }

    private static PipeConfig.Direction directionValue(CallExpr.Argument arg, String value) {
        try {
            return PipeConfig.Direction.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PipeConfigurationException("Unknown pipe direction: " + value, arg.getLocation());
        }
    }

    private static final AstTransformer STRIPPER = new AstTransformer() {
        @Override
        public Expression visitAnnotatedExpr(AnnotatedExpr node, Void ctx) {
            Expression body = transform(node.getBody());
            List<AnnotatedExpr.Annotation> kept = new ArrayList<>(node.getAnnotations().size());
            for (AnnotatedExpr.Annotation annotation : node.getAnnotations()) {
                if (!MARKER_NAME.equals(annotation.getName())) kept.add(annotation);
            }
            if (kept.isEmpty()) return body;
            List<AnnotatedExpr.Annotation> annotations = kept.size() == node.getAnnotations().size()
                    ? transformAnnotations(node.getAnnotations())
                    : transformAnnotations(kept);
            if (annotations == node.getAnnotations() && body == node.getBody()) return node;
            return new AnnotatedExpr(node.getLocation(), annotations, body);
        }
    };
}
