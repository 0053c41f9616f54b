package com.pipelang.ir.pipe;

import com.pipelang.compiler.ast.AstScanner;
import com.pipelang.compiler.ast.AstTransformer;
import com.pipelang.compiler.ast.SourceLocation;
import com.pipelang.compiler.ast.expr.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 管道改写变换器
 *
 * <p>自顶向下遍历；运算符为管道符的 {@link BinaryExpr} 按右操作数形状分派，
 * 其余节点按子节点结构重建。每条规则产出的节点都会被重新访问，
 * 因此 {@code a >> b >> c} 中左侧的内层管道在外层规则之后展开。</p>
 */
final class PipeTransformer extends AstTransformer {
    private final RewriteContext context;
    private final PipeConfig config;

    PipeTransformer(PipeConfig config) {
        this.config = config;
        this.context = new RewriteContext(config, this);
    }

    @Override
    public Expression visitBinaryExpr(BinaryExpr node, Void ctx) {
        if (node.getOperator() != config.getOperator()) {
            return super.visitBinaryExpr(node, ctx);
        }
        Expression rewritten = context.revisit(dispatch(node));
        return config.isDebug() ? debugTap(rewritten) : rewritten;
    }

    // ============ 分派规则（先匹配者优先） ============

    private Expression dispatch(BinaryExpr node) {
        Expression left = node.getLeft();
        Expression right = node.getRight();
        String placeholder = config.getPlaceholder();

        // _.member -> left.member
        if (right instanceof MemberExpr && isPlaceholder(((MemberExpr) right).getTarget())) {
            MemberExpr member = (MemberExpr) right;
            return new MemberExpr(member.getLocation(), left, member.getMember());
        }

        // _.method(args) -> left.method(args)
        if (right instanceof CallExpr) {
            CallExpr call = (CallExpr) right;
            if (call.getCallee() instanceof MemberExpr
                    && isPlaceholder(((MemberExpr) call.getCallee()).getTarget())) {
                MemberExpr member = (MemberExpr) call.getCallee();
                MemberExpr newCallee = new MemberExpr(member.getLocation(), left, member.getMember());
                return new CallExpr(call.getLocation(), newCallee, call.getArgs());
            }
        }

        // 运算 / 集合 / 推导式 / f-string -> (lambda Z: right[_ -> Z])(left)
        if (needsLambda(right)) {
            if (!AstScanner.containsIdentifier(right, placeholder)) {
                throw new AmbiguousRewriteException(right.getNodeKind(), placeholder, right.getLocation());
            }
            LambdaExpr lambda = context.getSynthesizer().toLambda(right);
            return CallExpr.of(node.getLocation(), lambda, Collections.singletonList(left));
        }

        // 非调用：f -> f(left)
        if (!(right instanceof CallExpr)) {
            return CallExpr.of(node.getLocation(), right, Collections.singletonList(left));
        }

        // 普通调用：按方向插入位置参数
        return insertArgument((CallExpr) right, left);
    }

    private boolean isPlaceholder(Expression expr) {
        return expr instanceof Identifier && ((Identifier) expr).is(config.getPlaceholder());
    }

    private boolean needsLambda(Expression right) {
        if (right instanceof BinaryExpr) {
            return ((BinaryExpr) right).getOperator() != config.getOperator();
        }
        return right instanceof CollectionLiteral
                || right instanceof ComprehensionExpr
                || right instanceof StringInterpolation;
    }

    /**
     * FORWARD 插在第一个位置参数之前，REVERSE 插在最后一个位置参数之后；命名参数保持原位
     */
    private CallExpr insertArgument(CallExpr call, Expression value) {
        List<CallExpr.Argument> args = call.getArgs();
        CallExpr.Argument piped = CallExpr.Argument.positional(value);
        List<CallExpr.Argument> result = new ArrayList<>(args.size() + 1);
        if (config.getDirection() == PipeConfig.Direction.FORWARD) {
            result.add(piped);
            result.addAll(args);
        } else {
            int insertAt = 0;
            for (int i = 0; i < args.size(); i++) {
                if (!args.get(i).isNamed()) insertAt = i + 1;
            }
            result.addAll(args);
            result.add(insertAt, piped);
        }
        return new CallExpr(call.getLocation(), call.getCallee(), result);
    }

    private Expression debugTap(Expression value) {
        SourceLocation loc = value.getLocation();
        return CallExpr.of(loc, new Identifier(loc, PipeRewriter.DEBUG_TAP_FUNCTION),
                Collections.singletonList(value));
    }
}
