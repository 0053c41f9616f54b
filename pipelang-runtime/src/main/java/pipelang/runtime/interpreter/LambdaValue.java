package pipelang.runtime.interpreter;

import com.pipelang.compiler.ast.expr.LambdaExpr;

import java.util.List;
import java.util.Map;

/**
 * lambda 闭包：参数表、函数体与定义处的作用域
 */
public final class LambdaValue implements PipeCallable {

    private final LambdaExpr node;
    private final Environment closure;

    public LambdaValue(LambdaExpr node, Environment closure) {
        this.node = node;
        this.closure = closure;
    }

    @Override
    public String getName() {
        return "<lambda>";
    }

    @Override
    public int getArity() {
        return node.getParams().size();
    }

    public LambdaExpr getNode() {
        return node;
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> args, Map<String, Object> kwargs) {
        List<String> params = node.getParams();
        if (args.size() > params.size()) {
            throw new PipeRuntimeException("<lambda>() takes " + params.size()
                    + " positional arguments but " + args.size() + " were given", node.getLocation());
        }
        Environment scope = new Environment(closure);
        for (int i = 0; i < args.size(); i++) {
            scope.define(params.get(i), args.get(i));
        }
        for (Map.Entry<String, Object> kw : kwargs.entrySet()) {
            int index = params.indexOf(kw.getKey());
            if (index < 0) {
                throw new PipeRuntimeException("<lambda>() got an unexpected keyword argument '"
                        + kw.getKey() + "'", node.getLocation());
            }
            if (index < args.size()) {
                throw new PipeRuntimeException("<lambda>() got multiple values for argument '"
                        + kw.getKey() + "'", node.getLocation());
            }
            scope.define(kw.getKey(), kw.getValue());
        }
        for (String param : params) {
            if (!scope.localNames().contains(param)) {
                throw new PipeRuntimeException("<lambda>() missing required argument: '" + param + "'",
                        node.getLocation());
            }
        }
        return interpreter.evaluate(node.getBody(), scope);
    }

    @Override
    public String toString() {
        return "<lambda " + String.join(", ", node.getParams()) + ">";
    }
}
