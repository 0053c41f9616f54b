package com.pipelang.ir.pass;

import com.pipelang.compiler.ast.expr.Expression;
import com.pipelang.compiler.formatter.ExprFormatter;
import com.pipelang.compiler.parser.Parser;
import com.pipelang.ir.pipe.AmbiguousRewriteException;
import com.pipelang.ir.pipe.PipeConfig;
import com.pipelang.ir.pipe.PipeRewriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * PassPipeline 测试
 */
@DisplayName("PassPipeline 测试")
class PassPipelineTest {

    @Test
    @DisplayName("默认管线只包含管道改写")
    void testDefault() {
        PassPipeline pipeline = PassPipeline.createDefault(PipeConfig.defaults());
        assertThat(pipeline.getPasses()).hasSize(1).first().isInstanceOf(PipeRewriter.class);
        Expression result = pipeline.execute(Parser.parse("3 >> double >> add(1)", "<test>"));
        assertThat(ExprFormatter.format(result)).isEqualTo("add(double(3), 1)");
    }

    @Test
    @DisplayName("按顺序执行")
    void testOrder() {
        List<String> seen = new ArrayList<>();
        PassPipeline pipeline = new PassPipeline()
                .addPass(recording("first", seen))
                .addPass(new PipeRewriter())
                .addPass(recording("last", seen));
        Expression result = pipeline.execute(Parser.parse("x >> f", "<test>"));
        assertThat(seen).containsExactly("first:x >> f", "last:f(x)");
        assertThat(ExprFormatter.format(result)).isEqualTo("f(x)");
    }

    @Test
    @DisplayName("pass 异常向上传播")
    void testPropagates() {
        PassPipeline pipeline = PassPipeline.createDefault(PipeConfig.defaults());
        assertThatThrownBy(() -> pipeline.execute(Parser.parse("x >> 1 + 1", "<test>")))
                .isInstanceOf(AmbiguousRewriteException.class);
    }

    private static ExprPass recording(String name, List<String> seen) {
        return new ExprPass() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Expression run(Expression tree) {
                seen.add(name + ":" + ExprFormatter.format(tree));
                return tree;
            }
        };
    }
}
