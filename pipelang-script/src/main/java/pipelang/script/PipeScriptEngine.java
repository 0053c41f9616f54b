package pipelang.script;

import com.pipelang.compiler.ast.SourceLocation;
import com.pipelang.compiler.parser.ParseException;
import com.pipelang.ir.pipe.PipeConfig;
import com.pipelang.ir.pipe.PipeRewriteException;
import pipelang.runtime.CompiledPipe;
import pipelang.runtime.Pipes;
import pipelang.runtime.interpreter.Interpreter;
import pipelang.runtime.interpreter.PipeRuntimeException;

import javax.script.*;
import java.io.*;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PipeLang 的 JSR-223 ScriptEngine 实现。
 *
 * <p>委托 {@link Pipes}：{@code eval()} 编译（带缓存）后立即求值，
 * {@code compile()} 返回可重复求值的 {@link PipeCompiledScript}。
 * GLOBAL_SCOPE 与 ENGINE_SCOPE 的绑定注入求值作用域，ENGINE_SCOPE 优先。</p>
 */
public class PipeScriptEngine extends AbstractScriptEngine implements Compilable {

    private static final Logger LOG = Logger.getLogger(PipeScriptEngine.class.getName());

    static final String DEFAULT_FILE_NAME = "<script>";

    private final PipeScriptEngineFactory factory;
    private volatile Pipes pipes;

    public PipeScriptEngine(PipeScriptEngineFactory factory) {
        this.factory = factory;
        this.pipes = new Pipes();
    }

    @Override
    public Object eval(String script, ScriptContext context) throws ScriptException {
        return evaluate(compileSource(script, context), context);
    }

    @Override
    public Object eval(Reader reader, ScriptContext context) throws ScriptException {
        return eval(readAll(reader), context);
    }

    @Override
    public Bindings createBindings() {
        return new SimpleBindings();
    }

    @Override
    public ScriptEngineFactory getFactory() {
        return factory;
    }

    // ---- Compilable ----

    @Override
    public CompiledScript compile(String script) throws ScriptException {
        return new PipeCompiledScript(this, compileSource(script, context));
    }

    @Override
    public CompiledScript compile(Reader reader) throws ScriptException {
        return compile(readAll(reader));
    }

    // ---- 配置 ----

    /**
     * 设置引擎级管道配置。脚本开头的 {@code @pipes(...)} 标记参数叠加在其上。
     */
    public void setPipeConfig(PipeConfig config) {
        this.pipes = new Pipes(config);
    }

    public PipeConfig getPipeConfig() {
        return pipes.getDefaultConfig();
    }

    Pipes getPipes() {
        return pipes;
    }

    // ---- 内部方法 ----

    private CompiledPipe compileSource(String script, ScriptContext context) throws ScriptException {
        String fileName = fileName(context);
        try {
            return pipes.compile(script, fileName);
        } catch (ParseException e) {
            ScriptException se = e.getLine() > 0
                    ? new ScriptException(e.getRawMessage(), fileName, e.getLine(), e.getColumn())
                    : new ScriptException(e.getMessage());
            se.initCause(e);
            throw se;
        } catch (PipeRewriteException e) {
            throw toScriptException(e, e.getLocation(), fileName);
        }
    }

    Object evaluate(CompiledPipe compiled, ScriptContext context) throws ScriptException {
        Interpreter interpreter = pipes.newInterpreter();
        redirectIO(interpreter, context);
        try {
            return compiled.eval(interpreter, collectBindings(context));
        } catch (PipeRuntimeException e) {
            throw toScriptException(e, e.getLocation(), compiled.getUnitName());
        } finally {
            interpreter.getStdout().flush();
        }
    }

    private static Map<String, Object> collectBindings(ScriptContext context) {
        Map<String, Object> values = new LinkedHashMap<>();
        Bindings global = context.getBindings(ScriptContext.GLOBAL_SCOPE);
        if (global != null) values.putAll(global);
        Bindings engine = context.getBindings(ScriptContext.ENGINE_SCOPE);
        if (engine != null) values.putAll(engine);
        values.remove(ScriptEngine.FILENAME);
        return values;
    }

    private static String fileName(ScriptContext context) {
        Object name = context.getAttribute(ScriptEngine.FILENAME);
        return name != null ? name.toString() : DEFAULT_FILE_NAME;
    }

    private static void redirectIO(Interpreter interpreter, ScriptContext context) {
        Writer writer = context.getWriter();
        if (writer != null) {
            interpreter.setStdout(new PrintStream(new WriterOutputStream(writer), true, StandardCharsets.UTF_8));
        }
    }

    private static ScriptException toScriptException(RuntimeException e, SourceLocation location, String fileName) {
        ScriptException se = location != null && location.isKnown()
                ? new ScriptException(e.getMessage(), fileName, location.getLine(), location.getColumn())
                : new ScriptException(e.getMessage());
        se.initCause(e);
        return se;
    }

    private static String readAll(Reader reader) throws ScriptException {
        try {
            StringBuilder sb = new StringBuilder();
            char[] buf = new char[4096];
            int n;
            while ((n = reader.read(buf)) != -1) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        } catch (IOException e) {
            throw new ScriptException(e);
        }
    }

    /**
     * 将 Writer 适配为 OutputStream（用于 PrintStream 包装），按 UTF-8 流式解码
     *
     * <p>跨两次 write 被截断的多字节字符暂存在 {@code pending} 中，下一次写入时补齐。</p>
     */
    static class WriterOutputStream extends OutputStream {
        private final Writer writer;
        private final byte[] singleByte = new byte[1];
        private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        private final ByteBuffer pending = ByteBuffer.allocate(8);
        private final CharBuffer chars = CharBuffer.allocate(1024);

        WriterOutputStream(Writer writer) {
            this.writer = writer;
        }

        @Override
        public void write(int b) throws IOException {
            singleByte[0] = (byte) b;
            write(singleByte, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            ByteBuffer in;
            if (pending.position() > 0) {
                pending.flip();
                in = ByteBuffer.allocate(pending.remaining() + len);
                in.put(pending).put(b, off, len).flip();
                pending.clear();
            } else {
                in = ByteBuffer.wrap(b, off, len);
            }
            decode(in, false);
            // 剩余的只会是不完整字符的前几个字节
            pending.put(in);
        }

        @Override
        public void flush() throws IOException {
            writer.flush();
        }

        /**
         * 不关闭宿主的 Writer；输出残留字节（按替换字符）后 flush
         */
        @Override
        public void close() {
            try {
                pending.flip();
                decode(pending, true);
                pending.clear();
                decoder.flush(chars);
                drain();
                decoder.reset();
                writer.flush();
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Failed to flush script writer", e);
            }
        }

        private void decode(ByteBuffer in, boolean endOfInput) throws IOException {
            CoderResult result;
            do {
                result = decoder.decode(in, chars, endOfInput);
                drain();
            } while (result.isOverflow());
        }

        private void drain() throws IOException {
            chars.flip();
            if (chars.hasRemaining()) {
                writer.write(chars.array(), chars.arrayOffset(), chars.limit());
            }
            chars.clear();
        }
    }
}
