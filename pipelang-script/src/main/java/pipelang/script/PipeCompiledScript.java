package pipelang.script;

import pipelang.runtime.CompiledPipe;

import javax.script.CompiledScript;
import javax.script.ScriptContext;
import javax.script.ScriptEngine;
import javax.script.ScriptException;

/**
 * 预编译脚本：保存改写后的树，每次 eval 以当时的上下文绑定求值。
 */
public class PipeCompiledScript extends CompiledScript {

    private final PipeScriptEngine engine;
    private final CompiledPipe compiled;

    PipeCompiledScript(PipeScriptEngine engine, CompiledPipe compiled) {
        this.engine = engine;
        this.compiled = compiled;
    }

    @Override
    public Object eval(ScriptContext context) throws ScriptException {
        return engine.evaluate(compiled, context);
    }

    @Override
    public ScriptEngine getEngine() {
        return engine;
    }

    /** 改写结果的源码形式 */
    public String getRewrittenSource() {
        return compiled.getRewrittenSource();
    }
}
