package pipelang.script;

import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * PipeLang 的 JSR-223 ScriptEngineFactory 实现。
 *
 * <p>通过 SPI 机制（META-INF/services）被 {@link javax.script.ScriptEngineManager} 自动发现。</p>
 */
public class PipeScriptEngineFactory implements ScriptEngineFactory {

    private static final String ENGINE_NAME = "PipeLang";
    private static final String ENGINE_VERSION = "1.0.0";
    private static final String LANGUAGE_NAME = "pipelang";
    private static final String LANGUAGE_VERSION = "1.0";

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    @Override
    public String getEngineVersion() {
        return ENGINE_VERSION;
    }

    @Override
    public List<String> getExtensions() {
        return Collections.singletonList("pipe");
    }

    @Override
    public List<String> getMimeTypes() {
        return Collections.singletonList("application/x-pipelang");
    }

    @Override
    public List<String> getNames() {
        return Arrays.asList("pipelang", "pipes", "PipeLang");
    }

    @Override
    public String getLanguageName() {
        return LANGUAGE_NAME;
    }

    @Override
    public String getLanguageVersion() {
        return LANGUAGE_VERSION;
    }

    @Override
    public Object getParameter(String key) {
        switch (key) {
            case ScriptEngine.ENGINE:           return getEngineName();
            case ScriptEngine.ENGINE_VERSION:    return getEngineVersion();
            case ScriptEngine.LANGUAGE:          return getLanguageName();
            case ScriptEngine.LANGUAGE_VERSION:  return getLanguageVersion();
            case ScriptEngine.NAME:              return getNames().get(0);
            default:                             return null;
        }
    }

    @Override
    public String getMethodCallSyntax(String obj, String method, String... args) {
        StringBuilder sb = new StringBuilder();
        sb.append(obj).append('.').append(method).append('(');
        for (int i = 0; i < args.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(args[i]);
        }
        return sb.append(')').toString();
    }

    @Override
    public String getOutputStatement(String toDisplay) {
        return "print(" + toDisplay + ")";
    }

    /**
     * 单表达式语言：多条语句组成元组依次求值，结果取最后一项
     */
    @Override
    public String getProgram(String... statements) {
        if (statements.length == 0) return "None";
        if (statements.length == 1) return statements[0];
        return "(" + String.join(", ", statements) + ")[-1]";
    }

    @Override
    public PipeScriptEngine getScriptEngine() {
        return new PipeScriptEngine(this);
    }
}
