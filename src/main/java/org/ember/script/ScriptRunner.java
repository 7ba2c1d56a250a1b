package org.ember.script;

import org.ember.script.api.IScriptRunner;
import org.ember.script.api.ParseResult;
import org.ember.script.api.ScriptResult;
import org.ember.script.diagnostics.DiagnosticsEngine;
import org.ember.script.frontend.lexer.Lexer;
import org.ember.script.frontend.lexer.Token;
import org.ember.script.frontend.parser.Parser;
import org.ember.script.frontend.parser.ast.Stmt;
import org.ember.script.runtime.Interpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Orchestrates the pipeline from source text to program effects:
 * lexing, parsing and tree-walking evaluation. It is not thread-safe.
 * <p>
 * One runner keeps one {@link Interpreter}, so global variables survive from one
 * {@link #run(String)} to the next. The REPL relies on this.
 */
public class ScriptRunner implements IScriptRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptRunner.class);

    private final Interpreter interpreter;

    /**
     * Constructs a new runner.
     * @param output Receives one line per executed {@code print} statement.
     */
    public ScriptRunner(Consumer<String> output) {
        this.interpreter = new Interpreter(output);
    }

    @Override
    public ScriptResult run(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Stmt> program = parse(source, diagnostics);

        if (diagnostics.hasSyntaxErrors()) {
            LOG.debug("Not executing: {} syntax error(s)", diagnostics.getDiagnostics().size());
            return new ScriptResult(ScriptResult.Status.SYNTAX_ERROR, diagnostics.getDiagnostics());
        }

        boolean completed = interpreter.interpret(program, diagnostics);
        ScriptResult.Status status = completed ? ScriptResult.Status.OK : ScriptResult.Status.RUNTIME_ERROR;
        return new ScriptResult(status, diagnostics.getDiagnostics());
    }

    /**
     * Runs only the front end.
     * @param source The program text.
     * @return The parsed statements together with any syntax errors.
     */
    public ParseResult parse(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Stmt> program = parse(source, diagnostics);
        return new ParseResult(program, diagnostics.getDiagnostics());
    }

    private List<Stmt> parse(String source, DiagnosticsEngine diagnostics) {
        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();

        // Parsing a token stream with holes in it only produces follow-on errors.
        if (diagnostics.hasSyntaxErrors()) {
            return List.of();
        }

        // Phase 2: Parsing (builds AST)
        return new Parser(tokens, diagnostics).parse();
    }
}
