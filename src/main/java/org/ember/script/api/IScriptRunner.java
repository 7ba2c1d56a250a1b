package org.ember.script.api;

/**
 * Public entry point of the script pipeline: source text in, print lines and diagnostics out.
 */
public interface IScriptRunner {

    /**
     * Scans, parses and, if the program is free of syntax errors, executes the given source.
     * Errors are returned as diagnostics, never thrown.
     *
     * @param source The program text.
     * @return The outcome of the run.
     */
    ScriptResult run(String source);
}
