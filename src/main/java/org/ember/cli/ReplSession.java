package org.ember.cli;

import org.ember.script.api.ScriptResult;
import org.ember.script.ScriptRunner;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/**
 * Interactive prompt loop. Every line is run through the same {@link ScriptRunner},
 * so variables declared on one line stay visible on the next. Errors are printed
 * and the loop carries on.
 */
public class ReplSession {

    private static final Logger LOG = LoggerFactory.getLogger(ReplSession.class);

    private final ScriptRunner runner;
    private final LineReader lineReader;
    private final String prompt;
    private final PrintWriter err;

    /**
     * Creates a new session.
     * @param runner The runner that executes each line.
     * @param lineReader The source of input lines.
     * @param prompt The prompt shown before each line.
     * @param err Receives diagnostics.
     */
    public ReplSession(ScriptRunner runner, LineReader lineReader, String prompt, PrintWriter err) {
        this.runner = runner;
        this.lineReader = lineReader;
        this.prompt = prompt;
        this.err = err;
    }

    /**
     * Reads and runs lines until end of input (Ctrl+D) or an interrupt (Ctrl+C).
     * @return The number of lines that were run.
     */
    public int run() {
        int linesRun = 0;
        while (true) {
            String line;
            try {
                line = lineReader.readLine(prompt);
            } catch (UserInterruptException | EndOfFileException e) {
                LOG.debug("REPL closed after {} lines", linesRun);
                return linesRun;
            }
            if (line == null) {
                return linesRun;
            }
            if (line.isBlank()) {
                continue;
            }

            ScriptResult result = runner.run(line);
            linesRun++;
            result.diagnosticLines().forEach(err::println);
            err.flush();
        }
    }
}
