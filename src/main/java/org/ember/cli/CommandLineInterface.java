package org.ember.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.ember.config.ConfigLoader;
import org.ember.config.LoggingConfigurator;
import org.ember.script.ScriptRunner;
import org.ember.script.api.ParseResult;
import org.ember.script.api.ScriptResult;
import org.ember.script.util.AstPrinter;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(
    name = "ember",
    mixinStandardHelpOptions = true,
    version = "Ember 1.0",
    description = "Runs an Ember script, or starts an interactive prompt when no script is given."
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code for a script with syntax errors. */
    public static final int EXIT_SYNTAX_ERROR = 65;
    /** Exit code for a script stopped by a runtime error. */
    public static final int EXIT_RUNTIME_ERROR = 70;
    /** Exit code for an unreadable script file. */
    public static final int EXIT_IO_ERROR = 74;
    /** Exit code for an invalid configuration. */
    public static final int EXIT_CONFIG_ERROR = 78;

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Parameters(index = "0", arity = "0..1", paramLabel = "SCRIPT", description = "The script file to run.")
    private File script;

    @Option(names = {"-c", "--config"}, description = "Path to custom configuration file (default: ember.conf)")
    private File configFile;

    @Option(names = "--dump-ast", description = "Print the parsed program instead of running it.")
    private boolean dumpAst;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Config config;
        try {
            config = ConfigLoader.load(configFile);
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        LoggingConfigurator.configure(config);

        final ScriptRunner runner = new ScriptRunner(line -> {
            out.println(line);
            out.flush();
        });

        if (script == null) {
            return runPrompt(runner, config, out, err);
        }
        return runFile(runner, out, err);
    }

    private int runFile(ScriptRunner runner, PrintWriter out, PrintWriter err) {
        final String source;
        try {
            source = Files.readString(script.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.debug("Reading {} failed", script, e);
            err.println("Could not read script '" + script.getPath() + "': " + e.getMessage());
            err.flush();
            return EXIT_IO_ERROR;
        }

        if (dumpAst) {
            final ParseResult parsed = runner.parse(source);
            parsed.statements().forEach(stmt -> out.println(AstPrinter.print(stmt)));
            out.flush();
            parsed.diagnostics().forEach(err::println);
            err.flush();
            return parsed.hasErrors() ? EXIT_SYNTAX_ERROR : 0;
        }

        final ScriptResult result = runner.run(source);
        result.diagnosticLines().forEach(err::println);
        err.flush();
        return switch (result.status()) {
            case OK -> 0;
            case SYNTAX_ERROR -> EXIT_SYNTAX_ERROR;
            case RUNTIME_ERROR -> EXIT_RUNTIME_ERROR;
        };
    }

    private int runPrompt(ScriptRunner runner, Config config, PrintWriter out, PrintWriter err) throws IOException {
        if (config.getBoolean("ember.repl.banner")) {
            out.println("Ember 1.0 - press Ctrl+D to exit.");
            out.flush();
        }

        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            final LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .build();
            new ReplSession(runner, lineReader, config.getString("ember.repl.prompt"), err).run();
        }
        return 0;
    }
}
