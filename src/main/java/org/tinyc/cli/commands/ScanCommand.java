package org.tinyc.cli.commands;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tinyc.cli.CommandLineInterface;
import org.tinyc.compiler.diagnostics.Diagnostic;
import org.tinyc.compiler.diagnostics.DiagnosticsEngine;
import org.tinyc.compiler.frontend.lexer.Lexer;
import org.tinyc.compiler.frontend.lexer.LexerOptions;
import org.tinyc.compiler.frontend.lexer.Token;
import org.tinyc.compiler.frontend.lexer.TokenType;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "scan", description = "Scans a TINY source file, echoing its lines and tracing every token.")
public class ScanCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ScanCommand.class);

    /** Appended to program names that have no extension. */
    public static final String DEFAULT_EXTENSION = ".tny";

    /** Exit code for a missing source file. */
    public static final int EXIT_FILE_NOT_FOUND = 1;
    /** Exit code for lexical errors when {@code --fail-on-error} is set. */
    public static final int EXIT_LEXICAL_ERRORS = 2;

    @Parameters(index = "0", paramLabel = "PROGRAM", description = "The source file; '" + DEFAULT_EXTENSION + "' is appended if it has no extension.")
    private String program;

    @Option(names = "--echo", negatable = true, description = "Echo each source line to the listing (default from config).")
    private Boolean echo;

    @Option(names = "--trace", negatable = true, description = "Trace each token to the listing (default from config).")
    private Boolean trace;

    @Option(names = "--fail-on-error", description = "Exit with code " + EXIT_LEXICAL_ERRORS + " if error tokens were found.")
    private boolean failOnError;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final String programName = normalizeProgramName(program);
        final File file = new File(programName);
        if (!file.isFile()) {
            spec.commandLine().getErr().println("File " + programName + " not found");
            return EXIT_FILE_NOT_FOUND;
        }

        final Config config = parent.getConfig();
        LexerOptions options = LexerOptions.fromConfig(config.getConfig("tinyc.lexer"));
        if (echo != null) {
            options = options.withEchoSource(echo);
        }
        if (trace != null) {
            options = options.withTraceScan(trace);
        }

        final PrintWriter listing = spec.commandLine().getOut();
        listing.println();
        listing.println("COMPILATION: " + programName);

        final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        int tokenCount = 0;
        int lineCount;
        try (Reader source = Files.newBufferedReader(file.toPath(), StandardCharsets.ISO_8859_1)) {
            final Lexer lexer = new Lexer(source, programName, options, diagnostics, listing);
            for (Token token = lexer.getToken(); token.type() != TokenType.END_OF_FILE; token = lexer.getToken()) {
                tokenCount++;
            }
            lineCount = lexer.getLineNumber();
        }
        listing.flush();

        LOG.info("Scanned {}: {} lines, {} tokens, {} errors", programName, lineCount, tokenCount, diagnostics.errorCount());
        final PrintWriter err = spec.commandLine().getErr();
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            err.println(diagnostic);
        }
        err.flush();

        return failOnError && diagnostics.hasErrors() ? EXIT_LEXICAL_ERRORS : 0;
    }

    /**
     * Appends {@value #DEFAULT_EXTENSION} if the file name part contains no '.'.
     * @param name The program name as given on the command line.
     * @return The file name to open.
     */
    static String normalizeProgramName(String name) {
        return new File(name).getName().indexOf('.') < 0 ? name + DEFAULT_EXTENSION : name;
    }
}
