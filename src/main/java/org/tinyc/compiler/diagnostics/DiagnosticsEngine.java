package org.tinyc.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics reported while a source file is scanned.
 * <p>
 * The lexer never throws on malformed input; it emits an error token and records the
 * problem here. The driver decides afterwards whether the run failed.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records a lexical error.
     *
     * @param message    What went wrong, e.g. {@code Unexpected character: $}.
     * @param fileName   The source file.
     * @param lineNumber The line the scanner was on.
     */
    public void reportError(String message, String fileName, int lineNumber) {
        report(Diagnostic.Type.ERROR, message, fileName, lineNumber);
    }

    /**
     * Records a warning.
     *
     * @param message    The warning text.
     * @param fileName   The source file.
     * @param lineNumber The line the scanner was on.
     */
    public void reportWarning(String message, String fileName, int lineNumber) {
        report(Diagnostic.Type.WARNING, message, fileName, lineNumber);
    }

    private void report(Diagnostic.Type type, String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(type, message, fileName, lineNumber));
    }

    public boolean hasErrors() {
        return errorCount() > 0;
    }

    /**
     * @return The number of errors reported so far.
     */
    public long errorCount() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * @return All diagnostics in reporting order, as an unmodifiable view.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return One formatted diagnostic per line, in reporting order.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
