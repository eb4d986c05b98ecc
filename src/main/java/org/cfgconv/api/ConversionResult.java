package org.cfgconv.api;

import org.cfgconv.diagnostics.Diagnostic;
import org.cfgconv.model.Document;

import java.util.List;

/**
 * The outcome of a successful conversion.
 *
 * @param document The parsed document.
 * @param diagnostics Warnings recorded for input that was skipped or replaced by a fallback.
 */
public record ConversionResult(Document document, List<Diagnostic> diagnostics) {
    public ConversionResult {
        diagnostics = List.copyOf(diagnostics);
    }
}
