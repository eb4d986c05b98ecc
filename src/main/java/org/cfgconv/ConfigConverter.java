package org.cfgconv;

import org.cfgconv.api.ConversionResult;
import org.cfgconv.api.IConverter;
import org.cfgconv.api.SyntaxException;
import org.cfgconv.diagnostics.DiagnosticsEngine;
import org.cfgconv.frontend.lexer.Lexer;
import org.cfgconv.frontend.parser.Parser;
import org.cfgconv.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main converter implementation. It runs the lexer and parser over a source and
 * returns the resulting document. Every call uses its own lexer, parser, constant table
 * and diagnostics, so one instance can be shared between threads.
 */
public class ConfigConverter implements IConverter {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigConverter.class);

    @Override
    public ConversionResult convertWithDiagnostics(String source, String sourceName) throws SyntaxException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(source, diagnostics, sourceName);
        Parser parser = new Parser(lexer, diagnostics);

        Document document = parser.parse();

        if (!diagnostics.getDiagnostics().isEmpty()) {
            LOG.debug("Diagnostics for {}:\n{}", sourceName, diagnostics.summary());
        }
        LOG.debug("Parsed {} top-level entries from {} ({} constants)",
                document.size(), sourceName, parser.getConstants().names().size());
        return new ConversionResult(document, diagnostics.getDiagnostics());
    }
}
