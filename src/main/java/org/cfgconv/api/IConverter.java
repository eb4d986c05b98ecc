package org.cfgconv.api;

import org.cfgconv.model.Document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface for converting configuration sources into {@link Document}s.
 */
public interface IConverter {

    /**
     * Parses the given source.
     *
     * @param source The complete source text.
     * @param sourceName A name for the source, used in error messages.
     * @return The parsed document.
     * @throws SyntaxException if the source is not syntactically valid.
     */
    default Document convert(String source, String sourceName) throws SyntaxException {
        return convertWithDiagnostics(source, sourceName).document();
    }

    /**
     * Parses the given source and returns the warnings recorded along the way.
     *
     * @param source The complete source text.
     * @param sourceName A name for the source, used in error messages.
     * @return The parsed document together with its diagnostics.
     * @throws SyntaxException if the source is not syntactically valid.
     */
    ConversionResult convertWithDiagnostics(String source, String sourceName) throws SyntaxException;

    /**
     * Reads a UTF-8 source file and parses it.
     * @param sourcePath The path to the source file.
     * @return The parsed document.
     * @throws SyntaxException if the source is not syntactically valid.
     * @throws IOException if the file cannot be read.
     */
    default Document convert(Path sourcePath) throws SyntaxException, IOException {
        return convert(Files.readString(sourcePath, StandardCharsets.UTF_8), sourcePath.toString());
    }
}
