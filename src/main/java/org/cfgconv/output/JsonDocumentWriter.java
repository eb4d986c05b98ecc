package org.cfgconv.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.cfgconv.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes {@link Document}s to pretty-printed JSON.
 * <p>
 * Entries and struct fields keep their insertion order, every object member and array
 * element goes on its own line and non-ASCII characters are written unescaped.
 */
public class JsonDocumentWriter {

    private static final Logger LOG = LoggerFactory.getLogger(JsonDocumentWriter.class);

    /** The indent used when none is configured. */
    public static final int DEFAULT_INDENT = 2;

    private final ObjectWriter writer;

    public JsonDocumentWriter() {
        this(DEFAULT_INDENT);
    }

    /**
     * Creates a writer with the given indent width.
     * @param indent The number of spaces per nesting level, at least 0.
     */
    public JsonDocumentWriter(int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("Indent must not be negative: " + indent);
        }
        DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indent), "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        this.writer = new ObjectMapper().writer(printer);
    }

    /**
     * Renders the document as JSON text.
     * @param document The document to render.
     * @return The JSON text, without trailing newline.
     * @throws JsonProcessingException if serialization fails.
     */
    public String toJson(Document document) throws JsonProcessingException {
        return writer.writeValueAsString(document.unwrap());
    }

    /**
     * Writes the document as UTF-8 JSON, creating missing parent directories.
     * @param document The document to write.
     * @param target The output file.
     * @throws IOException if the directories or the file cannot be written.
     */
    public void write(Document document, Path target) throws IOException {
        String json = toJson(document);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
            LOG.debug("Created output directory {}", parent);
        }
        Files.writeString(target, json + "\n", StandardCharsets.UTF_8);
    }
}
