package org.cfgconv.api;

/**
 * A pure data class representing a position in the source code.
 *
 * @param fileName The source the position refers to.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
