package net.neoforged.rewrite.lang;

import java.io.IOException;

/**
 * Thrown when a syntax error is found in a source file.
 */
public class SourceParseException extends IOException {
    public final int line;
    public final int column;

    public SourceParseException(String message, int line, int column) {
        super(line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
    }
}
