package com.cmakeparser;

/**
 * Structural error in a CMake script: bad command name, missing parenthesis,
 * unmatched bracket or a block without its terminator.
 */
public class ParseException extends CMakeException {
    private final int line;
    private final int column;
    private final String text;

    public ParseException(String message, int line, int column, String text) {
        super(message + " at line " + line + ", column " + column + ": " + quote(text));
        this.line = line;
        this.column = column;
        this.text = text;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    /**
     * The source text of the offending token or command.
     */
    public String text() {
        return text;
    }

    private static String quote(String text) {
        String escaped = text
            .replace("\\", "\\\\")
            .replace("'", "\\'")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace("\t", "\\t");
        return "'" + escaped + "'";
    }
}
