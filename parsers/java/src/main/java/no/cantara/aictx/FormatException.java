package no.cantara.aictx;

/**
 * Thrown when a file's frontmatter block is missing, unterminated, not a YAML mapping,
 * or lacks {@code id}/{@code kind}.
 */
public class FormatException extends IllegalArgumentException {
    public FormatException(String msg) { super(msg); }
    public FormatException(String msg, Throwable cause) { super(msg, cause); }
}
