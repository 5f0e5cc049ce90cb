package com.github.wikitext.parsing;

/**
 * Unchecked failure raised while turning wikitext into a node tree.
 */
public class ParsingException extends RuntimeException {
    private static final long serialVersionUID = 3205361786453915570L;

    private final int position;

    public ParsingException(String message) {
        this(message, -1);
    }

    public ParsingException(String message, int position) {
        super(position >= 0 ? String.format("%s (at position %d)", message, position) : message);
        this.position = position;
    }

    public ParsingException(String message, Throwable cause) {
        super(message, cause);
        this.position = -1;
    }

    /**
     * Offset into the source text where parsing stopped, or {@code -1} if unknown.
     */
    public int getPosition() {
        return position;
    }
}
