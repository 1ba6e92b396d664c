package com.largomodo.imagereview.core;

/**
 * Thrown when a cell pattern (typically a manual edit) is not a valid regular expression.
 * <p>
 * RuntimeException so compilation can be attempted inline; scanner and resolver catch it,
 * log the offending text and carry on with the remaining cells.
 */
public class MalformedCellPatternException extends RuntimeException {

    /**
     * Constructs exception with descriptive message.
     *
     * @param message Details about the rejected pattern
     */
    public MalformedCellPatternException(String message) {
        super(message);
    }

    /**
     * Constructs exception with message and underlying cause.
     */
    public MalformedCellPatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
