package eu.fbk.slopat.data;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Signals a failure in parsing a string according to some formal grammar.
 * <p>
 * This exception is thrown when a term, a statement text or any other string obeying some formal
 * grammar cannot be parsed (e.g., syntax error, unknown namespace prefix). The offending string
 * is kept for debugging purposes.
 * </p>
 */
public class ParseException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String parsedString;

    /**
     * Creates a new instance with the parsed string and the optional error message specified.
     *
     * @param parsedString
     *            a parsed string, for debugging purposes
     * @param message
     *            an optional error message, to which the supplied string is concatenated
     */
    public ParseException(final String parsedString, @Nullable final String message) {
        this(parsedString, message, null);
    }

    /**
     * Creates a new instance with the parsed string, optional error message and cause specified.
     *
     * @param parsedString
     *            a parsed string, for debugging purposes
     * @param message
     *            an optional error message, to which the supplied parsed string is concatenated
     * @param cause
     *            the optional cause of this exception
     */
    public ParseException(final String parsedString, @Nullable final String message,
            @Nullable final Throwable cause) {

        super(message + (parsedString == null ? "" : " (parsed string: " + abbreviate(parsedString)
                + ")"), cause);

        Preconditions.checkNotNull(parsedString);
        this.parsedString = parsedString;
    }

    /**
     * Returns the parsed string. This property is intended for debugging purposes.
     *
     * @return the parsed string
     */
    public final String getParsedString() {
        return this.parsedString;
    }

    private static String abbreviate(final String string) {
        return string.length() <= 80 ? string : string.substring(0, 77) + "...";
    }

}
