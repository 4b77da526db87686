package io.github.yok.leaguerow.core;

/**
 * Thrown when a row is structurally unusable, such as a {@code null} cell map or a required column
 * key that is missing entirely.
 *
 * <p>
 * This is a caller contract violation and is distinct from a field that could not be parsed: an
 * empty or malformed cell never raises this exception.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class InvalidRowException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param message description of the violation
     */
    public InvalidRowException(String message) {
        super(message);
    }
}
