package io.shortcode.core.error;

import io.shortcode.core.model.Literal;

/**
 * Thrown by a handler when a directive argument is missing, duplicated against policy, or of the
 * wrong literal type. The renderer surfaces it wrapped in a {@link DirectiveFailedException}.
 */
public final class InvalidArgumentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String argument;

    public InvalidArgumentException(String message, String argument) {
        super(message);
        this.argument = argument;
    }

    public static InvalidArgumentException missing(String argument) {
        return new InvalidArgumentException("Missing required argument '" + argument + "'", argument);
    }

    public static InvalidArgumentException wrongType(String argument, Literal.Type expected, Literal actual) {
        return new InvalidArgumentException(
                String.format("Argument '%s' must be %s, got %s", argument, expected, actual.type()), argument);
    }

    public static InvalidArgumentException duplicate(String argument) {
        return new InvalidArgumentException("Argument '" + argument + "' given more than once", argument);
    }

    /** The offending argument name. */
    public String argument() {
        return argument;
    }
}
