package org.opsforge.plugins;

import io.vavr.Function1;
import io.vavr.Function2;
import io.vavr.Function3;
import io.vavr.control.Either;

/**
 * Describes malformed plugin input: bad name, version, download URL or combined notation.
 * <p>
 * The message always embeds the offending value(s) and, where a pattern was violated, the pattern itself.
 *
 * @param message human-readable description of the problem
 */
public record FormatError(String message) {
    public static FormatError formatError(String message) {
        return new FormatError(message);
    }

    public static Function1<String, FormatError> forOneValue(String template) {
        return value -> formatError(String.format(template, value));
    }

    public static Function2<String, String, FormatError> forTwoValues(String template) {
        return (first, second) -> formatError(String.format(template, first, second));
    }

    public static Function3<String, String, String, FormatError> forThreeValues(String template) {
        return (first, second, third) -> formatError(String.format(template, first, second, third));
    }

    /**
     * Wrap this error into a failed result.
     */
    public <T> Either<FormatError, T> either() {
        return Either.left(this);
    }

    @Override
    public String toString() {
        return message;
    }
}
