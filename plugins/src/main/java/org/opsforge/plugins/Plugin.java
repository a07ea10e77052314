package org.opsforge.plugins;

import io.vavr.Function1;
import io.vavr.Function3;
import io.vavr.Function4;
import io.vavr.control.Either;
import io.vavr.control.Option;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Plugin coordinates: name, version and optional download URL.
 * <p>
 * Use {@link #parsePlugin(String)} or {@link #newPlugin(String, String, String)} to build instances from
 * untrusted input. Both return a failed {@link Either} instead of throwing. The {@code must*} helpers unwrap
 * the result and throw, so they are only meant for values known to be valid (constants, tests).
 *
 * @param name        plugin name, matches {@link #NAME_PATTERN}
 * @param version     plugin version, matches {@link #VERSION_PATTERN}
 * @param downloadURL download location, empty or containing a match of {@link #DOWNLOAD_URL_PATTERN}
 */
public record Plugin(String name, String version, String downloadURL) {
    public static final Pattern NAME_PATTERN = Pattern.compile("^[0-9a-zA-Z\\-_]+$");
    public static final Pattern VERSION_PATTERN = Pattern.compile("^[0-9a-zA-Z\\-_+\\\\.]+$");
    public static final Pattern DOWNLOAD_URL_PATTERN = Pattern.compile(
            "https?:\\/\\/(www\\.)?[-a-zA-Z0-9@:%._\\+~#=]{1,256}\\.[a-zA-Z0-9()]{1,6}\\b([-a-zA-Z0-9()@:%_\\+.~#?&//=]*)");

    public Plugin {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        downloadURL = downloadURL == null ? "" : downloadURL;

        var error = validate(name, version, downloadURL);
        if (error.isDefined()) {
            throw new IllegalArgumentException(error.get().message());
        }
    }

    /**
     * Parse plugin from {@code name:version} notation, for example {@code "git-client:4.7.0"}.
     * <p>
     * Only the first colon separates name from version.
     *
     * @param nameWithVersion combined notation
     * @return parsed plugin or format error
     */
    public static Either<FormatError, Plugin> parsePlugin(String nameWithVersion) {
        if (nameWithVersion == null) {
            return INVALID_FORMAT.apply(null).either();
        }
        var parts = nameWithVersion.split(":", 2);
        if (parts.length != 2) {
            return INVALID_FORMAT.apply(nameWithVersion).either();
        }
        return newPlugin(parts[0], parts[1], "");
    }

    /**
     * Create plugin from separate fields. Checks name, then version, then download URL (when not empty) and
     * reports the first violation only. Values are kept exactly as given.
     *
     * @param name        plugin name
     * @param version     plugin version
     * @param downloadURL download URL, may be empty or {@code null}
     * @return plugin or format error
     */
    public static Either<FormatError, Plugin> newPlugin(String name, String version, String downloadURL) {
        return validate(name, version, downloadURL)
                .<Either<FormatError, Plugin>>fold(() -> Either.right(new Plugin(name, version, downloadURL)),
                                                   error -> error.<Plugin>either());
    }

    /**
     * Unwrap a plugin creation result.
     *
     * @throws IllegalStateException if the result holds a format error
     */
    public static Plugin mustPlugin(Either<FormatError, Plugin> result) {
        return result.getOrElseThrow(error -> new IllegalStateException(error.message()));
    }

    public static Plugin mustParse(String nameWithVersion) {
        return mustPlugin(parsePlugin(nameWithVersion));
    }

    public static Plugin must(String name, String version) {
        return mustPlugin(newPlugin(name, version, ""));
    }

    public boolean hasDownloadURL() {
        return !downloadURL.isEmpty();
    }

    @Override
    public String toString() {
        return name + ":" + version;
    }

    private static Option<FormatError> validate(String name, String version, String downloadURL) {
        if (!matches(NAME_PATTERN, name)) {
            return Option.some(INVALID_NAME.apply(name, version, NAME_PATTERN.pattern()));
        }
        if (!matches(VERSION_PATTERN, version)) {
            return Option.some(INVALID_VERSION.apply(name, version, VERSION_PATTERN.pattern()));
        }
        if (downloadURL != null && !downloadURL.isEmpty()
            && !DOWNLOAD_URL_PATTERN.matcher(downloadURL).find()) {
            return Option.some(INVALID_DOWNLOAD_URL.apply(downloadURL, name, version, DOWNLOAD_URL_PATTERN.pattern()));
        }
        return Option.none();
    }

    private static boolean matches(Pattern pattern, String value) {
        return value != null && pattern.matcher(value).matches();
    }

    private static final Function1<String, FormatError> INVALID_FORMAT =
            FormatError.forOneValue("invalid plugin format '%s'");
    private static final Function3<String, String, String, FormatError> INVALID_NAME =
            FormatError.forThreeValues("invalid plugin name '%s:%s', must follow pattern '%s'");
    private static final Function3<String, String, String, FormatError> INVALID_VERSION =
            FormatError.forThreeValues("invalid plugin version '%s:%s', must follow pattern '%s'");
    private static final Function4<String, String, String, String, FormatError> INVALID_DOWNLOAD_URL =
            (url, name, version, pattern) -> FormatError.formatError(
                    String.format("invalid download URL '%s' for plugin name %s:%s, must follow pattern '%s'",
                                  url, name, version, pattern));
}
