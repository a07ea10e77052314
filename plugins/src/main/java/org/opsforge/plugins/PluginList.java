package org.opsforge.plugins;

import io.vavr.Function2;
import io.vavr.control.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented plugin list.
 * <p>
 * Format:
 * <pre>
 * # Comment line
 *
 * kubernetes:1.29.0
 * workflow-job:2.40
 * git:4.7.0
 * </pre>
 * Blank lines and {@code #} comments are skipped. Any other line must be in {@code name:version} notation.
 */
public final class PluginList {
    private static final Logger log = LoggerFactory.getLogger(PluginList.class);

    private PluginList() {}

    /**
     * Parse plugin list content. Fails on the first invalid line.
     *
     * @param content list content
     * @return plugins in file order or error pointing to the offending line
     */
    public static Either<FormatError, List<Plugin>> parse(String content) {
        var plugins = new ArrayList<Plugin>();

        if (content == null) {
            return Either.right(plugins);
        }

        var lines = content.split("\\R");

        for (int i = 0; i < lines.length; i++) {
            var trimmed = lines[i].trim();

            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            var parsed = Plugin.parsePlugin(trimmed);

            if (parsed.isLeft()) {
                return INVALID_LINE.apply(String.valueOf(i + 1), parsed.getLeft().message()).either();
            }
            plugins.add(parsed.get());
        }

        log.debug("Parsed {} plugins", plugins.size());
        return Either.right(plugins);
    }

    public static String asString(List<Plugin> plugins) {
        var sb = new StringBuilder();

        for (var plugin : plugins) {
            sb.append(plugin).append('\n');
        }
        return sb.toString();
    }

    private static final Function2<String, String, FormatError> INVALID_LINE =
            FormatError.forTwoValues("invalid plugin list line %s: %s");
}
