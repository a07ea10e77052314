package org.opsforge.plugins.codec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vavr.Function1;
import io.vavr.control.Either;
import io.vavr.control.Try;
import org.opsforge.plugins.FormatError;
import org.opsforge.plugins.Plugin;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON representation of plugin lists: {@code [{"name": ..., "version": ..., "downloadURL": ...}]}.
 * <p>
 * Decoded entries go through {@link Plugin#newPlugin(String, String, String)}, so JSON input is validated
 * exactly like programmatic input.
 */
public interface PluginJsonCodec {
    Either<FormatError, String> serialize(List<Plugin> plugins);

    Either<FormatError, List<Plugin>> deserialize(String json);

    static PluginJsonCodec forMapper(ObjectMapper objectMapper) {
        record pluginJsonCodec(ObjectMapper objectMapper) implements PluginJsonCodec {
            @Override
            public Either<FormatError, String> serialize(List<Plugin> plugins) {
                var entries = new ArrayList<PluginEntry>();

                if (plugins != null) {
                    for (var plugin : plugins) {
                        if (plugin == null) {
                            return NULL_PLUGIN.apply(String.valueOf(entries.size())).either();
                        }
                        entries.add(PluginEntry.pluginEntry(plugin));
                    }
                }
                return Try.of(() -> objectMapper.writeValueAsString(entries))
                          .toEither()
                          .mapLeft(PluginJsonCodec::serializationError);
            }

            @Override
            public Either<FormatError, List<Plugin>> deserialize(String json) {
                return Try.of(() -> objectMapper.readValue(json, ENTRIES))
                          .toEither()
                          .mapLeft(PluginJsonCodec::deserializationError)
                          .flatMap(PluginJsonCodec::toPlugins);
            }
        }
        return new pluginJsonCodec(objectMapper);
    }

    static PluginJsonCodec defaultCodec() {
        return forMapper(new ObjectMapper());
    }

    private static Either<FormatError, List<Plugin>> toPlugins(List<PluginEntry> entries) {
        var plugins = new ArrayList<Plugin>();

        if (entries == null) {
            return Either.right(plugins);
        }

        for (var entry : entries) {
            if (entry == null) {
                return NULL_ENTRY.apply(String.valueOf(plugins.size())).either();
            }
            var plugin = Plugin.newPlugin(entry.name(), entry.version(), entry.downloadURL());

            if (plugin.isLeft()) {
                return plugin.getLeft().either();
            }
            plugins.add(plugin.get());
        }
        return Either.right(plugins);
    }

    private static FormatError serializationError(Throwable throwable) {
        return FormatError.formatError("unable to write plugin JSON: " + throwable.getMessage());
    }

    private static FormatError deserializationError(Throwable throwable) {
        return FormatError.formatError("invalid plugin JSON: " + throwable.getMessage());
    }

    /// Wire shape of a single plugin
    record PluginEntry(@JsonProperty("name") String name,
                       @JsonProperty("version") String version,
                       @JsonProperty("downloadURL") String downloadURL) {
        static PluginEntry pluginEntry(Plugin plugin) {
            return new PluginEntry(plugin.name(), plugin.version(), plugin.downloadURL());
        }
    }

    Function1<String, FormatError> NULL_PLUGIN = FormatError.forOneValue("unable to write plugin JSON: null plugin at index %s");
    Function1<String, FormatError> NULL_ENTRY = FormatError.forOneValue("invalid plugin JSON: null entry at index %s");

    TypeReference<List<PluginEntry>> ENTRIES = new TypeReference<>() {};
}
