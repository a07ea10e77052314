package org.opsforge.plugins;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PluginListTest {

    @Test
    void parse_skips_comments_and_blank_lines() {
        var content = """
                # Base plugins
                kubernetes:1.29.0

                  workflow-job:2.40  
                # Source control
                git:4.7.0
                """;

        PluginList.parse(content)
                  .peekLeft(error -> Assertions.fail(error.message()))
                  .peek(plugins -> assertThat(plugins).containsExactly(Plugin.must("kubernetes", "1.29.0"),
                                                                       Plugin.must("workflow-job", "2.40"),
                                                                       Plugin.must("git", "4.7.0")));
    }

    @Test
    void parse_handles_windows_line_endings() {
        PluginList.parse("git:4.7.0\r\nkubernetes:1.29.0\r\n")
                  .peekLeft(error -> Assertions.fail(error.message()))
                  .peek(plugins -> assertThat(plugins).hasSize(2));
    }

    @Test
    void parse_empty_content_returns_empty_list() {
        PluginList.parse("")
                  .peekLeft(error -> Assertions.fail(error.message()))
                  .peek(plugins -> assertThat(plugins).isEmpty());

        PluginList.parse(null)
                  .peekLeft(error -> Assertions.fail(error.message()))
                  .peek(plugins -> assertThat(plugins).isEmpty());
    }

    @Test
    void parse_reports_first_invalid_line() {
        var content = "git:4.7.0\n# comment\nbroken-entry\nbad name:1.0\n";

        PluginList.parse(content)
                  .peek(plugins -> Assertions.fail("Should fail on line 3"))
                  .peekLeft(error -> assertThat(error.message())
                          .isEqualTo("invalid plugin list line 3: invalid plugin format 'broken-entry'"));
    }

    @Test
    void parse_reports_validation_message_of_line() {
        PluginList.parse("git:4.7.0\nbad name:1.0")
                  .peek(plugins -> Assertions.fail("Should fail on line 2"))
                  .peekLeft(error -> assertThat(error.message()).startsWith("invalid plugin list line 2: invalid plugin name"));
    }

    @Test
    void as_string_renders_one_plugin_per_line() {
        var plugins = List.of(Plugin.must("git", "4.7.0"), Plugin.must("kubernetes", "1.29.0"));

        assertThat(PluginList.asString(plugins)).isEqualTo("git:4.7.0\nkubernetes:1.29.0\n");
        assertThat(PluginList.parse(PluginList.asString(plugins)).get()).isEqualTo(plugins);
    }
}
