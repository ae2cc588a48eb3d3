package com.linkchex.cli;

import com.linkchex.core.model.CheckConfig;
import com.linkchex.core.model.CheckConfig.OutputFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliOptionsTest {

    @TempDir Path tmp;

    @Test
    void parses_all_flag_styles() throws Exception {
        CliOptions o = CliOptions.parse(new String[]{
                "--sitemap", "https://ex.com/sitemap.xml",
                "--concurrency=50",
                "-page-concurrency", "3",
                "--timeout", "5",
                "--retries", "2",
                "--rate-limit", "2.5",
                "--deadline", "60",
                "--exclude", "*.pdf", "--exclude", "^https://ex\\.com/private/",
                "--include", "https://ex.com/*",
                "--check-external", "--skip-resources", "--default-excludes",
                "--format", "JSON", "-o", "out.json",
                "--progress", "-v"});

        CheckConfig cfg = o.toConfig();

        assertThat(cfg.getSitemap()).isEqualTo("https://ex.com/sitemap.xml");
        assertThat(cfg.getLinkConcurrency()).isEqualTo(50);
        assertThat(cfg.getPageConcurrency()).isEqualTo(3);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(cfg.getMaxRetries()).isEqualTo(2);
        assertThat(cfg.getRateLimit()).isEqualTo(2.5);
        assertThat(cfg.getRunTimeout()).isEqualTo(Duration.ofMinutes(1));
        assertThat(cfg.getExcludePatterns()).containsExactly("*.pdf", "^https://ex\\.com/private/");
        assertThat(cfg.getIncludePatterns()).containsExactly("https://ex.com/*");
        assertThat(cfg.isCheckExternal()).isTrue();
        assertThat(cfg.isSkipResources()).isTrue();
        assertThat(cfg.isDefaultExcludes()).isTrue();
        assertThat(cfg.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(cfg.getOutput()).isEqualTo(Path.of("out.json"));
        assertThat(cfg.isProgress()).isTrue();
        assertThat(cfg.isVerbose()).isTrue();
    }

    @Test
    void flags_override_config_file_and_source_replaces_other_source() throws Exception {
        Path yml = tmp.resolve("linkchex.yml");
        Files.writeString(yml, "url: https://from-file.example\nconcurrency: 7\nretries: 4\n");

        CheckConfig cfg = CliOptions.parse(new String[]{"--config", yml.toString(),
                "--sitemap", "local.xml", "--retries", "0"}).toConfig();

        assertThat(cfg.getUrl()).isNull();
        assertThat(cfg.getSitemap()).isEqualTo("local.xml");
        assertThat(cfg.getLinkConcurrency()).isEqualTo(7);
        assertThat(cfg.getMaxRetries()).isZero();
    }

    @Test
    void boolean_with_inline_value() {
        assertThat(CliOptions.parse(new String[]{"--check-external=false"}).checkExternal).isFalse();
        assertThat(CliOptions.parse(new String[]{"--list-only=true"}).listOnly).isTrue();
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--verbose=maybe"}))
                .isInstanceOf(CliOptions.UsageException.class);
    }

    @Test
    void usage_errors() {
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--bogus", "1"}))
                .isInstanceOf(CliOptions.UsageException.class)
                .hasMessage("flag provided but not defined: -bogus");
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--concurrency"}))
                .hasMessageContaining("flag needs an argument");
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--concurrency", "many"}))
                .hasMessageContaining("not an integer");
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"stray"}))
                .hasMessageContaining("unexpected argument");
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--timeout", "0"}).toConfig())
                .isInstanceOf(CliOptions.UsageException.class);
    }

    @Test
    void usage_mentions_exit_codes() {
        assertThat(CliOptions.usage()).contains("--sitemap").contains("Exit codes");
    }
}
