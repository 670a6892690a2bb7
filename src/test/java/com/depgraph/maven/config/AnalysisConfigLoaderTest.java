package com.depgraph.maven.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalysisConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_fullConfig_mapsEveryField() throws Exception {
        Path file = write("""
                package_name: "web-app"
                repository_url: "https://example.org/packages"
                test_repository_mode: true
                ascii_tree_output: false
                reverse_mode: true
                graph_export: true
                """);

        AnalysisConfig config = AnalysisConfigLoader.load(file);

        assertThat(config.getPackageName()).isEqualTo("web-app");
        assertThat(config.getRepositoryUrl()).isEqualTo("https://example.org/packages");
        assertThat(config.getAllParameters()).containsKeys("package_name", "repository_url",
                "test_repository_mode", "ascii_tree_output", "reverse_mode", "graph_export");
        assertThat(config.toRequest())
                .isEqualTo(new AnalysisRequest("web-app", true, true, false, true));
    }

    @Test
    void load_optionalFlagsMissing_defaultToFalse() throws Exception {
        Path file = write("""
                package_name: "A"
                repository_url: "https://example.org/packages"
                test_repository_mode: false
                ascii_tree_output: true
                """);

        AnalysisRequest request = AnalysisConfigLoader.load(file).toRequest();

        assertThat(request.isReverseMode()).isFalse();
        assertThat(request.isGraphExportEnabled()).isFalse();
        assertThat(request.isAsciiTreeEnabled()).isTrue();
    }

    @Test
    void load_missingFile_throwsNotFound() {
        Path missing = tempDir.resolve("nope.yaml");

        ConfigFileNotFoundException e = assertThrows(ConfigFileNotFoundException.class,
                () -> AnalysisConfigLoader.load(missing));

        assertThat(e.getMessage()).isEqualTo("Config file not found: " + missing);
    }

    @Test
    void load_missingRequiredField_namesTheField() throws Exception {
        Path file = write("""
                package_name: "A"
                test_repository_mode: false
                ascii_tree_output: true
                """);

        MissingConfigFieldException e = assertThrows(MissingConfigFieldException.class,
                () -> AnalysisConfigLoader.load(file));

        assertThat(e.getField()).isEqualTo("repository_url");
        assertThat(e.getMessage()).isEqualTo("Missing required config field: repository_url");
    }

    @Test
    void load_blankPackageName_isInvalid() throws Exception {
        Path file = write("""
                package_name: "  "
                repository_url: "https://example.org/packages"
                test_repository_mode: false
                ascii_tree_output: true
                """);

        InvalidConfigException e = assertThrows(InvalidConfigException.class,
                () -> AnalysisConfigLoader.load(file));

        assertThat(e.getMessage()).isEqualTo("Invalid value '  ' for field 'package_name': must be non-empty string");
    }

    @Test
    void load_quotedBoolean_isInvalid() throws Exception {
        Path file = write("""
                package_name: "A"
                repository_url: "https://example.org/packages"
                test_repository_mode: "true"
                ascii_tree_output: true
                """);

        InvalidConfigException e = assertThrows(InvalidConfigException.class,
                () -> AnalysisConfigLoader.load(file));

        assertThat(e.getField()).isEqualTo("test_repository_mode");
        assertThat(e.getMessage()).isEqualTo("Invalid value 'true' for field 'test_repository_mode': must be boolean value");
    }

    @Test
    void load_numericOptionalFlag_isInvalid() throws Exception {
        Path file = write("""
                package_name: "A"
                repository_url: "https://example.org/packages"
                test_repository_mode: false
                ascii_tree_output: true
                graph_export: 1
                """);

        InvalidConfigException e = assertThrows(InvalidConfigException.class,
                () -> AnalysisConfigLoader.load(file));

        assertThat(e.getField()).isEqualTo("graph_export");
    }

    @Test
    void load_malformedYaml_reportsParsingError() throws Exception {
        Path file = write("package_name: [unclosed\n");

        ConfigException e = assertThrows(ConfigException.class, () -> AnalysisConfigLoader.load(file));

        assertThat(e.getMessage()).startsWith("YAML parsing error");
    }

    @Test
    void load_scalarDocument_reportsParsingError() throws Exception {
        Path file = write("just some text\n");

        ConfigException e = assertThrows(ConfigException.class, () -> AnalysisConfigLoader.load(file));

        assertThat(e.getMessage()).startsWith("YAML parsing error");
    }

    @Test
    void loadFromResource_bundledSample_isValid() throws Exception {
        AnalysisConfig config = AnalysisConfigLoader.loadFromResource(AnalysisConfigLoader.SAMPLE_RESOURCE);

        assertThat(config.getPackageName()).isEqualTo("A");
        assertThat(config.isAsciiTreeOutput()).isTrue();
        assertThat(config.isGraphExport()).isTrue();
    }

    @Test
    void analysisRequest_rejectsBlankPackageName() {
        assertThrows(IllegalArgumentException.class, () -> new AnalysisRequest(" ", false, false, false, false));
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("depgraph.yaml");
        Files.writeString(file, content);
        return file;
    }
}
