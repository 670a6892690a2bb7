package com.depgraph.maven;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.depgraph.maven.config.AnalysisConfigLoader;

/**
 * Writes a sample analysis configuration file.
 * <p>
 * Run manually: {@code mvn depgraph:create-sample-config}
 */
@Mojo(name = "create-sample-config", requiresProject = false)
public class CreateSampleConfigMojo extends AbstractMojo {

    @Parameter(property = "depgraph.configFile", defaultValue = "${project.basedir}/depgraph.yaml")
    private File configFile;

    @Parameter(property = "depgraph.force", defaultValue = "false")
    private boolean force;

    @Override
    public void execute() throws MojoExecutionException {
        Path target = configFile.toPath();
        if (Files.exists(target) && !force) {
            throw new MojoExecutionException("Config file already exists: " + target
                    + "\nUse -Ddepgraph.force=true to overwrite it.");
        }

        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, AnalysisConfigLoader.sampleConfig(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to write sample config " + target, e);
        }
        getLog().info("Created sample config file: " + target);
    }
}
