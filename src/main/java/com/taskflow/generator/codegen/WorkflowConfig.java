package com.taskflow.generator.codegen;

import java.nio.file.Path;
import java.time.Duration;

import com.taskflow.generator.codegen.naming.IdentifierPolicy;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

/**
 * Configuration for the workflow engine.
 */
@Data
@Builder
public class WorkflowConfig {

    /** Project directory; artifacts live below it and scripts run in it. */
    @NonNull
    private Path baseDir;

    /** Package every module artifact declares. */
    @NonNull
    @Builder.Default
    private String basePackage = "tasks";

    @NonNull
    @Builder.Default
    private String defaultArtifactName = "DefaultModule.java";

    /** Reject malformed names instead of cleaning them up. */
    private boolean strictIdentifiers;

    @NonNull
    @Builder.Default
    private Duration executionTimeout = Duration.ofSeconds(300);

    @NonNull
    @Builder.Default
    private Path javaExecutable = Path.of(System.getProperty("java.home"), "bin", "java");

    /** Class path handed to flow scripts, typically the compiled runtime and tasks. */
    private String runtimeClasspath;

    /**
     * Directory holding the module artifacts.
     */
    public Path getModuleDir() {
        return baseDir.resolve(basePackage.replace('.', '/'));
    }

    public IdentifierPolicy identifierPolicy() {
        return strictIdentifiers ? IdentifierPolicy.validating() : IdentifierPolicy.sanitizing();
    }
}
