package com.taskflow.generator.codegen.artifact;

import java.nio.file.Path;
import java.util.Optional;

import com.taskflow.generator.codegen.WorkflowConfig;
import com.taskflow.generator.codegen.model.ModuleId;

/**
 * Where each module's artifact lives: {@code {moduleDir}/{module}.java}, with the
 * default module in a fixed file next to them.
 *
 * <p>Every artifact declares the base package and one public class named after
 * its file. Tasks are public static members of that class, so any module, or a
 * script outside the package, can reach them as {@code module.Task}.
 */
public class ArtifactLayout {

    public static final String EXTENSION = ".java";
    public static final String MARKER_FILE = "package-info.java";

    private final Path baseDir;
    private final Path moduleDir;
    private final String basePackage;
    private final String defaultArtifactName;

    public ArtifactLayout(WorkflowConfig config) {
        this.baseDir = config.getBaseDir();
        this.moduleDir = config.getModuleDir();
        this.basePackage = config.getBasePackage();
        this.defaultArtifactName = config.getDefaultArtifactName();
    }

    public Path artifactPath(ModuleId module) {
        return moduleDir.resolve(module.isDefault() ? defaultArtifactName : module.getName() + EXTENSION);
    }

    /**
     * Name of the class that holds the module's tasks.
     */
    public String holderName(ModuleId module) {
        if (module.isDefault()) {
            return defaultArtifactName.endsWith(EXTENSION)
                    ? defaultArtifactName.substring(0, defaultArtifactName.length() - EXTENSION.length())
                    : defaultArtifactName;
        }
        return module.getName();
    }

    /**
     * Symbol a task is reachable under from outside its module.
     */
    public String taskSymbol(ModuleId module, String task) {
        return holderName(module) + "." + task;
    }

    public Path markerPath() {
        return moduleDir.resolve(MARKER_FILE);
    }

    public Path getModuleDir() {
        return moduleDir;
    }

    public String getBasePackage() {
        return basePackage;
    }

    /**
     * Maps a file in the module directory back to its named module. The default
     * artifact and the marker are not named modules.
     */
    public Optional<ModuleId> moduleOf(Path file) {
        String fileName = file.getFileName().toString();
        if (!fileName.endsWith(EXTENSION) || fileName.equals(defaultArtifactName) || fileName.equals(MARKER_FILE)) {
            return Optional.empty();
        }
        return Optional.of(ModuleId.of(fileName.substring(0, fileName.length() - EXTENSION.length())));
    }

    /**
     * Artifact path relative to the project directory, for messages.
     */
    public String display(ModuleId module) {
        return baseDir.relativize(artifactPath(module)).toString().replace('\\', '/');
    }
}
