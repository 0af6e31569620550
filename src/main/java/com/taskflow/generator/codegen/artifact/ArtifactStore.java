package com.taskflow.generator.codegen.artifact;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.taskflow.generator.codegen.exception.ArtifactIOException;
import com.taskflow.generator.codegen.exception.ArtifactParseException;
import com.taskflow.generator.codegen.exception.NotFoundException;
import com.taskflow.generator.codegen.model.ModuleId;
import com.taskflow.generator.codegen.util.FileWriteUtil;

/**
 * Reads, parses and rewrites module artifacts. Each artifact is read whole,
 * mutated in memory by the caller and written back whole.
 */
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private final ArtifactLayout layout;
    private final SourceParser parser;
    private final TaskTreeMutator mutator;

    public ArtifactStore(ArtifactLayout layout, SourceParser parser, TaskTreeMutator mutator) {
        this.layout = layout;
        this.parser = parser;
        this.mutator = mutator;
    }

    public ArtifactLayout getLayout() {
        return layout;
    }

    public boolean exists(ModuleId module) {
        return Files.isRegularFile(layout.artifactPath(module));
    }

    public Optional<CompilationUnit> load(ModuleId module) {
        Path path = layout.artifactPath(module);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        CompilationUnit unit;
        try {
            unit = parser.parseArtifact(path, Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ArtifactIOException("read", path, e);
        }
        String holder = layout.holderName(module);
        if (unit.getTypes().size() != 1 || !unit.getType(0).isClassOrInterfaceDeclaration()
                || !unit.getType(0).getNameAsString().equals(holder)) {
            throw new ArtifactParseException(path, List.of("expected a single class named " + holder));
        }
        return Optional.of(unit);
    }

    public CompilationUnit loadExisting(ModuleId module) {
        return load(module)
                .orElseThrow(() -> new NotFoundException("File " + layout.display(module) + " not found"));
    }

    /**
     * Loads the artifact, or starts an empty one with the module's holder class.
     */
    public CompilationUnit loadOrCreate(ModuleId module) {
        return load(module).orElseGet(() -> {
            CompilationUnit unit = new CompilationUnit(layout.getBasePackage());
            unit.addClass(layout.holderName(module), Modifier.Keyword.PUBLIC, Modifier.Keyword.FINAL);
            return unit;
        });
    }

    public void write(ModuleId module, CompilationUnit unit) {
        Path path = layout.artifactPath(module);
        try {
            ensureMarker();
            FileWriteUtil.safeWriteString(path, unit.toString());
        } catch (IOException e) {
            throw new ArtifactIOException("write", path, e);
        }
        log.debug("Wrote {}", path);
    }

    public void remove(ModuleId module, String task) {
        CompilationUnit unit = loadExisting(module);
        mutator.remove(unit, module, task);
        write(module, unit);
    }

    /**
     * Source of one segment's statements, or of the whole task class when
     * {@code segment} is null.
     */
    public String readSegment(ModuleId module, String task, String segment) {
        CompilationUnit unit = loadExisting(module);
        ClassOrInterfaceDeclaration declaration = mutator.require(unit, module, task);
        if (segment == null) {
            return declaration.toString();
        }
        return mutator.segmentSource(declaration, segment);
    }

    public List<String> listTasks(ModuleId module) {
        return load(module).map(mutator::taskNames).orElse(List.of());
    }

    public List<String> listModules() {
        Path dir = layout.getModuleDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .map(layout::moduleOf)
                    .flatMap(Optional::stream)
                    .map(ModuleId::getName)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArtifactIOException("list", dir, e);
        }
    }

    private void ensureMarker() throws IOException {
        Path marker = layout.markerPath();
        if (FileWriteUtil.writeIfAbsent(marker, "package " + layout.getBasePackage() + ";\n")) {
            log.info("Created {}", marker);
        }
    }
}
