package com.taskflow.generator.codegen;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.taskflow.generator.codegen.artifact.ArtifactLayout;
import com.taskflow.generator.codegen.artifact.ArtifactStore;
import com.taskflow.generator.codegen.artifact.ImportMerger;
import com.taskflow.generator.codegen.artifact.SourceParser;
import com.taskflow.generator.codegen.artifact.TaskTreeMutator;
import com.taskflow.generator.codegen.dependency.DependencyResolver;
import com.taskflow.generator.codegen.dependency.RequiresAnnotations;
import com.taskflow.generator.codegen.exception.DuplicateException;
import com.taskflow.generator.codegen.exception.NotFoundException;
import com.taskflow.generator.codegen.flow.FlowScriptExecutor;
import com.taskflow.generator.codegen.flow.FlowScriptGenerator;
import com.taskflow.generator.codegen.flow.FlowScripts;
import com.taskflow.generator.codegen.model.InputReference;
import com.taskflow.generator.codegen.model.ModuleId;
import com.taskflow.generator.codegen.model.ResolvedDependencies;
import com.taskflow.generator.codegen.model.TaskDefinition;
import com.taskflow.generator.codegen.model.TaskUpdate;
import com.taskflow.generator.codegen.naming.IdentifierKind;
import com.taskflow.generator.codegen.naming.IdentifierPolicy;
import com.taskflow.generator.codegen.task.InputLoadTransform;
import com.taskflow.generator.codegen.task.TaskConventions;
import com.taskflow.generator.codegen.task.TaskSourceGenerator;

/**
 * Create, read, update, upsert, delete and rename task definitions.
 *
 * <p>Every operation validates its input before touching an artifact, then reads
 * the module artifact, mutates its syntax tree and writes it back whole. A failed
 * operation leaves the artifact as it was.
 */
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private final WorkflowConfig config;
    private final IdentifierPolicy identifierPolicy;
    private final ArtifactStore store;
    private final TaskTreeMutator mutator;
    private final ImportMerger importMerger;
    private final DependencyResolver dependencyResolver;
    private final RequiresAnnotations requiresAnnotations;
    private final TaskSourceGenerator generator;
    private final InputLoadTransform inputLoad;
    private final FlowScripts flowScripts;

    public WorkflowService(WorkflowConfig config) {
        this.config = config;
        this.identifierPolicy = config.identifierPolicy();

        SourceParser parser = new SourceParser();
        this.mutator = new TaskTreeMutator();
        this.store = new ArtifactStore(new ArtifactLayout(config), parser, mutator);
        this.importMerger = new ImportMerger(parser);
        this.dependencyResolver = new DependencyResolver(store, identifierPolicy);
        this.requiresAnnotations = new RequiresAnnotations(parser);
        this.inputLoad = new InputLoadTransform();
        this.generator = new TaskSourceGenerator(parser, identifierPolicy, requiresAnnotations, inputLoad);
        this.flowScripts = new FlowScripts(config,
                new FlowScriptGenerator(config, store, identifierPolicy),
                new FlowScriptExecutor(config));
    }

    // ---------- CRUD ----------

    /**
     * Adds a new task class to its module, creating the module if needed.
     *
     * @return status message
     * @throws DuplicateException if the module already has a task with that name
     */
    public String create(TaskDefinition definition) {
        ModuleId module = resolveModule(definition.getModule());
        String task = identifierPolicy.apply(definition.getName(), IdentifierKind.TASK);

        ResolvedDependencies dependencies = dependencyResolver.resolve(definition.getInputs(), module);
        ClassOrInterfaceDeclaration declaration =
                generator.generate(task, definition.getSegments(), dependencies.getEntries());

        CompilationUnit unit = store.loadOrCreate(module);
        if (mutator.locate(unit, task).isPresent()) {
            throw new DuplicateException("Task " + task + " already exists in " + module.displayName());
        }

        importMerger.merge(unit, TaskConventions.BASE_IMPORTS);
        importMerger.merge(unit, dependencies.importBlock(config.getBasePackage()));
        importMerger.merge(unit, definition.getImports());
        mutator.insert(unit, declaration);
        store.write(module, unit);

        String status = "Created " + task + " in " + module.displayName();
        log.info(status);
        return status;
    }

    /**
     * Updates the task when it exists, otherwise creates it.
     */
    public String upsert(TaskDefinition definition) {
        ModuleId module = resolveModule(definition.getModule());
        String task = identifierPolicy.apply(definition.getName(), IdentifierKind.TASK);

        boolean exists = store.load(module)
                .flatMap(unit -> mutator.locate(unit, task))
                .isPresent();
        if (exists) {
            return update(TaskUpdate.builder()
                    .name(task)
                    .module(definition.getModule())
                    .segments(definition.getSegments())
                    .inputs(definition.getInputs())
                    .imports(definition.getImports())
                    .build());
        }
        return create(definition.toBuilder().name(task).build());
    }

    /**
     * Upserts a task given only its primary segment body.
     */
    public String upsertPrimary(String task, String code, String module, List<InputReference> inputs,
                                String imports) {
        return upsert(TaskDefinition.builder()
                .name(task)
                .module(module)
                .segment(TaskConventions.PRIMARY_SEGMENT, code)
                .inputs(inputs)
                .imports(imports)
                .build());
    }

    /**
     * Upserts one additional segment. An existing primary body is kept; a new task
     * gets a primary segment that saves an empty result.
     */
    public String upsertSegment(String task, String segment, String code, String module,
                                List<InputReference> inputs, String imports) {
        String primary;
        try {
            primary = readPrimary(task, module);
        } catch (NotFoundException e) {
            log.debug("No existing {} to keep: {}", TaskConventions.PRIMARY_SEGMENT, e.getMessage());
            primary = TaskConventions.RESULT_BINDING + " = null;";
        }
        Map<String, String> segments = new LinkedHashMap<>();
        segments.put(TaskConventions.PRIMARY_SEGMENT, primary);
        segments.put(segment, code);
        return upsert(TaskDefinition.builder()
                .name(task)
                .module(module)
                .segments(segments)
                .inputs(inputs)
                .imports(imports)
                .build());
    }

    /**
     * Source of one segment body, without the input-load statement, or of the
     * whole task class when {@code segment} is null. Additional segment names go
     * through the same cleanup as when they were stored.
     */
    public String read(String task, String module, String segment) {
        ModuleId moduleId = resolveModule(module);
        String taskId = identifierPolicy.apply(task, IdentifierKind.TASK);
        if (segment == null) {
            return store.readSegment(moduleId, taskId, null);
        }
        String segmentId = segment.equals(TaskConventions.PRIMARY_SEGMENT)
                ? segment
                : identifierPolicy.apply(segment, IdentifierKind.SEGMENT);
        return inputLoad.strip(store.readSegment(moduleId, taskId, segmentId));
    }

    public String readPrimary(String task, String module) {
        return read(task, module, TaskConventions.PRIMARY_SEGMENT);
    }

    /**
     * Applies the supplied parts of the update; parts left null are not touched.
     */
    public String update(TaskUpdate update) {
        ModuleId module = resolveModule(update.getModule());
        String task = identifierPolicy.apply(update.getName(), IdentifierKind.TASK);

        ResolvedDependencies dependencies = update.getInputs() == null
                ? null
                : dependencyResolver.resolve(update.getInputs(), module);

        BlockStmt primary = null;
        List<MethodDeclaration> segments = List.of();
        if (update.getSegments() != null) {
            String primaryCode = update.getSegments().get(TaskConventions.PRIMARY_SEGMENT);
            if (primaryCode != null) {
                primary = generator.primaryBlock(primaryCode);
            }
            segments = generator.segmentMethods(update.getSegments());
        }

        CompilationUnit unit = store.loadExisting(module);
        ClassOrInterfaceDeclaration declaration = mutator.require(unit, module, task);

        if (dependencies != null) {
            importMerger.merge(unit, dependencies.importBlock(config.getBasePackage()));
        }
        importMerger.merge(unit, update.getImports());

        if (primary != null) {
            mutator.replaceSegment(declaration, TaskConventions.PRIMARY_SEGMENT, primary);
        }
        if (!segments.isEmpty()) {
            mutator.replaceSegments(declaration, TaskConventions.LIFECYCLE_HOOKS, segments);
        }
        if (dependencies != null) {
            requiresAnnotations.replace(declaration, dependencies.getEntries());
        }

        store.write(module, unit);
        String status = "Updated " + task + " in " + module.displayName();
        log.info(status);
        return status;
    }

    public String delete(String task, String module) {
        ModuleId moduleId = resolveModule(module);
        String taskId = identifierPolicy.apply(task, IdentifierKind.TASK);
        store.remove(moduleId, taskId);
        String status = "Deleted " + taskId + " from " + moduleId.displayName();
        log.info(status);
        return status;
    }

    /**
     * Renames a task and every dependency reference to it within the same module.
     * References from other modules are not rewritten.
     */
    public String rename(String oldTask, String newTask, String module) {
        ModuleId moduleId = resolveModule(module);
        String oldId = identifierPolicy.apply(oldTask, IdentifierKind.TASK);
        String newId = identifierPolicy.apply(newTask, IdentifierKind.TASK);

        CompilationUnit unit = store.loadExisting(moduleId);
        ClassOrInterfaceDeclaration declaration = mutator.require(unit, moduleId, oldId);
        if (mutator.locate(unit, newId).isPresent()) {
            throw new DuplicateException("Task " + newId + " already exists in " + moduleId.displayName());
        }

        mutator.rename(unit, declaration, newId);
        int references = requiresAnnotations.renameReferences(unit, moduleId, oldId, newId);
        store.write(moduleId, unit);

        String status = "Renamed " + oldId + " -> " + newId + " in " + moduleId.displayName();
        log.info("{} and updated {} dependency references", status, references);
        return status;
    }

    // ---------- Listing ----------

    public List<String> listTasks(String module) {
        return store.listTasks(resolveModule(module));
    }

    public List<String> listModules() {
        return store.listModules();
    }

    // ---------- Flow scripts ----------

    public FlowScripts flows() {
        return flowScripts;
    }

    /**
     * Maps an optional caller module name to a module identity. Absent means the
     * default module.
     */
    public ModuleId resolveModule(String module) {
        if (module == null) {
            return ModuleId.DEFAULT;
        }
        return ModuleId.of(identifierPolicy.apply(module, IdentifierKind.MODULE));
    }

    public WorkflowConfig getConfig() {
        return config;
    }
}
