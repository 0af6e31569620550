package com.taskflow.generator.codegen.dependency;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.taskflow.generator.codegen.artifact.ArtifactStore;
import com.taskflow.generator.codegen.exception.NotFoundException;
import com.taskflow.generator.codegen.exception.ValidationException;
import com.taskflow.generator.codegen.model.AnnotationEntry;
import com.taskflow.generator.codegen.model.InputReference;
import com.taskflow.generator.codegen.model.ModuleId;
import com.taskflow.generator.codegen.model.ResolvedDependencies;
import com.taskflow.generator.codegen.naming.IdentifierKind;
import com.taskflow.generator.codegen.naming.IdentifierPolicy;

/**
 * Checks a task's input references against the existing artifacts and turns them
 * into dependency annotation entries plus the imports other modules need.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final ArtifactStore store;
    private final IdentifierPolicy identifierPolicy;

    public DependencyResolver(ArtifactStore store, IdentifierPolicy identifierPolicy) {
        this.store = store;
        this.identifierPolicy = identifierPolicy;
    }

    public ResolvedDependencies resolve(List<InputReference> inputs, ModuleId currentModule) {
        if (inputs == null || inputs.isEmpty()) {
            return ResolvedDependencies.none();
        }
        validateShape(inputs);

        Map<String, AnnotationEntry> entries = new LinkedHashMap<>();
        Set<ModuleId> crossModule = new LinkedHashSet<>();
        Map<ModuleId, List<String>> tasksByModule = new HashMap<>();

        for (InputReference input : inputs) {
            Optional<ModuleId> explicitModule = input.getModule()
                    .map(name -> ModuleId.of(identifierPolicy.apply(name, IdentifierKind.MODULE)));
            ModuleId module = explicitModule.orElse(currentModule);
            String task = identifierPolicy.apply(input.getTask(), IdentifierKind.TASK);

            if (explicitModule.isPresent() && !module.equals(currentModule) && !store.exists(module)) {
                throw new NotFoundException("Input module '" + module.getName()
                        + "' does not exist. Available modules: " + store.listModules());
            }
            List<String> available = tasksByModule.computeIfAbsent(module, store::listTasks);
            if (!available.contains(task)) {
                throw new NotFoundException("Input task '" + task + "' does not exist in "
                        + module.displayName() + ". Available tasks: " + available);
            }

            boolean cross = !module.equals(currentModule);
            String key = explicitModule.isPresent() ? module.getName() + "." + task : task;
            AnnotationEntry entry = AnnotationEntry.builder()
                    .key(key)
                    .module(module)
                    .task(task)
                    .crossModule(cross)
                    .build();
            if (entries.putIfAbsent(key, entry) != null) {
                log.debug("Ignoring repeated input {}", key);
            }
            if (cross) {
                crossModule.add(module);
            }
        }

        return new ResolvedDependencies(List.copyOf(entries.values()), List.copyOf(crossModule));
    }

    private static void validateShape(List<InputReference> inputs) {
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            InputReference input = inputs.get(i);
            if (input == null) {
                errors.add("Input #" + (i + 1) + " is missing");
            } else if (input.getTask() == null || input.getTask().isBlank()) {
                errors.add("Input #" + (i + 1) + " has no task name");
            } else if (input.getModule().map(String::isBlank).orElse(false)) {
                errors.add("Input #" + (i + 1) + " has a blank module name");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
}
