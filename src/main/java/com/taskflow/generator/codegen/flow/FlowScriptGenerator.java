package com.taskflow.generator.codegen.flow;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.lang.model.SourceVersion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.taskflow.generator.codegen.WorkflowConfig;
import com.taskflow.generator.codegen.artifact.ArtifactStore;
import com.taskflow.generator.codegen.exception.NotFoundException;
import com.taskflow.generator.codegen.exception.ValidationException;
import com.taskflow.generator.codegen.exception.WorkflowException;
import com.taskflow.generator.codegen.model.FlowAction;
import com.taskflow.generator.codegen.model.FlowRequest;
import com.taskflow.generator.codegen.model.ModuleId;
import com.taskflow.generator.codegen.naming.IdentifierKind;
import com.taskflow.generator.codegen.naming.IdentifierPolicy;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the small launcher programs that drive a task through the workflow
 * runtime, from FreeMarker templates on the class path.
 */
public class FlowScriptGenerator {

    private static final Logger log = LoggerFactory.getLogger(FlowScriptGenerator.class);

    static final String FLOW_TEMPLATE = "flow-script.ftl";
    static final String TASK_TEMPLATE = "task-script.ftl";

    private static final List<String> RUNTIME_IMPORTS = List.of("taskflow.*", "java.util.*");

    private final WorkflowConfig config;
    private final ArtifactStore store;
    private final IdentifierPolicy identifierPolicy;
    private final JavaLiteralRenderer literals;
    private final Configuration freemarkerConfig;

    public FlowScriptGenerator(WorkflowConfig config, ArtifactStore store, IdentifierPolicy identifierPolicy) {
        this.config = config;
        this.store = store;
        this.identifierPolicy = identifierPolicy;
        this.literals = new JavaLiteralRenderer();
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Script that builds a workflow for the target task, resets the requested
     * tasks in order, then previews or runs it.
     *
     * @throws NotFoundException   if the module or target task does not exist
     * @throws ValidationException if a parameter has no literal form
     */
    public String build(FlowRequest request) {
        ModuleId module = resolveModule(request.getModule());
        String task = identifierPolicy.apply(request.getTask(), IdentifierKind.TASK);
        List<String> known = requireTask(module, task);
        String params = literals.renderMap(request.getParams());

        List<String> resets = new ArrayList<>();
        for (String raw : request.getResetTasks()) {
            String reset = identifierPolicy.apply(raw, IdentifierKind.TASK);
            if (!known.contains(reset)) {
                log.warn("Reset task {} not found in {}; keeping it in the script", reset, module.displayName());
            }
            resets.add(store.getLayout().taskSymbol(module, reset));
        }

        Map<String, Object> model = baseModel(request.getAction() == FlowAction.PREVIEW ? "RunPreview" : "RunFlow",
                module);
        model.put("params", params);
        model.put("task", store.getLayout().taskSymbol(module, task));
        model.put("resets", resets);
        model.put("resetTarget", request.isResetTarget());
        model.put("method", request.getAction().getMethod());
        model.put("loadOutput", request.isLoadOutput());
        return render(FLOW_TEMPLATE, model);
    }

    /**
     * Script that instantiates the task and calls one of its methods directly,
     * bypassing the workflow.
     */
    public String buildTaskCall(String task, String method, String module) {
        if (method == null || !SourceVersion.isName(method) || method.contains(".")) {
            throw new ValidationException("Invalid method name: " + method);
        }
        ModuleId moduleId = resolveModule(module);
        String taskId = identifierPolicy.apply(task, IdentifierKind.TASK);
        requireTask(moduleId, taskId);

        Map<String, Object> model = baseModel("RunTask", moduleId);
        model.put("task", store.getLayout().taskSymbol(moduleId, taskId));
        model.put("method", method);
        return render(TASK_TEMPLATE, model);
    }

    private List<String> requireTask(ModuleId module, String task) {
        if (!store.exists(module)) {
            throw new NotFoundException("File " + store.getLayout().display(module) + " not found");
        }
        List<String> tasks = store.listTasks(module);
        if (!tasks.contains(task)) {
            throw new NotFoundException("Task " + task + " not found in " + module.displayName()
                    + ". Available: " + tasks);
        }
        return tasks;
    }

    // Tasks are referenced as Module.Task through a single-type import of the module class
    private Map<String, Object> baseModel(String className, ModuleId module) {
        List<String> imports = new ArrayList<>(RUNTIME_IMPORTS);
        imports.add(config.getBasePackage() + "." + store.getLayout().holderName(module));

        Map<String, Object> model = new HashMap<>();
        model.put("className", className);
        model.put("imports", imports);
        return model;
    }

    private ModuleId resolveModule(String module) {
        return module == null
                ? ModuleId.DEFAULT
                : ModuleId.of(identifierPolicy.apply(module, IdentifierKind.MODULE));
    }

    private String render(String templateName, Map<String, Object> model) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new WorkflowException("Failed to render " + templateName + ": " + e.getMessage(), e);
        }
    }
}
