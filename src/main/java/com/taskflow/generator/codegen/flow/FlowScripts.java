package com.taskflow.generator.codegen.flow;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.taskflow.generator.codegen.WorkflowConfig;
import com.taskflow.generator.codegen.exception.ArtifactIOException;
import com.taskflow.generator.codegen.model.ExecutionResult;
import com.taskflow.generator.codegen.model.FlowAction;
import com.taskflow.generator.codegen.model.FlowRequest;
import com.taskflow.generator.codegen.model.FlowScriptResult;
import com.taskflow.generator.codegen.util.FileWriteUtil;

/**
 * Builds flow scripts, optionally writes them next to the project and optionally
 * runs them.
 */
public class FlowScripts {

    private static final Logger log = LoggerFactory.getLogger(FlowScripts.class);

    public static final String PREVIEW_FILE = "RunPreview.java";
    public static final String RUN_FILE = "RunFlow.java";
    public static final String TASK_FILE = "RunTask.java";

    private final WorkflowConfig config;
    private final FlowScriptGenerator generator;
    private final FlowScriptExecutor executor;

    public FlowScripts(WorkflowConfig config, FlowScriptGenerator generator, FlowScriptExecutor executor) {
        this.config = config;
        this.generator = generator;
        this.executor = executor;
    }

    public FlowScriptResult preview(FlowRequest request, boolean execute) {
        return preview(request, Path.of(PREVIEW_FILE), execute);
    }

    /**
     * @param fileOut where to write the script, relative to the base directory; null skips writing
     */
    public FlowScriptResult preview(FlowRequest request, Path fileOut, boolean execute) {
        String script = generator.build(request.toBuilder().action(FlowAction.PREVIEW).build());
        return finish(script, fileOut, execute);
    }

    public FlowScriptResult run(FlowRequest request, boolean execute) {
        return run(request, Path.of(RUN_FILE), execute);
    }

    public FlowScriptResult run(FlowRequest request, Path fileOut, boolean execute) {
        String script = generator.build(request.toBuilder().action(FlowAction.RUN).build());
        return finish(script, fileOut, execute);
    }

    public FlowScriptResult runTask(String task, String method, String module, boolean execute) {
        return runTask(task, method, module, Path.of(TASK_FILE), execute);
    }

    public FlowScriptResult runTask(String task, String method, String module, Path fileOut, boolean execute) {
        return finish(generator.buildTaskCall(task, method, module), fileOut, execute);
    }

    /**
     * Runs an already rendered script.
     */
    public ExecutionResult execute(String script) {
        return executor.execute(script);
    }

    private FlowScriptResult finish(String script, Path fileOut, boolean execute) {
        FlowScriptResult.FlowScriptResultBuilder result = FlowScriptResult.builder().script(script);
        if (fileOut != null) {
            Path target = config.getBaseDir().resolve(fileOut);
            try {
                FileWriteUtil.safeWriteString(target, script);
            } catch (IOException e) {
                throw new ArtifactIOException("write", target, e);
            }
            log.info("Wrote flow script to {}", target);
            result.writtenTo(target);
        }
        if (execute) {
            result.execution(executor.execute(script));
        }
        return result.build();
    }
}
