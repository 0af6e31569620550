package com.taskflow.generator.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.taskflow.generator.cli.exception.OptionsValidationException;
import com.taskflow.generator.cli.model.EngineOptions;
import com.taskflow.generator.cli.model.FlowOptions;
import com.taskflow.generator.cli.model.TaskSourceOptions;
import com.taskflow.generator.cli.model.ValidatedTaskSource;
import com.taskflow.generator.cli.output.WorkflowResultsPrinter;
import com.taskflow.generator.cli.validation.WorkflowOptionsValidator;
import com.taskflow.generator.codegen.WorkflowService;
import com.taskflow.generator.codegen.exception.ValidationException;
import com.taskflow.generator.codegen.exception.WorkflowException;
import com.taskflow.generator.codegen.flow.FlowScripts;
import com.taskflow.generator.codegen.model.ExecutionResult;
import com.taskflow.generator.codegen.model.FlowRequest;
import com.taskflow.generator.codegen.model.FlowScriptResult;
import com.taskflow.generator.codegen.model.TaskDefinition;
import com.taskflow.generator.codegen.model.TaskUpdate;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * CLI for creating, editing and running task definitions. Shared options go
 * before the subcommand: {@code taskflow --base-dir work create Clean --code "result = 1;"}.
 */
@Command(
        name = "taskflow",
        mixinStandardHelpOptions = true,
        version = "taskflow-generator 1.0.0",
        description = "Creates and edits task definitions and runs them through flow scripts."
)
public class WorkflowCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCommand.class);

    static final int OK = 0;
    static final int FAILED = 1;

    @Mixin
    private EngineOptions engine;

    @Spec
    private CommandSpec spec;

    private final WorkflowOptionsValidator validator = new WorkflowOptionsValidator();
    private final WorkflowResultsPrinter printer;

    public WorkflowCommand() {
        this(new WorkflowResultsPrinter());
    }

    public WorkflowCommand(WorkflowResultsPrinter printer) {
        this.printer = printer;
    }

    @Override
    public Integer call() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    @Command(name = "create", description = "Adds a new task to a module.")
    int create(@Parameters(paramLabel = "TASK") String task,
               @Option(names = { "--module", "-m" }) String module,
               @Mixin TaskSourceOptions source) {
        return withService(service -> {
            ValidatedTaskSource v = validator.validate(source, true);
            return service.create(definition(task, module, v));
        });
    }

    @Command(name = "upsert", description = "Updates a task, or creates it when missing.")
    int upsert(@Parameters(paramLabel = "TASK") String task,
               @Option(names = { "--module", "-m" }) String module,
               @Mixin TaskSourceOptions source) {
        return withService(service -> {
            ValidatedTaskSource v = validator.validate(source, true);
            return service.upsert(definition(task, module, v));
        });
    }

    @Command(name = "update", description = "Replaces the given parts of an existing task.")
    int update(@Parameters(paramLabel = "TASK") String task,
               @Option(names = { "--module", "-m" }) String module,
               @Mixin TaskSourceOptions source) {
        return withService(service -> {
            ValidatedTaskSource v = validator.validate(source, false);
            return service.update(TaskUpdate.builder()
                    .name(task)
                    .module(module)
                    .segments(v.getSegments().isEmpty() ? null : v.getSegments())
                    .inputs(v.getInputs())
                    .imports(v.getImports())
                    .build());
        });
    }

    @Command(name = "read", description = "Prints a segment body, or the whole task with --full.")
    int read(@Parameters(paramLabel = "TASK") String task,
             @Option(names = { "--module", "-m" }) String module,
             @Option(names = { "--segment", "-s" }, defaultValue = "run") String segment,
             @Option(names = { "--full" }) boolean full) {
        return withService(service -> {
            printer.printSource(service.read(task, module, full ? null : segment));
            return null;
        });
    }

    @Command(name = "delete", description = "Removes a task from its module.")
    int delete(@Parameters(paramLabel = "TASK") String task,
               @Option(names = { "--module", "-m" }) String module) {
        return withService(service -> service.delete(task, module));
    }

    @Command(name = "rename", description = "Renames a task and the references to it in the same module.")
    int rename(@Parameters(index = "0", paramLabel = "OLD") String oldTask,
               @Parameters(index = "1", paramLabel = "NEW") String newTask,
               @Option(names = { "--module", "-m" }) String module) {
        return withService(service -> service.rename(oldTask, newTask, module));
    }

    @Command(name = "list", description = "Lists the tasks of a module, or the modules with --modules.")
    int list(@Option(names = { "--module", "-m" }) String module,
             @Option(names = { "--modules" }) boolean modules) {
        return withService(service -> {
            printer.printList(modules ? service.listModules() : service.listTasks(module));
            return null;
        });
    }

    @Command(name = "preview", description = "Renders a flow script that previews the workflow.")
    int preview(@Mixin FlowOptions flow) {
        return withFlow(service -> service.flows().preview(request(flow),
                fileOut(flow, FlowScripts.PREVIEW_FILE), flow.isExecute()));
    }

    @Command(name = "run", description = "Renders a flow script that runs the workflow.")
    int run(@Mixin FlowOptions flow) {
        return withFlow(service -> service.flows().run(request(flow),
                fileOut(flow, FlowScripts.RUN_FILE), flow.isExecute()));
    }

    @Command(name = "run-task", description = "Renders a script that calls one method of a task directly.")
    int runTask(@Option(names = { "--task", "-t" }, required = true) String task,
                @Option(names = { "--method" }, defaultValue = "run") String method,
                @Option(names = { "--module", "-m" }) String module,
                @Option(names = { "--out", "-o" }) Path out,
                @Option(names = { "--no-write" }) boolean noWrite,
                @Option(names = { "--execute", "-x" }) boolean execute) {
        Path fileOut = noWrite ? null : (out == null ? Path.of(FlowScripts.TASK_FILE) : out);
        return withFlow(service -> service.flows().runTask(task, method, module, fileOut, execute));
    }

    private int withService(Function<WorkflowService, String> action) {
        try {
            WorkflowService service = new WorkflowService(validator.validate(engine));
            String status = action.apply(service);
            if (status != null) {
                printer.printStatus(status);
            }
            return OK;
        } catch (OptionsValidationException e) {
            log.error("Invalid options:");
            printer.printErrors(e.getErrors());
            return FAILED;
        } catch (ValidationException e) {
            log.error("Validation failed:");
            printer.printErrors(e.getErrors());
            return FAILED;
        } catch (WorkflowException e) {
            log.error(e.getMessage());
            return FAILED;
        }
    }

    private int withFlow(Function<WorkflowService, FlowScriptResult> action) {
        boolean[] succeeded = { true };
        int code = withService(service -> {
            FlowScriptResult result = action.apply(service);
            printer.printFlow(result);
            succeeded[0] = result.getExecution().map(ExecutionResult::isSuccess).orElse(true);
            return null;
        });
        return code == OK && !succeeded[0] ? FAILED : code;
    }

    private FlowRequest request(FlowOptions flow) {
        return FlowRequest.builder()
                .task(flow.getTask())
                .module(flow.getModule())
                .params(validator.parseParams(flow.getParams()))
                .resetTasks(flow.getResetTasks())
                .resetTarget(flow.isResetTarget())
                .loadOutput(flow.isLoadOutput())
                .build();
    }

    private static Path fileOut(FlowOptions flow, String defaultFile) {
        if (flow.isNoWrite()) {
            return null;
        }
        return flow.getOut() == null ? Path.of(defaultFile) : flow.getOut();
    }

    private static TaskDefinition definition(String task, String module, ValidatedTaskSource v) {
        return TaskDefinition.builder()
                .name(task)
                .module(module)
                .segments(v.getSegments())
                .inputs(v.getInputs())
                .imports(v.getImports())
                .build();
    }
}
