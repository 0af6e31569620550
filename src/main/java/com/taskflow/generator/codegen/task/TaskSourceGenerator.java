package com.taskflow.generator.codegen.task;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.taskflow.generator.codegen.artifact.SourceParser;
import com.taskflow.generator.codegen.dependency.RequiresAnnotations;
import com.taskflow.generator.codegen.exception.ValidationException;
import com.taskflow.generator.codegen.model.AnnotationEntry;
import com.taskflow.generator.codegen.naming.IdentifierKind;
import com.taskflow.generator.codegen.naming.IdentifierPolicy;

/**
 * Builds task class source from caller segment bodies.
 *
 * <p>The primary segment must assign the result binding and always ends by saving
 * it. Every segment starts with the input-load statement. Bodies are parsed here,
 * so nothing malformed ever reaches an artifact.
 */
public class TaskSourceGenerator {

    private static final Pattern RESULT_ASSIGNMENT =
            Pattern.compile("\\b" + TaskConventions.RESULT_BINDING + "\\s*=(?!=)");
    private static final Pattern SAVE_INVOCATION = Pattern.compile(
            "(?<![\\w.$])save\\s*\\(\\s*" + TaskConventions.RESULT_BINDING + "\\s*\\)");
    private static final String INDENT = "    ";

    private final SourceParser parser;
    private final IdentifierPolicy identifierPolicy;
    private final RequiresAnnotations requiresAnnotations;
    private final InputLoadTransform inputLoad;

    public TaskSourceGenerator(SourceParser parser, IdentifierPolicy identifierPolicy,
                               RequiresAnnotations requiresAnnotations, InputLoadTransform inputLoad) {
        this.parser = parser;
        this.identifierPolicy = identifierPolicy;
        this.requiresAnnotations = requiresAnnotations;
        this.inputLoad = inputLoad;
    }

    /**
     * Renders and parses a complete task class.
     *
     * @param task     sanitized task identifier
     * @param segments caller segment bodies; must contain {@code run}
     * @param entries  dependency annotation entries, possibly empty
     */
    public ClassOrInterfaceDeclaration generate(String task, Map<String, String> segments,
                                                List<AnnotationEntry> entries) {
        if (segments == null || !segments.containsKey(TaskConventions.PRIMARY_SEGMENT)) {
            throw new ValidationException("Code must include a '" + TaskConventions.PRIMARY_SEGMENT + "' segment");
        }
        String source = render(task, segments, entries);
        return parser.parseMemberClass(source, "Task " + task);
    }

    String render(String task, Map<String, String> segments, List<AnnotationEntry> entries) {
        StringBuilder sb = new StringBuilder();
        String annotation = requiresAnnotations.render(entries);
        if (!annotation.isEmpty()) {
            sb.append(annotation).append("\n");
        }
        sb.append("public static class ").append(task).append(" extends ").append(TaskConventions.TASK_BASE_CLASS).append(" {\n");
        sb.append("\n").append(INDENT).append("@Override\n");
        appendMethod(sb, TaskConventions.PRIMARY_SEGMENT, primaryBody(segments.get(TaskConventions.PRIMARY_SEGMENT)));
        for (Map.Entry<String, String> segment : additionalSegments(segments).entrySet()) {
            sb.append("\n");
            appendMethod(sb, segment.getKey(), inputLoad.prepend(segment.getValue()));
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Parsed body for the primary segment.
     */
    public BlockStmt primaryBlock(String body) {
        return parser.parseBlock(primaryBody(body), "Segment " + TaskConventions.PRIMARY_SEGMENT + "()");
    }

    /**
     * Parsed methods for every segment except the primary one, names sanitized.
     */
    public List<MethodDeclaration> segmentMethods(Map<String, String> segments) {
        List<MethodDeclaration> methods = new ArrayList<>();
        for (Map.Entry<String, String> segment : additionalSegments(segments).entrySet()) {
            StringBuilder sb = new StringBuilder();
            appendMethod(sb, segment.getKey(), inputLoad.prepend(segment.getValue()));
            methods.add(parser.parseMethod(sb.toString(), "Segment " + segment.getKey() + "()"));
        }
        return methods;
    }

    /**
     * Primary body with the load statement in front and the save call at the end.
     * Only an unqualified {@code save(result)} counts as already saving.
     */
    String primaryBody(String body) {
        validateResultBinding(body);
        String withLoad = inputLoad.prepend(body);
        if (SAVE_INVOCATION.matcher(body).find()) {
            return withLoad;
        }
        return withLoad.stripTrailing() + "\n" + TaskConventions.SAVE_CALL;
    }

    private void validateResultBinding(String body) {
        if (body == null || !RESULT_ASSIGNMENT.matcher(body).find()) {
            throw new ValidationException("The " + TaskConventions.PRIMARY_SEGMENT
                    + " segment must assign its output to '" + TaskConventions.RESULT_BINDING
                    + "'. Example: " + TaskConventions.RESULT_BINDING + " = loadRows();");
        }
    }

    private Map<String, String> additionalSegments(Map<String, String> segments) {
        Map<String, String> additional = new LinkedHashMap<>();
        for (Map.Entry<String, String> segment : segments.entrySet()) {
            if (segment.getKey().equals(TaskConventions.PRIMARY_SEGMENT)) {
                continue;
            }
            String name = identifierPolicy.apply(segment.getKey(), IdentifierKind.SEGMENT);
            if (additional.put(name, segment.getValue()) != null) {
                throw new ValidationException("Segment names collide after cleanup: " + name);
            }
        }
        return additional;
    }

    private static void appendMethod(StringBuilder sb, String name, String body) {
        sb.append(INDENT).append("public void ").append(name).append("() {\n");
        body.lines().forEach(line -> sb.append(INDENT).append(INDENT).append(line).append("\n"));
        sb.append(INDENT).append("}\n");
    }
}
