package com.taskflow.generator.codegen.task;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.taskflow.generator.codegen.artifact.SourceParser;
import com.taskflow.generator.codegen.dependency.RequiresAnnotations;
import com.taskflow.generator.codegen.exception.ValidationException;
import com.taskflow.generator.codegen.model.AnnotationEntry;
import com.taskflow.generator.codegen.model.ModuleId;
import com.taskflow.generator.codegen.naming.IdentifierPolicy;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for task class generation.
 */
class TaskSourceGeneratorTest {

    private TaskSourceGenerator generator;

    @BeforeEach
    void setUp() {
        SourceParser parser = new SourceParser();
        generator = new TaskSourceGenerator(parser, IdentifierPolicy.sanitizing(),
                new RequiresAnnotations(parser), new InputLoadTransform());
    }

    @Test
    void testGenerateTaskWithSegmentsAndAnnotation() {
        Map<String, String> segments = new LinkedHashMap<>();
        segments.put("run", "result = sourceRows();");
        segments.put("Clean Up", "log(\"cleaning\");");
        AnnotationEntry raw = AnnotationEntry.builder()
                .key("SalesRaw").module(ModuleId.DEFAULT).task("SalesRaw").build();

        ClassOrInterfaceDeclaration task = generator.generate("SalesByRegion", segments, List.of(raw));

        assertThat(task.getNameAsString()).isEqualTo("SalesByRegion");
        assertThat(task.isPublic()).isTrue();
        assertThat(task.isStatic()).isTrue();
        assertThat(task.getParentNode()).isEmpty();
        assertThat(task.getExtendedTypes(0).getNameAsString()).isEqualTo("PersistedTask");
        assertThat(task.getAnnotation(0).toString())
                .isEqualTo("@Requires({ @Input(key = \"SalesRaw\", task = SalesRaw.class) })");
        assertThat(task.getMethods()).extracting(MethodDeclaration::getNameAsString)
                .containsExactly("run", "clean_up");

        MethodDeclaration run = task.getMethodsByName("run").get(0);
        assertThat(run.getAnnotationByName("Override")).isPresent();
        assertThat(run.getBody().orElseThrow().getStatements()).extracting(Object::toString)
                .containsExactly("var inputs = inputLoad();", "result = sourceRows();", "save(result);");
        assertThat(task.getMethodsByName("clean_up").get(0).getBody().orElseThrow().getStatement(0).toString())
                .isEqualTo(InputLoadTransform.STATEMENT);
    }

    @Test
    void testExistingSaveCallIsKept() {
        String body = generator.primaryBody("result = rows();\nsave(result);");

        assertThat(body).isEqualTo("var inputs = inputLoad();\nresult = rows();\nsave(result);");
    }

    @Test
    void testQualifiedSaveCallDoesNotReplaceResultSave() {
        String body = generator.primaryBody("result = rows();\nbackup.save(rows);");

        assertThat(body).isEqualTo("var inputs = inputLoad();\nresult = rows();\nbackup.save(rows);\nsave(result);");
    }

    @Test
    void testSaveOfOtherValueDoesNotReplaceResultSave() {
        String body = generator.primaryBody("result = rows();\nsave(rows);");

        assertThat(body).endsWith("save(rows);\nsave(result);");
    }

    @Test
    void testPrimarySegmentIsRequired() {
        assertThatThrownBy(() -> generator.generate("Report", Map.of("other", "x();"), List.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'run'");
    }

    @Test
    void testPrimarySegmentMustAssignResult() {
        assertThatThrownBy(() -> generator.primaryBlock("if (result == null) { load(); }"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("result");
    }

    @Test
    void testUnparseableBodyIsValidationError() {
        assertThatThrownBy(() -> generator.generate("Report", Map.of("run", "result = ;"), List.of()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void testCollidingSegmentNamesAreRejected() {
        Map<String, String> segments = new LinkedHashMap<>();
        segments.put("run", "result = 1;");
        segments.put("clean up", "a();");
        segments.put("Clean-Up", "b();");

        assertThatThrownBy(() -> generator.segmentMethods(segments))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("clean_up");
    }

    @Test
    void testLifecycleNamesAreRenamed() {
        List<MethodDeclaration> methods = generator.segmentMethods(Map.of("run", "result = 1;", "save", "x();"));

        assertThat(methods).extracting(MethodDeclaration::getNameAsString).containsExactly("save_seg");
    }
}
