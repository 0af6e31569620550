package com.taskflow.generator.codegen.dependency;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.taskflow.generator.codegen.artifact.SourceParser;
import com.taskflow.generator.codegen.model.AnnotationEntry;
import com.taskflow.generator.codegen.model.ModuleId;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for rendering and rewriting the dependency annotation.
 */
class RequiresAnnotationsTest {

    private SourceParser parser;
    private RequiresAnnotations annotations;

    @BeforeEach
    void setUp() {
        parser = new SourceParser();
        annotations = new RequiresAnnotations(parser);
    }

    @Test
    void testRenderSameAndCrossModuleEntries() {
        String rendered = annotations.render(List.of(
                entry("Cleaned", ModuleId.of("features"), "Cleaned", false),
                entry("sources.RawCsv", ModuleId.of("sources"), "RawCsv", true)));

        assertThat(rendered).isEqualTo("@Requires({ @Input(key = \"Cleaned\", task = Cleaned.class), "
                + "@Input(key = \"sources.RawCsv\", task = sources.RawCsv.class) })");
        assertThat(annotations.render(List.of())).isEmpty();
    }

    @Test
    void testReplaceSwapsOrRemovesAnnotation() {
        ClassOrInterfaceDeclaration task = parser.parseMemberClass("""
                @Deprecated
                @Requires({ @Input(key = "Old", task = Old.class) })
                public static class Report extends PersistedTask {
                }
                """, "Report");

        annotations.replace(task, List.of(entry("Fresh", ModuleId.DEFAULT, "Fresh", false)));
        assertThat(task.getAnnotations()).hasSize(2);
        assertThat(task.getAnnotation(0).toString()).contains("task = Fresh.class");

        annotations.replace(task, List.of());
        assertThat(task.getAnnotations()).extracting(a -> a.getNameAsString()).containsExactly("Deprecated");
    }

    @Test
    void testRenameRewritesSameModuleReferencesOnly() {
        CompilationUnit unit = parser.parseArtifact(null, """
                package tasks;

                public final class features {

                    @Requires({ @Input(key = "Cleaned", task = Cleaned.class), @Input(key = "features.Cleaned", task = Cleaned.class) })
                    public static class Report {
                    }

                    @Requires({ @Input(key = "sources.Cleaned", task = sources.Cleaned.class) })
                    public static class Summary {
                    }
                }
                """);

        int rewritten = annotations.renameReferences(unit, ModuleId.of("features"), "Cleaned", "Scrubbed");

        assertThat(rewritten).isEqualTo(4);
        String printed = unit.toString();
        assertThat(printed).contains("key = \"Scrubbed\", task = Scrubbed.class");
        assertThat(printed).contains("key = \"features.Scrubbed\", task = Scrubbed.class");
        assertThat(printed).contains("key = \"sources.Cleaned\", task = sources.Cleaned.class");
    }

    private static AnnotationEntry entry(String key, ModuleId module, String task, boolean cross) {
        return AnnotationEntry.builder().key(key).module(module).task(task).crossModule(cross).build();
    }
}
