package com.taskflow.generator.codegen.dependency;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.taskflow.generator.codegen.artifact.SourceParser;
import com.taskflow.generator.codegen.model.AnnotationEntry;
import com.taskflow.generator.codegen.model.ModuleId;

/**
 * Renders and rewrites the {@code @Requires} dependency annotation:
 *
 * <pre>
 * &#64;Requires({ &#64;Input(key = "sources.RawCsv", task = sources.RawCsv.class) })
 * </pre>
 *
 * <p>Cross-module values go through the other module's class, which shares the
 * base package with every artifact.
 */
public class RequiresAnnotations {

    public static final String REQUIRES = "Requires";
    public static final String INPUT = "Input";
    private static final String KEY = "key";
    private static final String TASK = "task";

    private final SourceParser parser;

    public RequiresAnnotations(SourceParser parser) {
        this.parser = parser;
    }

    /**
     * Annotation source for the entries, or an empty string when there are none.
     */
    public String render(List<AnnotationEntry> entries) {
        if (entries.isEmpty()) {
            return "";
        }
        return entries.stream()
                .map(entry -> "@" + INPUT + "(" + KEY + " = \"" + entry.getKey() + "\", "
                        + TASK + " = " + entry.getValue() + ".class)")
                .collect(Collectors.joining(", ", "@" + REQUIRES + "({ ", " })"));
    }

    /**
     * Removes any existing dependency annotation from the task and, when there are
     * entries, puts a freshly built one first.
     */
    public void replace(ClassOrInterfaceDeclaration task, List<AnnotationEntry> entries) {
        task.getAnnotations().removeIf(RequiresAnnotations::isRequires);
        if (!entries.isEmpty()) {
            task.getAnnotations().add(0, parser.parseAnnotation(render(entries)));
        }
    }

    /**
     * Points every same-module reference to {@code oldTask} at {@code newTask}.
     * Qualified references belong to other modules and are left alone.
     *
     * @return number of annotation members rewritten
     */
    public int renameReferences(CompilationUnit unit, ModuleId module, String oldTask, String newTask) {
        String qualifiedOldKey = module.isDefault() ? null : module.getName() + "." + oldTask;
        int rewritten = 0;
        for (ClassOrInterfaceDeclaration type : unit.findAll(ClassOrInterfaceDeclaration.class)) {
            for (NormalAnnotationExpr input : inputsOf(type)) {
                for (MemberValuePair pair : input.getPairs()) {
                    Expression value = pair.getValue();
                    if (pair.getNameAsString().equals(TASK) && isBareClass(value, oldTask)) {
                        value.asClassExpr().setType(new ClassOrInterfaceType(null, newTask));
                        rewritten++;
                    } else if (pair.getNameAsString().equals(KEY) && value.isStringLiteralExpr()) {
                        StringLiteralExpr key = value.asStringLiteralExpr();
                        if (key.getValue().equals(oldTask)) {
                            key.setString(newTask);
                            rewritten++;
                        } else if (key.getValue().equals(qualifiedOldKey)) {
                            key.setString(module.getName() + "." + newTask);
                            rewritten++;
                        }
                    }
                }
            }
        }
        return rewritten;
    }

    static boolean isRequires(AnnotationExpr annotation) {
        return annotation.getName().getIdentifier().equals(REQUIRES);
    }

    static List<NormalAnnotationExpr> inputsOf(TypeDeclaration<?> type) {
        Optional<AnnotationExpr> requires = type.getAnnotations().stream()
                .filter(RequiresAnnotations::isRequires)
                .findFirst();
        if (requires.isEmpty() || !requires.get().isSingleMemberAnnotationExpr()) {
            return List.of();
        }
        Expression member = requires.get().asSingleMemberAnnotationExpr().getMemberValue();
        List<Expression> values = member instanceof ArrayInitializerExpr
                ? ((ArrayInitializerExpr) member).getValues()
                : List.of(member);
        return values.stream()
                .filter(Expression::isNormalAnnotationExpr)
                .map(Expression::asNormalAnnotationExpr)
                .filter(annotation -> annotation.getName().getIdentifier().equals(INPUT))
                .collect(Collectors.toList());
    }

    private static boolean isBareClass(Expression value, String task) {
        if (!value.isClassExpr()) {
            return false;
        }
        ClassExpr classExpr = value.asClassExpr();
        if (!classExpr.getType().isClassOrInterfaceType()) {
            return false;
        }
        ClassOrInterfaceType type = classExpr.getType().asClassOrInterfaceType();
        return type.getScope().isEmpty() && type.getNameAsString().equals(task);
    }
}
