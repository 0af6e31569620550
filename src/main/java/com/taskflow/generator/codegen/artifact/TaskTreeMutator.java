package com.taskflow.generator.codegen.artifact;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.taskflow.generator.codegen.exception.NotFoundException;
import com.taskflow.generator.codegen.exception.ValidationException;
import com.taskflow.generator.codegen.exception.WorkflowException;
import com.taskflow.generator.codegen.model.ModuleId;

/**
 * Locates, inserts, replaces and removes task classes and their segment methods
 * inside a parsed artifact. Tasks are the member classes of the artifact's single
 * top-level class. Nodes that are not touched keep their structure.
 */
public class TaskTreeMutator {

    /**
     * The top-level class that holds the module's tasks.
     */
    public ClassOrInterfaceDeclaration holder(CompilationUnit unit) {
        return unit.getTypes().stream()
                .filter(TypeDeclaration::isClassOrInterfaceDeclaration)
                .map(TypeDeclaration::asClassOrInterfaceDeclaration)
                .findFirst()
                .orElseThrow(() -> new WorkflowException("Artifact declares no module class"));
    }

    public Optional<ClassOrInterfaceDeclaration> locate(CompilationUnit unit, String task) {
        return tasks(unit)
                .filter(type -> type.getNameAsString().equals(task))
                .findFirst();
    }

    public ClassOrInterfaceDeclaration require(CompilationUnit unit, ModuleId module, String task) {
        return locate(unit, task)
                .orElseThrow(() -> new NotFoundException("Task " + task + " not found in " + module.displayName()));
    }

    public List<String> taskNames(CompilationUnit unit) {
        return tasks(unit)
                .map(ClassOrInterfaceDeclaration::getNameAsString)
                .collect(Collectors.toList());
    }

    /**
     * Appends the class after the module's existing tasks.
     */
    public void insert(CompilationUnit unit, ClassOrInterfaceDeclaration task) {
        ClassOrInterfaceDeclaration holder = holder(unit);
        checkName(holder, task.getNameAsString());
        holder.addMember(task);
    }

    /**
     * Gives a task a new name. Dependency references to it are not touched.
     */
    public void rename(CompilationUnit unit, ClassOrInterfaceDeclaration task, String newName) {
        checkName(holder(unit), newName);
        task.setName(newName);
    }

    public void remove(CompilationUnit unit, ModuleId module, String task) {
        boolean removed = holder(unit).getMembers().removeIf(member -> member.isClassOrInterfaceDeclaration()
                && member.asClassOrInterfaceDeclaration().getNameAsString().equals(task));
        if (!removed) {
            throw new NotFoundException("Task " + task + " not found in " + module.displayName());
        }
    }

    public Optional<MethodDeclaration> segment(ClassOrInterfaceDeclaration task, String name) {
        return task.getMethodsByName(name).stream()
                .filter(method -> method.getParameters().isEmpty())
                .findFirst();
    }

    public void replaceSegment(ClassOrInterfaceDeclaration task, String name, BlockStmt body) {
        MethodDeclaration method = segment(task, name)
                .orElseThrow(() -> new NotFoundException(name + "() not found in " + task.getNameAsString()));
        method.setBody(body);
    }

    /**
     * Drops every method whose name is not in {@code keep} and appends the new
     * segments in the given order.
     */
    public void replaceSegments(ClassOrInterfaceDeclaration task, Set<String> keep,
                                List<MethodDeclaration> segments) {
        List<MethodDeclaration> stale = task.getMethods().stream()
                .filter(method -> !keep.contains(method.getNameAsString()))
                .collect(Collectors.toList());
        stale.forEach(Node::remove);
        segments.forEach(task::addMember);
    }

    /**
     * Statements of one segment, one printed statement per line.
     */
    public String segmentSource(ClassOrInterfaceDeclaration task, String name) {
        MethodDeclaration method = segment(task, name)
                .orElseThrow(() -> new NotFoundException(name + "() method not found in " + task.getNameAsString()));
        return method.getBody()
                .map(body -> body.getStatements().stream()
                        .map(Statement::toString)
                        .collect(Collectors.joining("\n")))
                .orElse("");
    }

    private Stream<ClassOrInterfaceDeclaration> tasks(CompilationUnit unit) {
        return unit.getTypes().stream()
                .filter(TypeDeclaration::isClassOrInterfaceDeclaration)
                .findFirst()
                .map(holder -> holder.getMembers().stream()
                        .filter(BodyDeclaration::isClassOrInterfaceDeclaration)
                        .map(BodyDeclaration::asClassOrInterfaceDeclaration))
                .orElseGet(Stream::empty);
    }

    // A member class may not share its enclosing class's name
    private static void checkName(ClassOrInterfaceDeclaration holder, String task) {
        if (holder.getNameAsString().equals(task)) {
            throw new ValidationException("Task name " + task + " is taken by its module class");
        }
    }
}
