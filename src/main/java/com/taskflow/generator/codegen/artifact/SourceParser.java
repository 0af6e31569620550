package com.taskflow.generator.codegen.artifact;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.taskflow.generator.codegen.exception.ArtifactParseException;
import com.taskflow.generator.codegen.exception.ValidationException;

/**
 * Parses artifacts and generated fragments. Problems in an existing artifact are
 * fatal; problems in caller-supplied fragments are validation errors.
 */
public class SourceParser {

    private static final String MEMBER_HOST = "MemberHost";

    private final JavaParser parser;

    public SourceParser() {
        ParserConfiguration config = new ParserConfiguration();
        config.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(config);
    }

    public CompilationUnit parseArtifact(Path artifact, String source) {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful()) {
            throw new ArtifactParseException(artifact, problems(result));
        }
        return result.getResult().orElseThrow();
    }

    public ImportDeclaration parseImport(String line) {
        ParseResult<ImportDeclaration> result = parser.parseImport(line);
        if (!result.isSuccessful()) {
            throw new ValidationException("Invalid import syntax: " + line);
        }
        return result.getResult().orElseThrow();
    }

    /**
     * Parses a statement list, as written inside a method body.
     */
    public BlockStmt parseBlock(String statements, String description) {
        ParseResult<BlockStmt> result = parser.parseBlock("{\n" + statements + "\n}");
        if (!result.isSuccessful()) {
            throw invalid(description, result);
        }
        return result.getResult().orElseThrow();
    }

    public MethodDeclaration parseMethod(String source, String description) {
        ParseResult<BodyDeclaration<?>> result = parser.parseBodyDeclaration(source);
        if (!result.isSuccessful()) {
            throw invalid(description, result);
        }
        BodyDeclaration<?> declaration = result.getResult().orElseThrow();
        if (!declaration.isMethodDeclaration()) {
            throw new ValidationException(description + " is not a method declaration");
        }
        return declaration.asMethodDeclaration();
    }

    /**
     * Parses a member class declaration, such as {@code public static class X {...}}.
     * The source is parsed inside an enclosing class so member-only modifiers are legal.
     */
    public ClassOrInterfaceDeclaration parseMemberClass(String source, String description) {
        ParseResult<CompilationUnit> result = parser.parse("class " + MEMBER_HOST + " {\n" + source + "\n}\n");
        if (!result.isSuccessful()) {
            throw invalid(description, result);
        }
        List<BodyDeclaration<?>> members = result.getResult().orElseThrow().getType(0).getMembers();
        if (members.size() != 1 || !members.get(0).isClassOrInterfaceDeclaration()) {
            throw new ValidationException(description + " must declare exactly one class");
        }
        ClassOrInterfaceDeclaration declaration = members.get(0).asClassOrInterfaceDeclaration();
        declaration.remove();
        return declaration;
    }

    public AnnotationExpr parseAnnotation(String source) {
        ParseResult<AnnotationExpr> result = parser.parseAnnotation(source);
        if (!result.isSuccessful()) {
            throw invalid("Annotation " + source, result);
        }
        return result.getResult().orElseThrow();
    }

    private static ValidationException invalid(String description, ParseResult<?> result) {
        List<String> errors = problems(result).stream()
                .map(problem -> description + ": " + problem)
                .collect(Collectors.toList());
        if (errors.isEmpty()) {
            errors = List.of(description + " could not be parsed");
        }
        return new ValidationException(errors);
    }

    private static List<String> problems(ParseResult<?> result) {
        return result.getProblems().stream()
                .map(Problem::getMessage)
                .collect(Collectors.toList());
    }
}
