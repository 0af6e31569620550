package com.taskflow.generator.codegen.artifact;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.NodeList;

/**
 * Merges a block of import lines into a parsed artifact.
 *
 * <p>Lines are compared by their printed text, so {@code import a.B;} and
 * {@code import a.*;} are different imports. New imports go directly after the
 * last existing one, in the order given.
 */
public class ImportMerger {

    private static final Logger log = LoggerFactory.getLogger(ImportMerger.class);

    private final SourceParser parser;

    public ImportMerger(SourceParser parser) {
        this.parser = parser;
    }

    /**
     * @return number of imports added
     */
    public int merge(CompilationUnit unit, String importBlock) {
        List<String> lines = splitImportLines(importBlock);
        if (lines.isEmpty()) {
            return 0;
        }

        // Parse everything first so a bad line leaves the tree untouched
        List<ImportDeclaration> candidates = new ArrayList<>();
        for (String line : lines) {
            candidates.add(parser.parseImport(line));
        }

        NodeList<ImportDeclaration> imports = unit.getImports();
        Set<String> existing = imports.stream()
                .map(ImportMerger::canonical)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        int position = imports.size();
        int added = 0;
        for (ImportDeclaration candidate : candidates) {
            String text = canonical(candidate);
            if (existing.add(text)) {
                imports.add(position++, candidate);
                added++;
                log.info("Added import: {}", text);
            } else {
                log.debug("Import already exists: {}", text);
            }
        }
        return added;
    }

    /**
     * Splits an import block into its statements, skipping blank and comment lines.
     */
    public static List<String> splitImportLines(String importBlock) {
        if (importBlock == null || importBlock.isBlank()) {
            return List.of();
        }
        return importBlock.strip().lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !line.startsWith("//"))
                .collect(Collectors.toList());
    }

    public static String canonical(ImportDeclaration declaration) {
        return declaration.toString().strip();
    }
}
