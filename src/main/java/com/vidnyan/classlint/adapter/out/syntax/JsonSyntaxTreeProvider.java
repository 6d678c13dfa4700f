package com.vidnyan.classlint.adapter.out.syntax;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.classlint.application.port.out.SyntaxTreeProvider;
import com.vidnyan.classlint.application.port.out.SyntaxTreeUnavailableException;
import com.vidnyan.classlint.domain.syntax.ModifierToken;
import com.vidnyan.classlint.domain.syntax.SyntaxKind;
import com.vidnyan.classlint.domain.syntax.SyntaxNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads syntax trees dumped as JSON next to their source file, e.g. {@code Foo.swift.ast.json}.
 * <p>
 * Node kinds are matched leniently ({@code class}, {@code classDecl}, {@code CLASS_DECL});
 * unknown kinds become {@link SyntaxKind#OTHER}. Missing lists, and modifiers without a name or
 * position, are dropped rather than failing the whole file.
 */
@Slf4j
@Component
public class JsonSyntaxTreeProvider implements SyntaxTreeProvider {

    private final ObjectMapper objectMapper;
    private final String treeSuffix;

    public JsonSyntaxTreeProvider(ObjectMapper objectMapper,
                                  @Value("${lint.tree-suffix:.ast.json}") String treeSuffix) {
        this.objectMapper = objectMapper;
        this.treeSuffix = treeSuffix;
    }

    @Override
    public SyntaxNode load(Path sourceFile) {
        Path dump = treePath(sourceFile);
        if (!Files.isRegularFile(dump)) {
            throw new SyntaxTreeUnavailableException("No syntax tree found at " + dump);
        }
        try {
            NodeDto dto = objectMapper.readValue(dump.toFile(), NodeDto.class);
            if (dto == null) {
                throw new SyntaxTreeUnavailableException("Empty syntax tree in " + dump);
            }
            SyntaxNode root = mapToNode(dto);
            log.debug("Loaded syntax tree for {} from {}", sourceFile, dump);
            return root;
        } catch (IOException e) {
            throw new SyntaxTreeUnavailableException("Failed to read syntax tree " + dump + ": " + e.getMessage(), e);
        }
    }

    Path treePath(Path sourceFile) {
        return sourceFile.resolveSibling(sourceFile.getFileName().toString() + treeSuffix);
    }

    private SyntaxNode mapToNode(NodeDto dto) {
        List<ModifierToken> modifiers = dto.modifiers == null ? List.of() : dto.modifiers.stream()
                .filter(Objects::nonNull)
                .filter(m -> m.name != null && m.start != null && m.end != null)
                .map(m -> new ModifierToken(m.name, m.detail, m.start, m.end))
                .toList();
        List<SyntaxNode> children = dto.children == null ? List.of() : dto.children.stream()
                .filter(Objects::nonNull)
                .map(this::mapToNode)
                .toList();
        return new SyntaxNode(mapKind(dto.kind), dto.name, modifiers, children);
    }

    static SyntaxKind mapKind(String kind) {
        if (kind == null) return SyntaxKind.OTHER;
        String normalized = kind.toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");
        if (normalized.endsWith("DECL")) {
            normalized = normalized.substring(0, normalized.length() - "DECL".length());
        }
        return switch (normalized) {
            case "SOURCEFILE" -> SyntaxKind.SOURCE_FILE;
            case "CLASS" -> SyntaxKind.CLASS;
            case "PROTOCOL" -> SyntaxKind.PROTOCOL;
            case "FUNCTION" -> SyntaxKind.FUNCTION;
            case "VARIABLE" -> SyntaxKind.VARIABLE;
            default -> SyntaxKind.OTHER;
        };
    }

    // DTO classes for JSON deserialization
    static class NodeDto {
        public String kind;
        public String name;
        public List<ModifierDto> modifiers;
        public List<NodeDto> children;
    }

    static class ModifierDto {
        public String name;
        public String detail;
        public Integer start;
        public Integer end;
    }
}
