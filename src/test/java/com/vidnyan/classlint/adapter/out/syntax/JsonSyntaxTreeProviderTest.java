package com.vidnyan.classlint.adapter.out.syntax;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.classlint.application.port.out.SyntaxTreeUnavailableException;
import com.vidnyan.classlint.config.ClassLintConfiguration;
import com.vidnyan.classlint.domain.syntax.SyntaxKind;
import com.vidnyan.classlint.domain.syntax.SyntaxNode;
import com.vidnyan.classlint.support.SwiftSnippetParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonSyntaxTreeProviderTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ClassLintConfiguration().objectMapper();
    private final JsonSyntaxTreeProvider provider = new JsonSyntaxTreeProvider(objectMapper, ".ast.json");

    @Test
    void readsTreeDumpedNextToSource() throws IOException {
        Path source = tempDir.resolve("C.swift");
        SyntaxNode tree = SwiftSnippetParser.parse("final class C { private(set) class var b: Bool { true } }");
        Files.writeString(tempDir.resolve("C.swift.ast.json"), objectMapper.writeValueAsString(tree));

        SyntaxNode loaded = provider.load(source);

        assertEquals(tree, loaded);
        SyntaxNode property = loaded.children().get(0).children().get(0);
        assertEquals("set", property.modifiers().get(0).detail());
    }

    @Test
    void acceptsParserStyleKindNamesAndIgnoresUnknownOnes() throws IOException {
        Path source = tempDir.resolve("K.swift");
        Files.writeString(tempDir.resolve("K.swift.ast.json"), """
                {
                  "kind": "sourceFile",
                  "children": [
                    { "kind": "classDecl", "name": "C", "children": [
                      { "kind": "functionDecl", "name": "f" },
                      { "kind": "subscriptDecl" },
                      { "kind": "variable_decl", "name": "b", "extra": true }
                    ]},
                    { "kind": "protocol-decl", "name": "P" },
                    { "name": "unnamed" }
                  ]
                }
                """);

        SyntaxNode root = provider.load(source);

        assertEquals(SyntaxKind.SOURCE_FILE, root.kind());
        SyntaxNode cls = root.children().get(0);
        assertEquals(SyntaxKind.CLASS, cls.kind());
        assertEquals(SyntaxKind.FUNCTION, cls.children().get(0).kind());
        assertEquals(SyntaxKind.OTHER, cls.children().get(1).kind());
        assertEquals(SyntaxKind.VARIABLE, cls.children().get(2).kind());
        assertEquals(SyntaxKind.PROTOCOL, root.children().get(1).kind());
        assertEquals(SyntaxKind.OTHER, root.children().get(2).kind());
        assertTrue(cls.children().get(0).modifiers().isEmpty());
    }

    @Test
    void dropsModifiersWithoutNameOrPosition() throws IOException {
        Path source = tempDir.resolve("M.swift");
        Files.writeString(tempDir.resolve("M.swift.ast.json"), """
                { "kind": "FUNCTION", "modifiers": [
                    { "name": "class", "start": 0, "end": 5 },
                    { "name": "private" },
                    { "start": 6, "end": 11 },
                    null
                ]}
                """);

        SyntaxNode node = provider.load(source);

        assertEquals(1, node.modifiers().size());
        assertEquals("class", node.modifiers().get(0).name());
    }

    @Test
    void missingDumpIsReported() {
        SyntaxTreeUnavailableException e = assertThrows(SyntaxTreeUnavailableException.class,
                () -> provider.load(tempDir.resolve("Missing.swift")));

        assertTrue(e.getMessage().contains("Missing.swift.ast.json"));
    }

    @Test
    void unreadableDumpIsReported() throws IOException {
        Path source = tempDir.resolve("Broken.swift");
        Files.writeString(tempDir.resolve("Broken.swift.ast.json"), "{ \"kind\": ");

        assertThrows(SyntaxTreeUnavailableException.class, () -> provider.load(source));
    }
}
