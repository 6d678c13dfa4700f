package com.vidnyan.classlint.adapter.out.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemSourceFileRepositoryTest {

    @TempDir
    Path tempDir;

    private final FileSystemSourceFileRepository repository = new FileSystemSourceFileRepository(".swift");

    @Test
    void scanFindsSwiftFilesRecursively() throws IOException {
        Path sources = tempDir.resolve("Sources/App");
        Files.createDirectories(sources);
        Files.writeString(sources.resolve("B.swift"), "class B {}");
        Files.writeString(sources.resolve("A.swift"), "class A {}");
        Files.writeString(sources.resolve("A.swift.ast.json"), "{}");
        Files.writeString(tempDir.resolve("README.md"), "docs");

        List<Path> results = repository.scan(tempDir);

        assertEquals(2, results.size());
        assertTrue(results.get(0).endsWith("A.swift"));
        assertTrue(results.get(1).endsWith("B.swift"));
    }

    @Test
    void scanOfRegularFileReturnsIt() throws IOException {
        Path file = tempDir.resolve("C.swift");
        Files.writeString(file, "class C {}");

        assertEquals(List.of(file), repository.scan(file));
    }

    @Test
    void scanOfMissingPathFindsNothing() throws IOException {
        assertEquals(List.of(), repository.scan(tempDir.resolve("missing")));
    }

    @Test
    void readAndWriteUseUtf8() throws IOException {
        Path file = tempDir.resolve("U.swift");

        repository.write(file, "let café = \"☕\"");

        assertEquals("let café = \"☕\"", repository.read(file));
    }
}
