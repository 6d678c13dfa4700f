package com.vidnyan.classlint.adapter.out.source;

import com.vidnyan.classlint.application.port.out.SourceFileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * File system based source repository.
 * Discovers source files by extension and reads and writes them as UTF-8.
 */
@Slf4j
@Component
public class FileSystemSourceFileRepository implements SourceFileRepository {

    private final String extension;

    public FileSystemSourceFileRepository(@Value("${lint.source-extension:.swift}") String extension) {
        this.extension = extension;
    }

    @Override
    public List<Path> scan(Path root) throws IOException {
        if (!Files.exists(root)) {
            log.warn("Source path does not exist: {}", root);
            return List.of();
        }
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> files = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(extension))
                    .sorted()
                    .toList();
            log.debug("Scanned {}: {} {} files", root, files.size(), extension);
            return files;
        }
    }

    @Override
    public String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    @Override
    public void write(Path file, String contents) throws IOException {
        Files.writeString(file, contents, StandardCharsets.UTF_8);
    }
}
