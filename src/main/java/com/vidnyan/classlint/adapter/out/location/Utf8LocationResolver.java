package com.vidnyan.classlint.adapter.out.location;

import com.vidnyan.classlint.application.port.out.LocationResolver;
import com.vidnyan.classlint.domain.model.Location;
import com.vidnyan.classlint.domain.model.SourceFile;
import com.vidnyan.classlint.domain.model.TextRange;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Resolves UTF-8 byte positions of the syntax tree against the UTF-16 contents of a file.
 * A position past the end of the contents, or inside a multi-byte sequence, is unresolvable.
 */
@Component
public class Utf8LocationResolver implements LocationResolver {

    @Override
    public Optional<TextRange> characterRange(SourceFile file, int startPosition, int endPosition) {
        if (startPosition < 0 || endPosition < startPosition) {
            return Optional.empty();
        }
        String contents = file.contents();
        OptionalInt start = characterOffset(contents, startPosition);
        OptionalInt end = characterOffset(contents, endPosition);
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(TextRange.between(start.getAsInt(), end.getAsInt()));
    }

    @Override
    public Optional<Location> location(SourceFile file, int characterOffset) {
        String contents = file.contents();
        if (characterOffset < 0 || characterOffset > contents.length()) {
            return Optional.empty();
        }
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < characterOffset; i++) {
            if (contents.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return Optional.of(new Location(file.displayPath(), line, characterOffset - lineStart + 1, characterOffset));
    }

    static OptionalInt characterOffset(String contents, int bytePosition) {
        int bytes = 0;
        int index = 0;
        while (bytes < bytePosition && index < contents.length()) {
            int codePoint = contents.codePointAt(index);
            bytes += utf8Length(codePoint);
            index += Character.charCount(codePoint);
        }
        return bytes == bytePosition ? OptionalInt.of(index) : OptionalInt.empty();
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }
}
