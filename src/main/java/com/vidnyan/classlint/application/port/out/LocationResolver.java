package com.vidnyan.classlint.application.port.out;

import com.vidnyan.classlint.domain.model.Location;
import com.vidnyan.classlint.domain.model.SourceFile;
import com.vidnyan.classlint.domain.model.TextRange;

import java.util.Optional;

/**
 * Port for translating syntax tree positions into file locations.
 * Tree positions are UTF-8 byte offsets; file ranges and locations use UTF-16 code units.
 * Every method answers empty when the input cannot be mapped onto the file contents.
 */
public interface LocationResolver {

    /**
     * Map a half-open byte range of the tree onto a character range of the contents.
     */
    Optional<TextRange> characterRange(SourceFile file, int startPosition, int endPosition);

    /**
     * Resolve a character offset into line and column.
     */
    Optional<Location> location(SourceFile file, int characterOffset);

    /**
     * Resolve a tree position into line and column.
     */
    default Optional<Location> locationOfPosition(SourceFile file, int position) {
        return characterRange(file, position, position)
                .flatMap(range -> location(file, range.location()));
    }
}
