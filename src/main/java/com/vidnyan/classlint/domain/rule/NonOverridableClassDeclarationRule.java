package com.vidnyan.classlint.domain.rule;

import com.vidnyan.classlint.application.port.out.LocationResolver;
import com.vidnyan.classlint.application.port.out.SuppressionFilter;
import com.vidnyan.classlint.domain.model.SourceFile;
import com.vidnyan.classlint.domain.syntax.ModifierToken;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Flags {@code class} methods and properties that cannot be overridden anyway, because their
 * class is final or because they are private, and rewrites them to {@code final class} or
 * {@code static}.
 */
@Slf4j
public class NonOverridableClassDeclarationRule implements CorrectableRule {

    public static final RuleDescription DESCRIPTION = new RuleDescription(
            "non_overridable_class_declaration",
            "Class Declaration in Final Class",
            "Class methods and properties in final classes should themselves be final, just as if the "
                    + "declarations are private. In both cases, they cannot be overridden. Using `final class` "
                    + "or `static` makes this explicit.",
            RuleDescription.Kind.STYLE);

    private final NonOverridableClassDeclarationConfiguration configuration;
    private final LocationResolver locationResolver;
    private final CorrectionApplier correctionApplier;

    public NonOverridableClassDeclarationRule(NonOverridableClassDeclarationConfiguration configuration,
                                              LocationResolver locationResolver,
                                              SuppressionFilter suppressionFilter) {
        this.configuration = configuration;
        this.locationResolver = locationResolver;
        this.correctionApplier = new CorrectionApplier(DESCRIPTION, locationResolver, suppressionFilter);
    }

    @Override
    public RuleDescription description() {
        return DESCRIPTION;
    }

    @Override
    public List<Violation> validate(SourceFile file) {
        return new ScopeTrackingVisitor().walk(file.tree()).stream()
                .map(flagged -> toViolation(file, flagged))
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * Edits replacing each redundant {@code class} keyword, one per flagged declaration.
     */
    public List<CorrectionEdit> corrections(SourceFile file) {
        return new ScopeTrackingVisitor().walk(file.tree()).stream()
                .map(FlaggedDeclaration::toEdit)
                .toList();
    }

    @Override
    public CorrectionOutcome correct(SourceFile file) {
        return correctionApplier.apply(file, corrections(file), configuration.finalClassModifier().replacement());
    }

    private Optional<Violation> toViolation(SourceFile file, FlaggedDeclaration flagged) {
        ModifierToken keyword = flagged.keyword();
        return locationResolver.characterRange(file, keyword.start(), keyword.end())
                .filter(range -> file.hasTextAt(range, keyword.name()))
                .flatMap(range -> locationResolver.location(file, range.location()))
                .map(location -> new Violation(
                        DESCRIPTION.identifier(),
                        configuration.severity(),
                        flagged.message(),
                        flagged.position(),
                        location))
                .or(() -> {
                    log.debug("Dropping violation at unresolvable or stale position {} in {}",
                            flagged.position(), file.displayPath());
                    return Optional.empty();
                });
    }
}
