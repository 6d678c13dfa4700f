package com.vidnyan.classlint.domain.rule;

import com.vidnyan.classlint.domain.syntax.ModifierList;
import com.vidnyan.classlint.domain.syntax.ModifierToken;
import com.vidnyan.classlint.domain.syntax.SyntaxKind;
import com.vidnyan.classlint.domain.syntax.SyntaxNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Single depth-first walk over a syntax tree that finds class methods and properties
 * whose {@code class} modifier is redundant.
 * <p>
 * The finality of every enclosing class is kept on a stack; only the innermost class counts,
 * a class nested in a final class is judged by its own modifiers. Protocol bodies are not entered.
 * Declarations are checked when the walk leaves them. The walk is iterative, so tree depth is
 * bounded by heap rather than by the call stack.
 * <p>
 * Not thread-safe; use one instance per traversal.
 */
public class ScopeTrackingVisitor {

    private final Deque<Boolean> finalClassScope = new ArrayDeque<>();
    private final List<FlaggedDeclaration> flagged = new ArrayList<>();

    /**
     * Walk the tree and return flagged declarations in the order the walk left them.
     */
    public List<FlaggedDeclaration> walk(SyntaxNode root) {
        flagged.clear();
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(root, false));

        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            SyntaxNode node = frame.node();
            if (frame.leaving()) {
                visitPost(node);
                continue;
            }
            if (isSkippable(node)) {
                continue;
            }
            visit(node);
            pending.push(new Frame(node, true));
            List<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(new Frame(children.get(i), false));
            }
        }
        return List.copyOf(flagged);
    }

    /**
     * Number of enclosing classes at the current point of the walk; zero outside a walk.
     */
    public int scopeDepth() {
        return finalClassScope.size();
    }

    private boolean isSkippable(SyntaxNode node) {
        return node.is(SyntaxKind.PROTOCOL);
    }

    protected void visit(SyntaxNode node) {
        if (node.is(SyntaxKind.CLASS)) {
            finalClassScope.push(node.modifierList().isFinal());
        }
    }

    protected void visitPost(SyntaxNode node) {
        switch (node.kind()) {
            case CLASS -> finalClassScope.pop();
            case FUNCTION -> check(node.modifierList(), FlaggedDeclaration.DeclarationType.METHOD);
            case VARIABLE -> check(node.modifierList(), FlaggedDeclaration.DeclarationType.PROPERTY);
            default -> {
                // not a declaration this rule looks at
            }
        }
    }

    private void check(ModifierList modifiers, FlaggedDeclaration.DeclarationType type) {
        if (modifiers.isFinal()) {
            return;
        }
        Optional<ModifierToken> classKeyword = modifiers.find(ModifierList.CLASS);
        if (classKeyword.isEmpty() || finalClassScope.isEmpty()) {
            return;
        }
        boolean inFinalClass = finalClassScope.peek();
        if (!inFinalClass && !modifiers.isPrivate()) {
            return;
        }
        flagged.add(new FlaggedDeclaration(
                classKeyword.get(),
                type,
                inFinalClass ? FlaggedDeclaration.Reason.IN_FINAL_CLASS : FlaggedDeclaration.Reason.PRIVATE));
    }

    private record Frame(SyntaxNode node, boolean leaving) {
    }
}
