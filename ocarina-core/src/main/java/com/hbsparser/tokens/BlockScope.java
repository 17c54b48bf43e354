package com.hbsparser.tokens;

import java.util.Collection;
import java.util.Set;

/**
 * Names bound by enclosing block parameters ({@code as |item index|}), innermost frame first.
 *
 * <p>Scopes are immutable: {@link #push} returns a new scope and leaves the receiver untouched,
 * so a traversal can hand each pending node the exact scope it must be classified under.</p>
 */
public final class BlockScope {
    private static final BlockScope EMPTY = new BlockScope(Set.of(), null, 0);

    private final Set<String> frame;
    private final BlockScope parent;
    private final int depth;

    private BlockScope(Set<String> frame, BlockScope parent, int depth) {
        this.frame = frame;
        this.parent = parent;
        this.depth = depth;
    }

    public static BlockScope empty() {
        return EMPTY;
    }

    /**
     * Scope with a new innermost frame holding {@code names}. A body that declares no
     * parameters introduces no frame, so an empty collection returns this scope unchanged.
     */
    public BlockScope push(Collection<String> names) {
        if (names.isEmpty()) {
            return this;
        }
        return new BlockScope(Set.copyOf(names), this, depth + 1);
    }

    /**
     * Scope without the innermost frame.
     *
     * @throws IllegalStateException on the empty scope
     */
    public BlockScope pop() {
        if (parent == null) {
            throw new IllegalStateException("pop() on empty block scope");
        }
        return parent;
    }

    /**
     * Exact, case-sensitive lookup of {@code head} in every frame, innermost to outermost.
     */
    public boolean isBound(String head) {
        for (BlockScope scope = this; scope != null; scope = scope.parent) {
            if (scope.frame.contains(head)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Number of frames.
     */
    public int depth() {
        return depth;
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder("BlockScope[");
        for (BlockScope scope = this; scope != null && scope.parent != null; scope = scope.parent) {
            if (scope != this) {
                text.append(" <- ");
            }
            text.append(scope.frame);
        }
        return text.append(']').toString();
    }
}
