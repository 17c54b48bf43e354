package com.hbsparser.ast;

import java.util.List;

/**
 * Statement kind contributed by a syntax extension.
 *
 * <p>Consumers that do not recognise a particular extension treat it as opaque
 * but still descend into {@link #children()}.</p>
 */
public non-sealed interface ExtensionNode extends Statement {

    /**
     * Nested nodes in document order; empty for leaf extensions.
     */
    List<Node> children();
}
