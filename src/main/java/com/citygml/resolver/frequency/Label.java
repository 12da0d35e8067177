package com.citygml.resolver.frequency;

import java.util.List;

/**
 * Decoded value of a raw field entry: a single label, or a group of labels for a
 * bracket-encoded multi-valued entry such as {@code [401, 402]}.
 */
public interface Label {

    /**
     * Scalar labels in depth-first order. A group flattens recursively.
     */
    List<String> leaves();

    boolean isGroup();
}
