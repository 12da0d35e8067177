package com.citygml.resolver.frequency;

import java.util.List;
import java.util.Objects;

public record ScalarLabel(String text) implements Label {

    public ScalarLabel {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public List<String> leaves() {
        return List.of(text);
    }

    @Override
    public boolean isGroup() {
        return false;
    }

    @Override
    public String toString() {
        return text;
    }
}
