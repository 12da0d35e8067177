package com.citygml.resolver.frequency;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public record GroupLabel(List<Label> members) implements Label {

    public GroupLabel {
        members = List.copyOf(members);
    }

    @Override
    public List<String> leaves() {
        List<String> leaves = new ArrayList<>();
        for (Label member : members) {
            leaves.addAll(member.leaves());
        }
        return leaves;
    }

    @Override
    public boolean isGroup() {
        return true;
    }

    @Override
    public String toString() {
        return members.stream().map(Label::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
