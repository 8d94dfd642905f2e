package com.shapecraft.generator.codegen.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Value;

/**
 * Member chain leading from a structure's source object to a value, e.g.
 * {@code [customer, address, city]}.
 */
@Value
public class SourcePath {
    public static final SourcePath EMPTY = new SourcePath(List.of());

    List<String> members;

    public static SourcePath of(List<String> members) {
        return new SourcePath(List.copyOf(members));
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int length() {
        return members.size();
    }

    public String last() {
        return members.get(members.size() - 1);
    }

    public SourcePath parent() {
        return isEmpty() ? this : new SourcePath(members.subList(0, members.size() - 1));
    }

    public boolean startsWith(SourcePath prefix) {
        return members.size() >= prefix.members.size()
                && members.subList(0, prefix.members.size()).equals(prefix.members);
    }

    /**
     * This path with {@code prefix} removed, or empty when it does not start with it.
     */
    public Optional<SourcePath> relativeTo(SourcePath prefix) {
        if (!startsWith(prefix)) {
            return Optional.empty();
        }
        return Optional.of(new SourcePath(List.copyOf(members.subList(prefix.members.size(), members.size()))));
    }

    public SourcePath append(SourcePath other) {
        List<String> joined = new ArrayList<>(members);
        joined.addAll(other.members);
        return new SourcePath(List.copyOf(joined));
    }

    public static SourcePath commonPrefix(List<SourcePath> paths) {
        if (paths.isEmpty()) {
            return EMPTY;
        }
        List<String> prefix = new ArrayList<>(paths.get(0).members);
        for (SourcePath path : paths) {
            int i = 0;
            while (i < prefix.size() && i < path.members.size() && prefix.get(i).equals(path.members.get(i))) {
                i++;
            }
            prefix = new ArrayList<>(prefix.subList(0, i));
        }
        return new SourcePath(List.copyOf(prefix));
    }

    @Override
    public String toString() {
        return String.join(".", members);
    }
}
