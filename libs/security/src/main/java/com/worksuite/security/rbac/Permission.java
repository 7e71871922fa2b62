package com.worksuite.security.rbac;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * A (module, action) capability.
 * <p>
 * Natural ordering is by module wire value, then action wire value, which is the order the
 * resolved permission set is exposed in.
 *
 * @param module functional area
 * @param action allowed operation
 */
public record Permission(Module module, Action action) implements Comparable<Permission> {

    private static final Comparator<Permission> ORDER =
            Comparator.comparing((Permission p) -> p.module().value())
                    .thenComparing(p -> p.action().value());

    public Permission {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(action, "action");
    }

    public static Permission of(Module module, Action action) {
        return new Permission(module, action);
    }

    /**
     * Builds a permission from stored column values.
     *
     * @return the permission, or empty if either value is unknown
     */
    public static Optional<Permission> fromValues(String module, String action) {
        Optional<Module> m = Module.fromValue(module);
        Optional<Action> a = Action.fromValue(action);
        if (m.isEmpty() || a.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Permission(m.get(), a.get()));
    }

    /**
     * Parses the {@code "module.action"} notation, e.g. {@code "projects.edit"}.
     *
     * @throws IllegalArgumentException if the text is not a known permission
     */
    public static Permission parse(String text) {
        int dot = text == null ? -1 : text.indexOf('.');
        if (dot <= 0) {
            throw new IllegalArgumentException("Permission must be module.action: " + text);
        }
        return fromValues(text.substring(0, dot), text.substring(dot + 1))
                .orElseThrow(() -> new IllegalArgumentException("Unknown permission: " + text));
    }

    @Override
    public int compareTo(Permission other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return module.value() + "." + action.value();
    }
}
