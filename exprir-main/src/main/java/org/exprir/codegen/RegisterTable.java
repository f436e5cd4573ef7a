package org.exprir.codegen;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Hands out virtual register names for one generation pass.
 * <p>
 * All prefixes share a single counter starting at 1, so {@code %x1}, {@code %x2},
 * {@code %addtmp3} never collide. Each name is handed out once.
 */
final class RegisterTable {

    private final Set<String> defined = new LinkedHashSet<>();
    private int nextId = 1;

    /**
     * Allocate a fresh register with the given stem, e.g. {@code x} or {@code multmp}.
     *
     * @return the register name including the leading {@code %}
     */
    String allocate(String prefix) {
        String name = "%" + prefix + nextId++;
        if (!defined.add(name)) {
            throw new IllegalStateException("Register " + name + " defined twice");
        }
        return name;
    }
}
