// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.util.condition;

/**
 * Throwable used internally to transfer control to a {@link Restart}.
 * <p>
 * Exposed only so that methods can declare it. Catching or throwing it manually is reserved for code that carries
 * an unwind across a thread boundary.
 * <p>
 * Not an {@link Exception} nor an {@link Error}: it is neither a failure nor something generic catch blocks should
 * ever see.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    // Unwinds are never serialized.
    private final transient Restart target;
}
