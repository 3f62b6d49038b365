// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes something that happened during a build and may be of interest to code further up the call
 * stack. Handlers run <em>before</em> the stack is unwound, so a handler can still reach restart points that were
 * established after the handler itself.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the short user-readable message of this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable message of this condition. Subclasses append whatever details they carry.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
