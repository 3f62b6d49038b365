// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.util.condition;

/**
 * The procedure of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Processes the given condition.
     * <p>
     * Returning normally declines the condition. Handling it means transferring control elsewhere, usually through
     * {@link Restart#unwindTo()}.
     */
    void handle(SignaledCondition condition) throws Unwind;

    /**
     * A handler procedure that can be called from any thread.
     * <p>
     * Only thread-safe handlers are inherited by worker threads through
     * {@link ConditionContext#saveInheritableState()}.
     */
    @FunctionalInterface
    interface ThreadSafe extends HandlerProcedure {
    }
}
