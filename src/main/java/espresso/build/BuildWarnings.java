// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.build;

import java.util.ArrayList;
import java.util.List;
import espresso.util.Trace;
import espresso.util.condition.HandlerProcedure;
import espresso.util.condition.SignaledCondition;

/**
 * A handler procedure recording every non-fatal condition as a {@link BuildWarning}, from any thread.
 * <p>
 * Fatal conditions are declined, so that older handlers get to decide about them.
 */
public final class BuildWarnings implements HandlerProcedure.ThreadSafe {
    @Override
    public void handle(final SignaledCondition condition) {
        if (condition.isFatal()) {
            return;
        }
        final var warning = new BuildWarning(condition.condition(), Trace.snapshot());
        synchronized (warnings) {
            warnings.add(warning);
        }
    }

    /**
     * Returns a snapshot of the warnings recorded so far, in the order they were signaled.
     */
    public List<BuildWarning> toList() {
        synchronized (warnings) {
            return List.copyOf(warnings);
        }
    }

    private final ArrayList<BuildWarning> warnings = new ArrayList<>();
}
