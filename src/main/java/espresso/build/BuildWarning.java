// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.build;

import java.util.List;
import espresso.util.condition.Condition;

/**
 * A non-fatal condition signaled during a build.
 *
 * @param condition The condition.
 * @param traces    The trace messages active when it was signaled, newest first.
 */
public record BuildWarning(Condition condition, List<String> traces) {
    public BuildWarning {
        traces = List.copyOf(traces);
    }

    /**
     * Renders the warning for humans: the condition type, its detailed message and the operation trace.
     */
    public String describe() {
        final var builder = new StringBuilder();
        builder.append("A condition of type ").append(condition.getClass().getName()).append(" has been signaled.\n");
        builder.append("\nDetailed message:\n").append(condition.detailedMessage().stripTrailing()).append('\n');
        builder.append("\nOperation trace:\n");
        for (final var trace : traces) {
            builder.append(" - ").append(trace).append('\n');
        }
        return builder.toString();
    }
}
