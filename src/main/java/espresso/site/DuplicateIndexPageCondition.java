// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import espresso.util.condition.Condition;

/**
 * A condition type indicating that a route got a second index page, for example from both {@code index.md} and
 * {@code index.html} in the same directory.
 */
public final class DuplicateIndexPageCondition extends Condition {
    DuplicateIndexPageCondition(final String routePath) {
        super("Route \"" + routePath + "\" already has an index page");
    }
}
