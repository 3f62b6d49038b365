// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import espresso.util.condition.Condition;

/**
 * A condition type indicating that a route path could not be resolved in the route tree.
 */
public final class RouteNotFoundCondition extends Condition {
    RouteNotFoundCondition(final String path, final String missingSegment) {
        super("No route found for path \"" + path + '"');
        this.path = path;
        this.missingSegment = missingSegment;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nFirst missing segment: \"" + missingSegment + '"';
    }

    public String path() {
        return path;
    }

    private final String path;
    private final String missingSegment;
}
