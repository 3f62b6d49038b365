// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import espresso.util.condition.Condition;

/**
 * A condition type indicating that a page was registered with a route path that has an empty segment, such as a
 * leading or trailing slash.
 */
public final class MalformedRoutePathCondition extends Condition {
    MalformedRoutePathCondition(final String routePath) {
        super("Malformed route path \"" + routePath + "\": empty segment");
        this.routePath = routePath;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nExpected form: segments separated by single slashes, \"\" for the root route";
    }

    public String routePath() {
        return routePath;
    }

    private final String routePath;
}
