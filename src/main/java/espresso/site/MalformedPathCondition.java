// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import espresso.util.condition.Condition;

/**
 * A condition type indicating that the path of a content file could not be reduced to a route path and an article
 * identifier relative to the content root.
 */
public final class MalformedPathCondition extends Condition {
    MalformedPathCondition(final String rawPath, final String contentRoot, final String reason) {
        super("Malformed content path \"" + rawPath + "\": " + reason);
        this.rawPath = rawPath;
        this.contentRoot = contentRoot;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nContent root: " + contentRoot;
    }

    public String rawPath() {
        return rawPath;
    }

    private final String rawPath;
    private final String contentRoot;
}
