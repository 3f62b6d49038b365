// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.article;

import espresso.util.condition.Condition;

/**
 * A condition type indicating that a related link could not be split into a route path and an article identifier.
 */
public final class MalformedRelatedLinkCondition extends Condition {
    MalformedRelatedLinkCondition(final String link) {
        super("Malformed related link: \"" + link + '"');
        this.link = link;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nExpected form: <route-path>/<article-id>";
    }

    /**
     * Retrieves the offending link text.
     */
    public String link() {
        return link;
    }

    private final String link;
}
