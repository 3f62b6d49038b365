// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import espresso.article.RelatedLink;
import espresso.util.condition.Condition;

/**
 * A condition type indicating that a related link of an article does not point to any registered page.
 * <p>
 * Signaled as a warning unless the build asks for strict related links, in which case it is fatal.
 */
public final class UnresolvedRelatedLinkCondition extends Condition {
    UnresolvedRelatedLinkCondition(final String sourcePath, final Resolution.Missing missing) {
        super("Related link \"" + missing.link() + "\" of " + sourcePath + " does not resolve");
        this.sourcePath = sourcePath;
        this.missing = missing;
    }

    @Override
    public String detailedMessage() {
        final var reason = switch (missing.reason()) {
            case UNKNOWN_ROUTE -> "there is no route \"" + missing.link().routePath() + '"';
            case UNKNOWN_ARTICLE -> "route \"" + missing.link().routePath() + "\" has no article \""
                + missing.link().articleId() + '"';
        };
        return message() + "\nReason: " + reason;
    }

    /**
     * Retrieves the site-relative path of the article holding the link.
     */
    public String sourcePath() {
        return sourcePath;
    }

    public RelatedLink link() {
        return missing.link();
    }

    public Resolution.Reason reason() {
        return missing.reason();
    }

    private final String sourcePath;
    private final Resolution.Missing missing;
}
