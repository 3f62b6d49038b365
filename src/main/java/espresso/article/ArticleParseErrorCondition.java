// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.article;

import espresso.util.condition.Condition;

/**
 * A condition type indicating that an {@link ArticleParser} could not turn a content file into an article.
 */
public final class ArticleParseErrorCondition extends Condition {
    public ArticleParseErrorCondition(final String message) {
        super(message);
    }
}
