// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.article;

import espresso.util.condition.ConditionContext;

/**
 * A reference from one article to another, by route path and article identifier.
 *
 * @param routePath The path of the route the referenced article lives in, {@code ""} for the root route.
 * @param articleId The identifier of the referenced article within that route.
 */
public record RelatedLink(String routePath, String articleId) {
    /**
     * Parses a link of the form {@code <route-path>/<article-id>}, such as {@code blog/coffee/roasting-basics}.
     * <p>
     * The string is split at its last slash. A single leading slash is ignored, and a link without any slash refers
     * to an article of the root route.
     * <p>
     * Signals a fatal {@link MalformedRelatedLinkCondition} if the article identifier is empty.
     */
    public static RelatedLink parse(final String link) {
        final var trimmed = link.strip();
        final var relative = trimmed.startsWith("/") ? trimmed.substring(1) : trimmed;
        final var slashIndex = relative.lastIndexOf('/');
        final var routePath = (slashIndex == -1) ? "" : relative.substring(0, slashIndex);
        final var articleId = relative.substring(slashIndex + 1);
        if (articleId.isEmpty() || routePath.endsWith("/")) {
            throw ConditionContext.error(new MalformedRelatedLinkCondition(link));
        }
        return new RelatedLink(routePath, articleId);
    }

    @Override
    public String toString() {
        return routePath.isEmpty() ? articleId : routePath + '/' + articleId;
    }
}
