// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import espresso.article.RelatedLink;
import espresso.util.Trace;
import espresso.util.condition.ConditionContext;

/**
 * Resolves the related links of articles to the pages they point to.
 */
public final class RelatedArticleResolver {
    private RelatedArticleResolver() {
    }

    /**
     * Resolves a single link: first its route, then the first page of that route with the link's article identifier.
     */
    public static Resolution resolve(final RouteTree tree, final RelatedLink link) {
        final var route = tree.find(link.routePath());
        if (route == null) {
            return new Resolution.Missing(link, Resolution.Reason.UNKNOWN_ROUTE);
        }
        final var page = route.findPage(link.articleId());
        if (page == null) {
            return new Resolution.Missing(link, Resolution.Reason.UNKNOWN_ARTICLE);
        }
        return new Resolution.Found(page);
    }

    /**
     * Fills in the related pages of every article in the tree, index page articles included.
     * <p>
     * A link that does not resolve is reported as an {@link UnresolvedRelatedLinkCondition}, signaled as fatal if
     * {@code strict} is set and as a warning otherwise.
     */
    static void resolveAll(final RouteTree tree, final boolean strict) {
        try (final var trace = new Trace("Resolving related articles")) {
            trace.use();
            RouteWalker.walkAll(tree.root(), route -> {
                for (final var page : route.pages()) {
                    resolveArticle(tree, page.fullPath(), page.article(), strict);
                }
                final var indexPage = route.indexPage();
                if (indexPage != null) {
                    final var indexPath = new Page(route.path(), indexPage.article()).fullPath();
                    resolveArticle(tree, indexPath, indexPage.article(), strict);
                }
            });
        }
    }

    private static void resolveArticle(
        final RouteTree tree,
        final String sourcePath,
        final Article article,
        final boolean strict
    ) {
        if (article.relatedLinks().isEmpty()) {
            return;
        }
        try (final var trace = new Trace(() -> "Resolving related links of " + sourcePath)) {
            trace.use();
            for (final var link : article.relatedLinks()) {
                final var resolution = resolve(tree, link);
                if (resolution instanceof final Resolution.Found found) {
                    article.addRelatedPage(found.page());
                } else {
                    final var condition =
                        new UnresolvedRelatedLinkCondition(sourcePath, (Resolution.Missing) resolution);
                    if (strict) {
                        throw ConditionContext.error(condition);
                    }
                    ConditionContext.signal(condition);
                }
            }
        }
    }
}
