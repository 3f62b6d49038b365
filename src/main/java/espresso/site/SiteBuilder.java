// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.concurrent.locks.ReentrantLock;
import espresso.article.ArticleParser;
import espresso.article.ParsedArticle;
import espresso.config.BuildOptions;
import espresso.config.Settings;
import espresso.util.Trace;

/**
 * Builds the model of a site: content is registered into a route tree, then {@link #finish()} derives the list pages,
 * index pages, navigation, footer and related articles.
 * <p>
 * The builder owns its route tree. The methods that register content are safe to call from several threads at once,
 * as each mutation of the tree happens under a lock private to the builder; parsing and path computation happen
 * outside of it. {@link #finish()} must only be called once every registration has returned.
 */
public final class SiteBuilder {
    /**
     * Initializes a new builder of an empty site, using the given parser for {@link #build(String, byte[])} and
     * {@link #prepare(String, byte[])}.
     */
    public SiteBuilder(final Settings settings, final BuildOptions options, final ArticleParser parser) {
        this.settings = settings;
        this.options = options;
        this.parser = parser;
    }

    /**
     * Parses the content file at {@code rawPath} and registers the result.
     * <p>
     * Any condition the parser signals, and {@link MalformedPathCondition} for a path outside the content root, may be
     * signaled. Nothing is registered in that case.
     *
     * @return The page of the parsed article; for an index file, the page wrapped by the registered index page.
     */
    public Page build(final String rawPath, final byte[] source) {
        final var entry = prepare(rawPath, source);
        register(entry);
        return entry.page();
    }

    /**
     * Computes the route and identifier of an already parsed article and registers it.
     * <p>
     * An article whose identifier is {@code index} becomes the index page of its route; that route never gets a list
     * page. Signals a fatal {@link MalformedPathCondition} if {@code rawPath} is not within the content root.
     *
     * @return The page of the article; for an index file, the page wrapped by the registered index page.
     */
    public Page ingest(final String rawPath, final ParsedArticle parsed) {
        final var entry = prepare(rawPath, parsed);
        register(entry);
        return entry.page();
    }

    /**
     * Parses the content file at {@code rawPath} into an entry, without registering it.
     */
    public Entry prepare(final String rawPath, final byte[] source) {
        try (final var trace = new Trace(() -> "Ingesting content from " + rawPath)) {
            trace.use();
            return prepare(rawPath, parser.parse(source));
        }
    }

    /**
     * Computes the entry of an already parsed article, without registering it. Depends on nothing but the arguments
     * and the build options.
     */
    public Entry prepare(final String rawPath, final ParsedArticle parsed) {
        final var contentPath = ContentPath.of(rawPath, options);
        final var page = new Page(contentPath.routePath(), new Article(contentPath.articleId(), parsed));
        return new Entry(page, contentPath.isIndex());
    }

    /**
     * Registers a prepared entry, as an index page or an ordinary page.
     */
    public void register(final Entry entry) {
        if (entry.isIndex()) {
            registerIndex(new IndexPage(entry.page().routePath(), entry.page().article()));
        } else {
            register(entry.page());
        }
    }

    /**
     * Appends the page to the route of its path, creating the missing routes.
     * <p>
     * Signals a fatal {@link MalformedRoutePathCondition} if the route path has an empty segment.
     */
    public void register(final Page page) {
        lock.lock();
        try {
            checkNotFinished();
            tree.insert(page);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the index page of the route of its path, creating the missing routes.
     * <p>
     * Signals a fatal {@link MalformedRoutePathCondition} if the route path has an empty segment, or a fatal
     * {@link DuplicateIndexPageCondition} if the route already has one.
     */
    public void registerIndex(final IndexPage indexPage) {
        lock.lock();
        try {
            checkNotFinished();
            tree.insertIndex(indexPage);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Derives the secondary views and returns the finished site. The builder accepts no registrations afterwards.
     * <p>
     * The passes run in order: navigation, list pages, index page aggregation, related articles, footer. Unresolvable
     * related links are signaled as {@link UnresolvedRelatedLinkCondition}, fatal only with strict related links.
     */
    public Site finish() {
        lock.lock();
        try {
            checkNotFinished();
            finished = true;
        } finally {
            lock.unlock();
        }
        try (final var trace = new Trace("Deriving site views")) {
            trace.use();
            final var root = tree.root();
            final var nav = NavigationAssembler.assemble(settings, root);
            ListPageAssembler.assemble(root, options.sortListPages());
            IndexPageAggregator.aggregate(root, options.sortListPages());
            RelatedArticleResolver.resolveAll(tree, options.strictRelatedLinks());
            final var footer = FooterAssembler.assemble(settings);
            return new Site(tree, nav, footer);
        }
    }

    private void checkNotFinished() {
        if (finished) {
            throw new IllegalStateException("The site model has already been finished");
        }
    }

    private final Settings settings;
    private final BuildOptions options;
    private final ArticleParser parser;
    private final RouteTree tree = new RouteTree();
    private final ReentrantLock lock = new ReentrantLock();
    // Guarded by lock.
    private boolean finished = false;

    /**
     * A parsed article with its place in the site, ready to be registered.
     *
     * @param page    The page of the article.
     * @param isIndex {@code true} iff the article is the index page of its route.
     */
    public record Entry(Page page, boolean isIndex) {
    }
}
