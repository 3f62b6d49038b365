// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import espresso.article.ParsedArticle;
import espresso.article.RelatedLink;

/**
 * An article placed in the site: a parsed content unit together with its identifier.
 * <p>
 * Everything but the related pages is fixed at construction. The related pages are filled in once, by the related
 * article pass, after every article has been registered.
 */
public final class Article {
    /**
     * Initializes a new article with the given identifier and parsed metadata.
     */
    public Article(final String id, final ParsedArticle parsed) {
        this.id = id;
        this.parsed = parsed;
    }

    /**
     * Retrieves the identifier of the article: its file name without the extension.
     */
    public String id() {
        return id;
    }

    public String title() {
        return parsed.title();
    }

    public String description() {
        return parsed.description();
    }

    public LocalDate date() {
        return parsed.date();
    }

    /**
     * Returns {@code true} iff the article is hidden from every derived view.
     */
    public boolean hide() {
        return parsed.hide();
    }

    /**
     * Returns {@code true} iff the article is not hidden.
     */
    public boolean isVisible() {
        return !parsed.hide();
    }

    public List<RelatedLink> relatedLinks() {
        return parsed.relatedLinks();
    }

    /**
     * Retrieves the pages the related links were resolved to, in the order of the links that could be resolved.
     * <p>
     * Empty until the related article pass has run.
     */
    public List<Page> relatedPages() {
        return Collections.unmodifiableList(relatedPages);
    }

    void addRelatedPage(final Page page) {
        relatedPages.add(page);
    }

    @Override
    public String toString() {
        return "Article[" + id + ", " + parsed.date() + (parsed.hide() ? ", hidden]" : "]");
    }

    private final String id;
    private final ParsedArticle parsed;
    private final ArrayList<Page> relatedPages = new ArrayList<>();
}
