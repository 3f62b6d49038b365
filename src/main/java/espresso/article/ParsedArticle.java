// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.article;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * The metadata of a content unit as produced by an {@link ArticleParser}.
 * <p>
 * A parsed article has no identity yet: the identifier is derived from the file name by the site builder.
 *
 * @param title        The title of the article.
 * @param description  A short description of the article.
 * @param date         The creation date of the article. Never {@code null}.
 * @param hide         If {@code true}, the article appears in no list, index, feed or navigation.
 * @param relatedLinks The articles this article refers to.
 */
public record ParsedArticle(
    String title,
    String description,
    LocalDate date,
    boolean hide,
    List<RelatedLink> relatedLinks
) {
    public ParsedArticle {
        Objects.requireNonNull(date, "Parsed article has no date");
        relatedLinks = List.copyOf(relatedLinks);
    }
}
