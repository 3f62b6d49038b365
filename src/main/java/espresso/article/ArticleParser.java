// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.article;

/**
 * Turns the raw bytes of a content file into a {@link ParsedArticle}.
 * <p>
 * Implementations must be safe to call from several worker threads at once. On malformed input, they signal a fatal
 * {@link ArticleParseErrorCondition}; related links are expected to go through {@link RelatedLink#parse(String)}.
 */
@FunctionalInterface
public interface ArticleParser {
    ParsedArticle parse(byte[] source);
}
