// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.site;

import java.util.ArrayList;
import espresso.config.BuildOptions;
import espresso.util.condition.ConditionContext;

/**
 * The location of a content file within the site: the route it belongs to and the identifier of its article.
 * <p>
 * For example, with the default options, {@code content/blog/coffee/roasting-basics.md} is the article
 * {@code roasting-basics} of the route {@code blog/coffee}, and {@code content/about.md} is the article {@code about}
 * of the root route.
 *
 * @param routePath The route path, {@code ""} for the root route.
 * @param articleId The file name without its extension.
 */
public record ContentPath(String routePath, String articleId) {
    /**
     * Returns {@code true} iff the file is the index page of its route.
     */
    public boolean isIndex() {
        return indexArticleId.equals(articleId);
    }

    /**
     * Computes the content path of the file at {@code rawPath}, which must lie within the content root given by
     * {@code options}.
     * <p>
     * Both slashes and backslashes are accepted as separators. Signals a fatal {@link MalformedPathCondition} if the
     * path is not below the content root, climbs out of it, or has no file name.
     */
    public static ContentPath of(final String rawPath, final BuildOptions options) {
        final var path = rawPath.replace('\\', '/');
        final var contentRoot = contentRoot(path, options);
        final var prefix = contentRoot + '/';
        if (!path.startsWith(prefix)) {
            throw ConditionContext.error(
                new MalformedPathCondition(rawPath, contentRoot, "not within the content root"));
        }
        final var segments = new ArrayList<String>();
        for (final var segment : path.substring(prefix.length()).split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                throw ConditionContext.error(
                    new MalformedPathCondition(rawPath, contentRoot, "escapes the content root"));
            }
            segments.add(segment);
        }
        if (segments.isEmpty()) {
            throw ConditionContext.error(new MalformedPathCondition(rawPath, contentRoot, "no file name"));
        }
        final var articleId = stripExtension(segments.remove(segments.size() - 1));
        if (articleId.isEmpty()) {
            throw ConditionContext.error(new MalformedPathCondition(rawPath, contentRoot, "empty article identifier"));
        }
        return new ContentPath(String.join("/", segments), articleId);
    }

    private static String contentRoot(final String path, final BuildOptions options) {
        final var contentDirectory = options.contentDirectory();
        final var buildPath = stripTrailingSlashes(options.buildPath().replace('\\', '/'));
        // Paths under the working directory may come without the leading "./".
        if (buildPath.equals(".") && path.startsWith(contentDirectory + '/')) {
            return contentDirectory;
        }
        return buildPath.endsWith("/") ? buildPath + contentDirectory : buildPath + '/' + contentDirectory;
    }

    private static String stripTrailingSlashes(final String path) {
        var end = path.length();
        while (end > 1 && path.charAt(end - 1) == '/') {
            end -= 1;
        }
        return path.substring(0, end);
    }

    private static String stripExtension(final String fileName) {
        final var dotIndex = fileName.lastIndexOf('.');
        return (dotIndex == -1) ? fileName : fileName.substring(0, dotIndex);
    }

    static final String indexArticleId = "index";
}
