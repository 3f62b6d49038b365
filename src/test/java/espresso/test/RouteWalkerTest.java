// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.test;

import java.util.ArrayList;
import java.util.List;
import espresso.site.Article;
import espresso.site.Page;
import espresso.site.Route;
import espresso.site.RouteWalker;
import espresso.site.Site;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import org.junit.jupiter.api.Test;

final class RouteWalkerTest {
    @Test
    void depthOneVisitsOnlyImmediateChildren() {
        final var site = buildSite();
        assertThat(walk(site.root(), 1)).containsExactly("about", "blog", "recipes");
    }

    @Test
    void depthTwoStopsBeforeGrandchildren() {
        final var site = buildSite();
        assertThat(walk(site.root(), 2))
            .containsExactly("about", "blog", "blog/coffee", "blog/tea", "recipes", "recipes/cake");
    }

    @Test
    void unboundedDepthVisitsWholeSubtreeInPreOrder() {
        final var site = buildSite();
        assertThat(walk(site.root(), RouteWalker.unbounded)).containsExactly(
            "about",
            "blog",
            "blog/coffee",
            "blog/coffee/beans",
            "blog/tea",
            "recipes",
            "recipes/cake"
        );
    }

    @Test
    void walkStartsBelowTheGivenRoute() {
        final var site = buildSite();
        final var blog = site.tree().lookup("blog");
        assertThat(walk(blog, RouteWalker.unbounded)).containsExactly("blog/coffee", "blog/coffee/beans", "blog/tea");
        assertThat(walk(blog, 0)).isEmpty();
    }

    @Test
    void walkAllIncludesTheRootFirst() {
        final var site = buildSite();
        final var paths = new ArrayList<String>();
        site.forEachRoute(route -> paths.add(route.path()));
        assertThat(paths).hasSize(8);
        assertThat(paths.get(0)).isEmpty();
    }

    @Test
    void invalidDepthIsRejected() {
        final var site = buildSite();
        assertThatIllegalArgumentException().isThrownBy(() -> RouteWalker.walk(site.root(), -2, route -> {
        }));
    }

    private static List<String> walk(final Route root, final int depth) {
        final var paths = new ArrayList<String>();
        RouteWalker.walk(root, depth, route -> paths.add(route.path()));
        return paths;
    }

    private static Site buildSite() {
        final var builder = TestContent.builder();
        // Registered out of order on purpose: walks order children by key.
        for (final var path : List.of("recipes/cake", "blog/tea", "blog/coffee/beans", "about", "blog")) {
            builder.register(new Page(path, new Article("post", TestContent.article("2023-01-01"))));
        }
        return builder.finish();
    }
}
