// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.test;

import espresso.site.Article;
import espresso.site.DuplicateIndexPageCondition;
import espresso.site.IndexPage;
import espresso.site.MalformedRoutePathCondition;
import espresso.site.Page;
import espresso.site.RouteNotFoundCondition;
import espresso.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class RouteTreeTest {
    @Test
    void insertCreatesNestedRoutes() {
        final var builder = TestContent.builder();
        final var page = new Page("blog/coffee", new Article("roasting", TestContent.article("2023-01-01")));
        builder.register(page);
        final var root = builder.finish().root();

        final var blog = root.child("blog");
        assertThat(blog).isNotNull();
        assertThat(blog.path()).isEqualTo("blog");
        assertThat(blog.pages()).isEmpty();
        final var coffee = blog.child("coffee");
        assertThat(coffee).isNotNull();
        assertThat(coffee.key()).isEqualTo("coffee");
        assertThat(coffee.path()).isEqualTo("blog/coffee");
        assertThat(coffee.pages()).containsExactly(page);
        assertThat(root.pages()).isEmpty();
    }

    @Test
    void insertReusesExistingRoutes() {
        final var builder = TestContent.builder();
        builder.register(new Page("blog/coffee", new Article("a", TestContent.article("2023-01-01"))));
        builder.register(new Page("blog/coffee", new Article("b", TestContent.article("2023-01-02"))));
        builder.register(new Page("blog", new Article("c", TestContent.article("2023-01-03"))));
        final var root = builder.finish().root();

        assertThat(root.children()).hasSize(1);
        final var blog = root.child("blog");
        assertThat(blog).isNotNull();
        assertThat(blog.children()).hasSize(1);
        assertThat(TestContent.ids(blog.pages())).containsExactly("c");
        final var coffee = blog.child("coffee");
        assertThat(coffee).isNotNull();
        assertThat(TestContent.ids(coffee.pages())).containsExactly("a", "b");
    }

    @Test
    void emptyPathAppendsToRoot() {
        final var builder = TestContent.builder();
        final var page = new Page("", new Article("about", TestContent.article("2023-01-01")));
        builder.register(page);
        final var root = builder.finish().root();

        assertThat(root.isRoot()).isTrue();
        assertThat(root.children()).isEmpty();
        assertThat(root.pages()).containsExactly(page);
    }

    @Test
    void lookupResolvesExistingRoutes() {
        final var builder = TestContent.builder();
        builder.register(new Page("blog/coffee/beans", new Article("a", TestContent.article("2023-01-01"))));
        final var tree = builder.finish().tree();

        assertThat(tree.lookup("").isRoot()).isTrue();
        assertThat(tree.lookup("blog").path()).isEqualTo("blog");
        assertThat(tree.lookup("blog/coffee/beans").path()).isEqualTo("blog/coffee/beans");
        assertThat(tree.find("blog/coffee")).isSameAs(tree.lookup("blog/coffee"));
    }

    @Test
    void lookupOfMissingRouteIsFatal() {
        final var builder = TestContent.builder();
        builder.register(new Page("blog", new Article("a", TestContent.article("2023-01-01"))));
        final var tree = builder.finish().tree();

        assertThat(tree.find("blog/tea")).isNull();
        assertThat(tree.find("tea")).isNull();
        assertThatThrownBy(() -> tree.lookup("blog/tea"))
            .isInstanceOfSatisfying(UnhandledErrorError.class, error -> {
                assertThat(error.condition()).isInstanceOf(RouteNotFoundCondition.class);
                assertThat(((RouteNotFoundCondition) error.condition()).path()).isEqualTo("blog/tea");
            });
    }

    @Test
    void secondIndexPageOfRouteIsFatal() {
        final var builder = TestContent.builder();
        builder.registerIndex(new IndexPage("blog", new Article("index", TestContent.article("2023-01-01"))));

        assertThatThrownBy(() -> builder.registerIndex(
            new IndexPage("blog", new Article("index", TestContent.article("2023-01-02")))
        )).isInstanceOfSatisfying(
            UnhandledErrorError.class,
            error -> assertThat(error.condition()).isInstanceOf(DuplicateIndexPageCondition.class)
        );
    }

    @ParameterizedTest
    @ValueSource(strings = {"/blog", "blog/", "blog//coffee", "/"})
    void routePathWithEmptySegmentIsRejected(final String routePath) {
        final var builder = TestContent.builder();
        final var page = new Page(routePath, new Article("x", TestContent.article("2023-01-01")));

        assertThatThrownBy(() -> builder.register(page)).isInstanceOfSatisfying(UnhandledErrorError.class, error -> {
            assertThat(error.condition()).isInstanceOf(MalformedRoutePathCondition.class);
            assertThat(((MalformedRoutePathCondition) error.condition()).routePath()).isEqualTo(routePath);
        });
        final var index = new IndexPage(routePath, new Article("index", TestContent.article("2023-01-01")));
        assertThatThrownBy(() -> builder.registerIndex(index)).isInstanceOfSatisfying(
            UnhandledErrorError.class,
            error -> assertThat(error.condition()).isInstanceOf(MalformedRoutePathCondition.class)
        );

        final var site = builder.finish();
        assertThat(site.root().children()).isEmpty();
        assertThat(site.root().pages()).isEmpty();
        assertThat(site.nav().items()).isEmpty();
    }

    @Test
    void lookupOfPathWithEmptySegmentFindsNothing() {
        final var builder = TestContent.builder();
        builder.register(new Page("blog", new Article("a", TestContent.article("2023-01-01"))));
        final var tree = builder.finish().tree();

        assertThat(tree.find("blog/")).isNull();
        assertThat(tree.find("/blog")).isNull();
    }
}
