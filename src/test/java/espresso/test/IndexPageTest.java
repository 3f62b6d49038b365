// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.test;

import espresso.config.BuildOptions;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class IndexPageTest {
    @Test
    void indexPageAggregatesVisiblePagesOfWholeSite() {
        final var builder = TestContent.builder();
        builder.ingest("content/index.md", TestContent.article("2022-12-01"));
        builder.ingest("content/about.md", TestContent.article("2022-01-01"));
        builder.ingest("content/blog/coffee/beans.md", TestContent.article("2023-03-01"));
        builder.ingest("content/blog/tea/green.md", TestContent.article("2023-01-01"));
        builder.ingest("content/blog/tea/draft.md", TestContent.article("2023-05-01", true));
        builder.ingest("content/recipes/cake.md", TestContent.article("2023-02-01"));
        final var site = builder.finish();

        final var indexPage = site.root().indexPage();
        assertThat(indexPage).isNotNull();
        assertThat(TestContent.fullPaths(indexPage.articlePages()))
            .containsExactly("blog/coffee/beans", "recipes/cake", "blog/tea/green", "about");
    }

    @Test
    void twoIndexRoutesBothSeeEveryVisibleArticle() {
        final var builder = TestContent.builder();
        builder.ingest("content/a/index.md", TestContent.article("2023-01-01"));
        builder.ingest("content/b/index.md", TestContent.article("2023-01-01"));
        builder.ingest("content/c/one.md", TestContent.article("2023-01-03"));
        builder.ingest("content/c/two.md", TestContent.article("2023-01-02"));
        builder.ingest("content/d/three.md", TestContent.article("2023-01-01"));
        final var site = builder.finish();

        for (final var path : new String[] {"a", "b"}) {
            final var indexPage = site.tree().lookup(path).indexPage();
            assertThat(indexPage).as(path).isNotNull();
            assertThat(TestContent.fullPaths(indexPage.articlePages())).as(path)
                .containsExactly("c/one", "c/two", "d/three");
        }
    }

    @Test
    void indexArticlesAreNotAggregated() {
        final var builder = TestContent.builder();
        builder.ingest("content/index.md", TestContent.article("2024-01-01"));
        builder.ingest("content/blog/index.md", TestContent.article("2024-01-01"));
        builder.ingest("content/blog/post.md", TestContent.article("2023-01-01"));
        final var site = builder.finish();

        final var indexPage = site.root().indexPage();
        assertThat(indexPage).isNotNull();
        assertThat(TestContent.fullPaths(indexPage.articlePages())).containsExactly("blog/post");
    }

    @Test
    void everyIndexPageSharesTheSameAggregate() {
        final var builder = TestContent.builder();
        builder.ingest("content/index.md", TestContent.article("2023-01-01"));
        builder.ingest("content/blog/index.md", TestContent.article("2023-01-01"));
        builder.ingest("content/recipes/cake/index.md", TestContent.article("2023-01-01"));
        builder.ingest("content/blog/post.md", TestContent.article("2023-01-02"));
        final var site = builder.finish();

        final var rootIndex = site.root().indexPage();
        final var blogIndex = site.tree().lookup("blog").indexPage();
        final var cakeIndex = site.tree().lookup("recipes/cake").indexPage();
        assertThat(rootIndex).isNotNull();
        assertThat(blogIndex).isNotNull();
        assertThat(cakeIndex).isNotNull();
        assertThat(blogIndex.articlePages()).isSameAs(rootIndex.articlePages());
        assertThat(cakeIndex.articlePages()).isSameAs(rootIndex.articlePages());
        assertThatExceptionOfType(UnsupportedOperationException.class)
            .isThrownBy(() -> rootIndex.articlePages().clear());
    }

    @Test
    void unsortedAggregateFollowsCanonicalRouteOrder() {
        final var builder = TestContent.builder(BuildOptions.defaults().withSortListPages(false));
        builder.ingest("content/recipes/cake.md", TestContent.article("2023-01-01"));
        builder.ingest("content/blog/b.md", TestContent.article("2023-01-03"));
        builder.ingest("content/about.md", TestContent.article("2023-01-02"));
        builder.ingest("content/blog/a.md", TestContent.article("2023-01-04"));
        builder.ingest("content/index.md", TestContent.article("2023-01-01"));
        final var site = builder.finish();

        final var indexPage = site.root().indexPage();
        assertThat(indexPage).isNotNull();
        assertThat(TestContent.fullPaths(indexPage.articlePages()))
            .containsExactly("about", "blog/b", "blog/a", "recipes/cake");
    }
}
