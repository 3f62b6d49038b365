// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import espresso.build.ContentUnit;
import espresso.build.SiteBuild;
import espresso.config.BuildOptions;
import espresso.config.RegisterMode;
import espresso.config.Settings;
import espresso.site.Article;
import espresso.site.IndexPage;
import espresso.site.Page;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class ConcurrentRegistrationTest {
    @Test
    void concurrentRegistrationsAreAllRetained() throws Exception {
        final var builder = TestContent.builder();
        final var executor = Executors.newFixedThreadPool(threadCount);
        try {
            final var start = new CountDownLatch(1);
            final var futures = new ArrayList<Future<?>>();
            for (var i = 0; i < pageCount; ++i) {
                final var routePath = "section-" + (i % 7) + "/part-" + (i % 3);
                final var page = new Page(routePath, new Article("page-" + i, TestContent.article("2023-01-01")));
                futures.add(executor.submit(() -> {
                    start.await();
                    builder.register(page);
                    return null;
                }));
            }
            for (var i = 0; i < 7; ++i) {
                final var routePath = "section-" + i;
                final var indexPage = new IndexPage(routePath, new Article("index", TestContent.article("2023-01-01")));
                futures.add(executor.submit(() -> {
                    start.await();
                    builder.registerIndex(indexPage);
                    return null;
                }));
            }
            start.countDown();
            for (final var future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        final var site = builder.finish();

        final var ids = new HashSet<String>();
        for (final var page : site.pages()) {
            assertThat(ids.add(page.id())).as(page.id()).isTrue();
        }
        assertThat(ids).hasSize(pageCount);
        assertThat(site.root().children()).hasSize(7);
        for (final var section : site.root().children()) {
            assertThat(section.indexPage()).as(section.path()).isNotNull();
            assertThat(section.children()).hasSize(3);
        }
    }

    @Test
    void directModeBuildRetainsEveryUnit() {
        final var units = new ArrayList<ContentUnit>();
        for (var i = 0; i < pageCount; ++i) {
            units.add(TestContent.unit("content/section-" + (i % 11) + "/page-" + i + ".md", "2023-01-01"));
        }
        final var executor = Executors.newFixedThreadPool(threadCount);
        try {
            final var options = BuildOptions.defaults().withRegisterMode(RegisterMode.DIRECT);
            final var build = new SiteBuild(Settings.titled("Test site"), options, new TestArticleParser(), executor);
            final var result = build.run(units);

            assertThat(result).isNotNull();
            assertThat(result.warnings()).isEmpty();
            assertThat(result.site().pages()).hasSize(pageCount);
            assertThat(result.site().root().children()).hasSize(11);
        } finally {
            executor.shutdownNow();
        }
    }

    private static final int pageCount = 2000;
    private static final int threadCount = 8;
}
