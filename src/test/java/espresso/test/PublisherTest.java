// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import espresso.output.OutputContext;
import espresso.output.OutputPlugin;
import espresso.output.Publisher;
import espresso.site.Page;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class PublisherTest {
    @Test
    void pluginsReceiveVisiblePagesThenFinish() {
        final var builder = TestContent.builder();
        builder.ingest("content/index.md", TestContent.article("2023-01-01"));
        builder.ingest("content/about.md", TestContent.article("2023-01-01"));
        builder.ingest("content/blog/draft.md", TestContent.article("2023-01-02", true));
        builder.ingest("content/blog/post.md", TestContent.article("2023-01-03"));
        final var site = builder.finish();
        final var context = new OutputContext(Path.of("build"), Instant.parse("2023-01-04T00:00:00Z"));
        final var first = new RecordingPlugin("first");
        final var second = new RecordingPlugin("second");

        Publisher.publish(site, List.of(first, second), context);

        assertThat(first.events).containsExactly("page about", "page blog/post", "finish");
        assertThat(second.events).isEqualTo(first.events);
        assertThat(first.contexts).containsOnly(context);
    }

    private static final class RecordingPlugin implements OutputPlugin {
        private RecordingPlugin(final String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void onPage(final Page page, final OutputContext context) {
            events.add("page " + page.fullPath());
            contexts.add(context);
        }

        @Override
        public void finish(final OutputContext context) {
            events.add("finish");
            contexts.add(context);
        }

        private final String name;
        private final List<String> events = new ArrayList<>();
        private final List<OutputContext> contexts = new ArrayList<>();
    }
}
