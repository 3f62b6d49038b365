// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.test;

import espresso.config.BuildOptions;
import espresso.site.ContentPath;
import espresso.site.MalformedPathCondition;
import espresso.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

final class ContentPathTest {
    @ParameterizedTest
    @CsvSource({
        "content/blog/coffee/roasting-basics.md, blog/coffee, roasting-basics",
        "content/about.md, '', about",
        "./content/blog/post.md, blog, post",
        "content/blog/archive.tar.gz, blog, archive.tar",
        "content/blog/README, blog, README",
        "content\\blog\\windows.md, blog, windows",
        "content/blog//./post.md, blog, post",
    })
    void computesRouteAndIdentifierInWorkingDirectory(
        final String rawPath,
        final String routePath,
        final String articleId
    ) {
        assertThat(ContentPath.of(rawPath, BuildOptions.defaults()))
            .isEqualTo(new ContentPath(routePath, articleId));
    }

    @ParameterizedTest
    @ValueSource(strings = {"my-site", "my-site/", "my-site\\"})
    void stripsBuildPathAndContentDirectory(final String buildPath) {
        final var options = BuildOptions.defaults().withBuildPath(buildPath);
        assertThat(ContentPath.of("my-site/content/blog/category-1/post.md", options))
            .isEqualTo(new ContentPath("blog/category-1", "post"));
    }

    @Test
    void recognizesIndexFiles() {
        assertThat(ContentPath.of("content/blog/index.md", BuildOptions.defaults()).isIndex()).isTrue();
        assertThat(ContentPath.of("content/blog/indexes.md", BuildOptions.defaults()).isIndex()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "elsewhere/blog/post.md",
        "contents/blog/post.md",
        "content",
        "content/",
        "content/../secrets.md",
        "content/blog/.md",
    })
    void rejectsPathsOutsideContentRoot(final String rawPath) {
        assertThatThrownBy(() -> ContentPath.of(rawPath, BuildOptions.defaults()))
            .isInstanceOfSatisfying(UnhandledErrorError.class, error -> {
                assertThat(error.condition()).isInstanceOf(MalformedPathCondition.class);
                assertThat(((MalformedPathCondition) error.condition()).rawPath()).isEqualTo(rawPath);
            });
    }

    @Test
    void rejectsPathsOutsideNonDefaultBuildPath() {
        final var options = BuildOptions.defaults().withBuildPath("my-site");
        assertThatThrownBy(() -> ContentPath.of("content/blog/post.md", options))
            .isInstanceOf(UnhandledErrorError.class);
    }
}
