// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.build;

import java.util.Collection;
import java.util.concurrent.ExecutorService;
import espresso.article.ArticleParser;
import espresso.config.BuildOptions;
import espresso.config.Settings;
import espresso.site.SiteBuilder;
import espresso.util.CollectionExecutorService;
import espresso.util.Trace;
import espresso.util.condition.ConditionContext;
import espresso.util.condition.Handler;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The entry point to building a site model from content units.
 */
public final class SiteBuild {
    /**
     * Initializes a new build with the given settings and options. Content units are parsed by {@code parser} in tasks
     * submitted to {@code executorService}.
     */
    public SiteBuild(
        final Settings settings,
        final BuildOptions options,
        final ArticleParser parser,
        final ExecutorService executorService
    ) {
        this.settings = settings;
        this.options = options;
        this.parser = parser;
        executor = new CollectionExecutorService(executorService);
    }

    /**
     * Builds the site model of the given content units.
     * <p>
     * Content units are parsed in parallel and registered according to the build's
     * {@link espresso.config.RegisterMode}; the derivation passes run once all of them are registered. Worker threads
     * inherit the caller's thread-safe handlers and restarts.
     * <p>
     * Non-fatal conditions are collected into the result's warnings. Fatal conditions are left to the caller's
     * handlers, which may transfer control to the {@value #abortRestartName} restart established by this method; the
     * partially built model is discarded then.
     *
     * @return The finished site and its warnings, or {@code null} if the build was aborted through the
     * {@value #abortRestartName} restart.
     */
    public @Nullable BuildResult run(final Collection<ContentUnit> units) {
        final var warnings = new BuildWarnings();
        try (final var handler = new Handler(warnings)) {
            handler.use();
            return ConditionContext.withRestart(abortRestartName, restart -> {
                try (final var trace = new Trace(() -> "Building site model from " + units.size() + " content units")) {
                    trace.use();
                    final var builder = new SiteBuilder(settings, options, parser);
                    registerAll(builder, units);
                    final var site = builder.finish();
                    return new BuildResult(site, warnings.toList());
                }
            });
        }
    }

    private void registerAll(final SiteBuilder builder, final Collection<ContentUnit> units) {
        switch (options.registerMode()) {
            case DIRECT -> executor.forEach(units, unit -> builder.build(unit.rawPath(), unit.source()));
            case MERGED -> {
                final var entries = executor.map(units, unit -> builder.prepare(unit.rawPath(), unit.source()));
                try (final var trace = new Trace("Registering parsed content")) {
                    trace.use();
                    entries.forEach(builder::register);
                }
            }
        }
    }

    /**
     * The name of the restart that aborts the build.
     */
    public static final String abortRestartName = "abort-build";

    private final Settings settings;
    private final BuildOptions options;
    private final ArticleParser parser;
    private final CollectionExecutorService executor;
}
