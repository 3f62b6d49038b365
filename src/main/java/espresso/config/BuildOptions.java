// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.config;

/**
 * Options controlling how the site model is built.
 *
 * @param buildPath          The directory the build runs in, {@code "."} for the working directory.
 * @param contentDirectory   The name of the content directory inside the build path.
 * @param sortListPages      If {@code true}, list pages and index aggregates are ordered by date, newest first.
 * @param strictRelatedLinks If {@code true}, an unresolvable related link aborts the build instead of being reported
 *                           as a warning.
 * @param registerMode       How parsed content gets registered in the route tree.
 */
public record BuildOptions(
    String buildPath,
    String contentDirectory,
    boolean sortListPages,
    boolean strictRelatedLinks,
    RegisterMode registerMode
) {
    public BuildOptions {
        if (buildPath.isEmpty()) {
            throw new IllegalArgumentException("Build path must not be empty, use \".\" for the working directory");
        }
        if (contentDirectory.isEmpty()) {
            throw new IllegalArgumentException("Content directory name must not be empty");
        }
    }

    /**
     * Returns the default options: building in the working directory, with content in {@code content}, sorted list
     * pages, lenient related links and merged registration.
     */
    public static BuildOptions defaults() {
        return defaults;
    }

    public BuildOptions withBuildPath(final String newBuildPath) {
        return new BuildOptions(newBuildPath, contentDirectory, sortListPages, strictRelatedLinks, registerMode);
    }

    public BuildOptions withSortListPages(final boolean newSortListPages) {
        return new BuildOptions(buildPath, contentDirectory, newSortListPages, strictRelatedLinks, registerMode);
    }

    public BuildOptions withStrictRelatedLinks(final boolean newStrictRelatedLinks) {
        return new BuildOptions(buildPath, contentDirectory, sortListPages, newStrictRelatedLinks, registerMode);
    }

    public BuildOptions withRegisterMode(final RegisterMode newRegisterMode) {
        return new BuildOptions(buildPath, contentDirectory, sortListPages, strictRelatedLinks, newRegisterMode);
    }

    static final String defaultContentDirectory = "content";

    private static final BuildOptions defaults =
        new BuildOptions(".", defaultContentDirectory, true, false, RegisterMode.MERGED);
}
