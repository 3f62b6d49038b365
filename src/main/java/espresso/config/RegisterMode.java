// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.config;

/**
 * How parsed content units get registered in the route tree during a build.
 */
public enum RegisterMode {
    /**
     * Workers only parse; the building thread registers every entry afterwards, in input order. The resulting tree
     * does not depend on thread scheduling.
     */
    MERGED,
    /**
     * Every worker registers its own entry as soon as it is parsed, through the builder's lock. Registration order
     * within a route then depends on scheduling.
     */
    DIRECT,
}
