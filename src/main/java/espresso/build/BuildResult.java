// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.build;

import java.util.List;
import espresso.site.Site;

/**
 * The outcome of a successful build.
 *
 * @param site     The finished site model.
 * @param warnings The non-fatal conditions signaled during the build.
 */
public record BuildResult(Site site, List<BuildWarning> warnings) {
    public BuildResult {
        warnings = List.copyOf(warnings);
    }
}
