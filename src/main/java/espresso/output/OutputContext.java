// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.output;

import java.nio.file.Path;
import java.time.Instant;

/**
 * What output plugins get to know about the output being produced.
 *
 * @param targetDirectory The directory the site is rendered into. Plugins write their own files there.
 * @param buildTime       The time to use wherever a build timestamp is needed.
 */
public record OutputContext(Path targetDirectory, Instant buildTime) {
}
