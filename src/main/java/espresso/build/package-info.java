// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The build pipeline: parsing content units on a worker pool and turning them into a finished site model.
 */
@NonNullByDefault
package espresso.build;

import espresso.util.annotation.NonNullByDefault;
