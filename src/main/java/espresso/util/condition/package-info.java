// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Condition and restart system used for reporting errors and warnings during a site build.
 * <p>
 * Code that detects a problem signals a {@link espresso.util.condition.Condition}; handlers established further up
 * the stack decide, before anything is unwound, whether to ignore it, record it, or transfer control to a
 * {@link espresso.util.condition.Restart}.
 */
@NonNullByDefault
package espresso.util.condition;

import espresso.util.annotation.NonNullByDefault;
