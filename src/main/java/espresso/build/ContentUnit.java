// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package espresso.build;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A content file as supplied by the file system layer.
 *
 * @param rawPath The path of the file, including the build path and the content directory.
 * @param source  The contents of the file. Never modified.
 */
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "Content is handed over once and only ever read"
)
public record ContentUnit(String rawPath, byte[] source) {
    /**
     * Returns a content unit holding the UTF-8 encoding of the given text.
     */
    public static ContentUnit ofText(final String rawPath, final String text) {
        return new ContentUnit(rawPath, text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return object instanceof final ContentUnit other
            && rawPath.equals(other.rawPath)
            && Arrays.equals(source, other.source);
    }

    @Override
    public int hashCode() {
        return 31 * rawPath.hashCode() + Arrays.hashCode(source);
    }

    @Override
    public String toString() {
        return "ContentUnit[" + rawPath + ", " + source.length + " bytes]";
    }
}
