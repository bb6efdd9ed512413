package org.rocstreaming.bindgen.model;

import java.util.Objects;

/**
 * Revision of roc-toolkit the definitions were extracted from.
 *
 * @param tag    output of {@code git describe --tags}
 * @param commit short commit hash
 */
public record GitInfo(String tag, String commit) {

    public GitInfo {
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(commit, "commit must not be null");
    }
}
