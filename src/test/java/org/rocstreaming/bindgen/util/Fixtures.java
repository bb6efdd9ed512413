package org.rocstreaming.bindgen.util;

import org.rocstreaming.bindgen.BindgenException;
import org.rocstreaming.bindgen.doxygen.DoxygenParser;
import org.rocstreaming.bindgen.model.ApiRoot;
import org.rocstreaming.bindgen.model.GitInfo;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

/**
 * Access to the Doxygen XML fixture of the roc-toolkit public API.
 */
public final class Fixtures {

    public static final GitInfo GIT_INFO = new GitInfo("v0.4.0", "1a2b3c4");

    private Fixtures() {
    }

    /**
     * Returns the directory holding the fixture XML files.
     */
    public static Path rocDoxygenDir() {
        URL url = Fixtures.class.getResource("/doxygen/roc");
        if (url == null) {
            throw new IllegalStateException("Missing test resource /doxygen/roc");
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid resource URL " + url, e);
        }
    }

    /**
     * Parses the whole fixture.
     */
    public static ApiRoot rocApiRoot() {
        try {
            return new DoxygenParser(rocDoxygenDir()).parse(GIT_INFO);
        } catch (BindgenException e) {
            throw new IllegalStateException("Fixture can't be parsed", e);
        }
    }
}
