package org.rocstreaming.bindgen.model;

/**
 * Common view of every named element that carries a documentation comment.
 */
public interface Documented {

    /**
     * Returns the source (C API) name of the element.
     */
    String name();

    /**
     * Returns the documentation of the element.
     */
    DocComment doc();
}
