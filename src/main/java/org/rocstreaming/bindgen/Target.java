package org.rocstreaming.bindgen;

/**
 * Binding ecosystems selectable on the command line.
 */
public enum Target {
    ALL,
    JAVA,
    GO;

    /**
     * Checks whether this selection includes the given single target.
     */
    public boolean includes(Target target) {
        return this == ALL || this == target;
    }
}
