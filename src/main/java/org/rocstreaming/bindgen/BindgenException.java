package org.rocstreaming.bindgen;

/**
 * Fatal condition that aborts the whole run: unreadable input, missing output directory,
 * unavailable version metadata.
 *
 * <p>Content problems (unknown markup, unresolved references) are never reported this way;
 * they are logged as warnings and generation continues.
 */
public class BindgenException extends Exception {

    public BindgenException(String message) {
        super(message);
    }

    public BindgenException(String message, Throwable cause) {
        super(message, cause);
    }
}
