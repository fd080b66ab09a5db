package me.christianrobert.plpgcheck.pragma;

/**
 * A pragma directive that cannot be applied. The message becomes the detail of the
 * "not processed" warning.
 */
public class PragmaException extends Exception {

    public PragmaException(String message) {
        super(message);
    }
}
