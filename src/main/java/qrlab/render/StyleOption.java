package qrlab.render;

/**
 * An enum constant that clients select by its lower-case wire name.
 */
public interface StyleOption {

    String wireName();
}
