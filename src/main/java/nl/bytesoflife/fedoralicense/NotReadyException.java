package nl.bytesoflife.fedoralicense;

/**
 * Thrown when a result is requested before any license string was parsed
 * successfully, or after a reset.
 */
public class NotReadyException extends IllegalStateException {

    public NotReadyException() {
        super("No Fedora license string processed.");
    }
}
