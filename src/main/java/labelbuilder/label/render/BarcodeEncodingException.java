package labelbuilder.label.render;

/**
 * Raised when a barcode payload cannot be encoded in the requested symbology.
 */
public class BarcodeEncodingException extends RuntimeException {

    public BarcodeEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
