package labelbuilder.label.service.template;

/**
 * A template that cannot be converted to or from a label.
 */
public class LabelTemplateException extends Exception {
    public LabelTemplateException(String message) {
        super(message);
    }

    public LabelTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
