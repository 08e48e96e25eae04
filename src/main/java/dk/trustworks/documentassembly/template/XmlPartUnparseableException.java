package dk.trustworks.documentassembly.template;

/**
 * A template XML part could not be parsed or has a shape the run rewriter does not handle.
 * Never leaves {@link TemplateRewriter}: the part is emitted with its original bytes instead.
 */
public class XmlPartUnparseableException extends Exception {

    public XmlPartUnparseableException(String message) {
        super(message);
    }

    public XmlPartUnparseableException(String message, Throwable cause) {
        super(message, cause);
    }
}
