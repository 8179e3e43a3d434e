package info.isaksson.erland.sysmltoscxml.emitter;

import java.util.Objects;

/**
 * Fatal conversion failure.
 *
 * <p>Carries the failure kind and the id of the model element that caused it so callers can
 * point at the offending element. No partial document is ever produced alongside this exception.</p>
 */
public final class ConversionException extends RuntimeException {

    private final ConversionError error;
    private final String elementId;

    public ConversionException(ConversionError error, String elementId, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error must not be null");
        this.elementId = elementId;
    }

    public ConversionError error() {
        return error;
    }

    /** Id of the element the failure is attributed to; may be {@code null} when no element exists. */
    public String elementId() {
        return elementId;
    }

    @Override
    public String toString() {
        return "ConversionException{" + error + (elementId == null ? "" : " @" + elementId) + ": " + getMessage() + "}";
    }
}
