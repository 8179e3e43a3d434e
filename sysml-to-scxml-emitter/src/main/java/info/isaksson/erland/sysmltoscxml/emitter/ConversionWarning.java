package info.isaksson.erland.sysmltoscxml.emitter;

import java.util.Comparator;
import java.util.Objects;

/**
 * A non-fatal finding attributed to one model element.
 *
 * <p>Ordered by code, then element id, then message.</p>
 */
public final class ConversionWarning implements Comparable<ConversionWarning> {

    private static final Comparator<ConversionWarning> ORDER = Comparator
            .comparing((ConversionWarning w) -> w.code)
            .thenComparing(w -> w.elementId)
            .thenComparing(w -> w.message);

    public final WarningCode code;
    public final String elementId;
    public final String message;

    public ConversionWarning(WarningCode code, String elementId, String message) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.elementId = Objects.requireNonNull(elementId, "elementId must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public int compareTo(ConversionWarning other) {
        return ORDER.compare(this, other);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionWarning)) return false;
        ConversionWarning that = (ConversionWarning) o;
        return code == that.code && elementId.equals(that.elementId) && message.equals(that.message);
    }

    @Override public int hashCode() {
        return Objects.hash(code, elementId, message);
    }

    @Override
    public String toString() {
        return code + " [" + elementId + "]: " + message;
    }
}
