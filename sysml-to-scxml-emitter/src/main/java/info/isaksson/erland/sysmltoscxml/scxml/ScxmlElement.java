package info.isaksson.erland.sysmltoscxml.scxml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal ordered XML element tree for SCXML output.
 *
 * <p>Attributes keep insertion order and children keep append order, so serialization is a pure
 * function of how the tree was built.</p>
 */
public final class ScxmlElement {
    private final String name;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<ScxmlElement> children = new ArrayList<>();

    public ScxmlElement(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        this.name = name;
    }

    public String name() {
        return name;
    }

    public ScxmlElement attr(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, () -> "value of '" + key + "' must not be null");
        attributes.put(key, value);
        return this;
    }

    public String attr(String key) {
        return attributes.get(key);
    }

    /** Appends and returns a new child element. */
    public ScxmlElement child(String childName) {
        ScxmlElement c = new ScxmlElement(childName);
        children.add(c);
        return c;
    }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public List<ScxmlElement> children() {
        return Collections.unmodifiableList(children);
    }

    public List<ScxmlElement> children(String childName) {
        List<ScxmlElement> out = new ArrayList<>();
        for (ScxmlElement c : children) {
            if (c.name.equals(childName)) out.add(c);
        }
        return out;
    }

    @Override
    public String toString() {
        return "<" + name + " " + attributes + ">";
    }
}
