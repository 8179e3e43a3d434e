package info.isaksson.erland.sysmltoscxml.scxml;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Serializes an {@link ScxmlElement} tree as a pretty-printed UTF-8 XML document.
 *
 * <p>Two-space indentation, one element per line, empty elements self-closed, trailing newline.
 * The same tree always yields the same bytes.</p>
 */
public final class ScxmlWriter {

    static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
    private static final String INDENT = "  ";

    private ScxmlWriter() {}

    public static String writeToString(ScxmlElement root) {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        StringBuilder sb = new StringBuilder(256);
        sb.append(XML_DECLARATION).append('\n');
        writeElement(sb, root, 0);
        return sb.toString();
    }

    public static void write(ScxmlElement root, Path outFile) throws IOException {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        if (outFile == null) {
            throw new IllegalArgumentException("outFile must not be null");
        }

        Path parent = outFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outFile, writeToString(root), StandardCharsets.UTF_8);
    }

    private static void writeElement(StringBuilder sb, ScxmlElement e, int depth) {
        indent(sb, depth);
        sb.append('<').append(e.name());
        for (Map.Entry<String, String> a : e.attributes().entrySet()) {
            sb.append(' ').append(a.getKey()).append("=\"").append(escapeAttr(a.getValue())).append('"');
        }
        if (e.children().isEmpty()) {
            sb.append("/>\n");
            return;
        }
        sb.append(">\n");
        for (ScxmlElement c : e.children()) {
            writeElement(sb, c, depth + 1);
        }
        indent(sb, depth);
        sb.append("</").append(e.name()).append(">\n");
    }

    private static void indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) sb.append(INDENT);
    }

    static String escapeAttr(String s) {
        if (s == null) return "";
        StringBuilder out = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&': out.append("&amp;"); break;
                case '<': out.append("&lt;"); break;
                case '>': out.append("&gt;"); break;
                case '"': out.append("&quot;"); break;
                case '\'': out.append("&apos;"); break;
                case '\n': out.append("&#10;"); break;
                case '\r': out.append("&#13;"); break;
                case '\t': out.append("&#9;"); break;
                default: out.append(c);
            }
        }
        return out.toString();
    }
}
