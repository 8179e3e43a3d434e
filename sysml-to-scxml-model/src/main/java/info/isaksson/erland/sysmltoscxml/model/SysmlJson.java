package info.isaksson.erland.sysmltoscxml.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization of the SysML element graph.
 *
 * <p>Element order is preserved as written; it is the document order the converter relies on.
 * Unknown properties are ignored so exports from newer tools still load.</p>
 */
public final class SysmlJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private SysmlJson() {}

    public static SysmlModel read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return unwrap(() -> MAPPER.readValue(in, SysmlModel.class));
        }
    }

    /** Parse a model from a JSON string. */
    public static SysmlModel readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return unwrap(() -> MAPPER.readValue(json, SysmlModel.class));
    }

    public static void write(SysmlModel model, Path path) throws IOException {
        if (model == null) throw new IllegalArgumentException("model is null");
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, model);
            out.write('\n');
        }
    }

    public static String toJsonString(SysmlModel model) throws IOException {
        if (model == null) throw new IllegalArgumentException("model is null");
        return MAPPER.writer(PRETTY).writeValueAsString(model) + "\n";
    }

    /**
     * Model validation errors raised inside the {@link SysmlModel} creator reach us wrapped by Jackson;
     * surface the original {@link IllegalArgumentException} so callers see one error type for bad graphs.
     */
    private static SysmlModel unwrap(JsonRead read) throws IOException {
        try {
            return read.read();
        } catch (JsonMappingException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof IllegalArgumentException) {
                throw (IllegalArgumentException) cause;
            }
            throw ex;
        }
    }

    @FunctionalInterface
    private interface JsonRead {
        SysmlModel read() throws IOException;
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        om.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
