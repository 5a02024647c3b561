package org.fusionqa.io.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fusionqa.io.RasterSource;
import org.fusionqa.model.Projection;
import org.fusionqa.model.RasterGrid;
import org.fusionqa.model.RasterImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON implementation of RasterSource.
 *
 * Expected JSON shape:
 * {
 *   "crs": "EPSG:32633",
 *   "scale": 30.0,
 *   "origin": [500000.0, 4100000.0],
 *   "width": 2,
 *   "height": 2,
 *   "bands": [
 *     { "name": "red", "values": [1.0, 2.0, 3.0, null] }
 *   ]
 * }
 *
 * Values are row-major from the upper-left pixel; null marks a masked pixel.
 */
public final class JsonRasterSource implements RasterSource {

    private static final Logger LOG = LoggerFactory.getLogger(JsonRasterSource.class);

    private final String id;
    private final InputStreamSupplier streamSupplier;
    private final JsonRasterFormat format;

    // Cached after first load
    private volatile RasterImage cached;

    private final Object lock = new Object();

    public JsonRasterSource(String id, InputStreamSupplier streamSupplier, JsonRasterFormat format) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must be non-empty");
        }
        this.id = id;
        this.streamSupplier = Objects.requireNonNull(streamSupplier, "streamSupplier must not be null");
        this.format = Objects.requireNonNull(format, "format must not be null");
    }

    /**
     * Source reading a file with the default band format; the file name is the id.
     */
    public static JsonRasterSource ofFile(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return new JsonRasterSource(path.getFileName().toString(), () -> Files.newInputStream(path), JsonRasterFormat.DEFAULT);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public RasterImage load() {
        RasterImage local = cached;
        if (local != null) {
            return local;
        }

        synchronized (lock) {
            if (cached != null) {
                return cached;
            }
            this.cached = loadOnce();
            LOG.debug("Loaded raster '{}': {}", id, cached);
            return this.cached;
        }
    }

    private RasterImage loadOnce() {
        ObjectMapper mapper = new ObjectMapper();
        JsonFactory factory = mapper.getFactory();

        String crs = null;
        Double scale = null;
        double[] origin = null;
        Integer width = null;
        Integer height = null;
        Map<String, double[]> bands = null;

        try (InputStream in = streamSupplier.open();
             JsonParser p = factory.createParser(in)) {

            if (p.nextToken() != JsonToken.START_OBJECT) {
                throw new IllegalArgumentException("Raster '" + id + "': JSON must start with an object");
            }

            while (p.nextToken() != JsonToken.END_OBJECT) {
                String field = p.currentName();
                p.nextToken(); // move to value

                switch (field) {
                    case "crs":
                        crs = p.getValueAsString(null);
                        break;
                    case "scale":
                        scale = readNumber(p, field);
                        break;
                    case "origin":
                        origin = readDoubleArray(p, field, false);
                        break;
                    case "width":
                        width = readInt(p, field);
                        break;
                    case "height":
                        height = readInt(p, field);
                        break;
                    case "bands":
                        bands = readBands(p);
                        break;
                    default:
                        // Skip unknown fields cleanly
                        p.skipChildren();
                }
            }
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Raster '" + id + "': malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON raster '" + id + "'", e);
        }

        if (crs == null || crs.isBlank()) throw missing("crs");
        if (scale == null) throw missing("scale");
        if (origin == null) throw missing("origin");
        if (width == null) throw missing("width");
        if (height == null) throw missing("height");
        if (bands == null || bands.isEmpty()) throw missing("bands");
        if (origin.length != 2) {
            throw new IllegalArgumentException("Raster '" + id + "': origin must be [x, y], got " + origin.length + " value(s)");
        }

        RasterGrid grid = new RasterGrid(width, height, new Projection(crs, scale, origin[0], origin[1]));
        return RasterImage.of(grid, bands);
    }

    private Map<String, double[]> readBands(JsonParser p) throws IOException {
        if (p.currentToken() != JsonToken.START_ARRAY) {
            throw new IllegalArgumentException("Raster '" + id + "': bands must be an array of objects");
        }
        Map<String, double[]> bands = new LinkedHashMap<>();

        while (p.nextToken() != JsonToken.END_ARRAY) {
            if (p.currentToken() != JsonToken.START_OBJECT) {
                throw new IllegalArgumentException("Raster '" + id + "': expected an object inside bands");
            }

            String name = null;
            double[] values = null;

            while (p.nextToken() != JsonToken.END_OBJECT) {
                String field = p.currentName();
                p.nextToken();

                if (format.nameField().equals(field)) {
                    name = p.getValueAsString(null);
                } else if (format.valuesField().equals(field)) {
                    values = readDoubleArray(p, field, true);
                } else {
                    p.skipChildren();
                }
            }

            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Raster '" + id + "': missing/blank band field '" + format.nameField() + "'");
            }
            if (values == null) {
                throw new IllegalArgumentException(
                        "Raster '" + id + "': missing field '" + format.valuesField() + "' for band '" + name + "'"
                );
            }
            if (bands.putIfAbsent(name, values) != null) {
                throw new IllegalArgumentException("Raster '" + id + "': duplicate band '" + name + "'");
            }
        }
        return bands;
    }

    private double readNumber(JsonParser p, String field) throws IOException {
        if (!p.currentToken().isNumeric()) {
            throw new IllegalArgumentException("Raster '" + id + "': " + field + " must be a number");
        }
        return p.getDoubleValue();
    }

    private int readInt(JsonParser p, String field) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_NUMBER_INT) {
            throw new IllegalArgumentException("Raster '" + id + "': " + field + " must be an integer");
        }
        return p.getIntValue();
    }

    /**
     * @param allowNull whether JSON null is accepted (read as a masked NaN sample)
     */
    private double[] readDoubleArray(JsonParser p, String field, boolean allowNull) throws IOException {
        if (p.currentToken() != JsonToken.START_ARRAY) {
            throw new IllegalArgumentException("Raster '" + id + "': " + field + " must be a JSON array of numbers");
        }

        int capacity = 256;
        double[] buffer = new double[capacity];
        int size = 0;

        while (p.nextToken() != JsonToken.END_ARRAY) {
            double value;
            if (p.currentToken() == JsonToken.VALUE_NULL && allowNull) {
                value = Double.NaN;
            } else if (p.currentToken().isNumeric()) {
                value = p.getDoubleValue();
            } else {
                throw new IllegalArgumentException("Raster '" + id + "': " + field + " must contain numbers only");
            }

            // Grow array if needed
            if (size == capacity) {
                capacity *= 2;
                buffer = Arrays.copyOf(buffer, capacity);
            }
            buffer[size++] = value;
        }

        return Arrays.copyOf(buffer, size);
    }

    private IllegalArgumentException missing(String field) {
        return new IllegalArgumentException("Raster '" + id + "': missing field '" + field + "'");
    }

    /**
     * Simple functional interface so callers can provide:
     * - a file stream
     * - a classpath resource stream
     * - an in-memory stream in tests
     */
    @FunctionalInterface
    public interface InputStreamSupplier {
        InputStream open() throws IOException;
    }
}
