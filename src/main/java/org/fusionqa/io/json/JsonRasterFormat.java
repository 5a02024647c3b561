package org.fusionqa.io.json;

/**
 * Describes how bands are stored in the "bands" array of a JSON raster.
 * Example band object:
 * { "name": "red", "values": [0.1, 0.2, null, ...] }
 */
public record JsonRasterFormat(String nameField, String valuesField) {

    public static final JsonRasterFormat DEFAULT = new JsonRasterFormat("name", "values");

    public JsonRasterFormat {
        if (nameField == null || nameField.isBlank()) {
            throw new IllegalArgumentException("nameField must be non-empty");
        }
        if (valuesField == null || valuesField.isBlank()) {
            throw new IllegalArgumentException("valuesField must be non-empty");
        }
        if (nameField.equals(valuesField)) {
            throw new IllegalArgumentException("nameField and valuesField must differ");
        }
    }
}
