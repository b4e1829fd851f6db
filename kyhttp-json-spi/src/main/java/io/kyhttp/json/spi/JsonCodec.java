package io.kyhttp.json.spi;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Encoding must write non-ASCII characters and forward slashes unescaped.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array (UTF-8).
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to a typed object. With {@code Object.class} the
     * result is the generic structure: maps, lists, strings, numbers, booleans
     * or null.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if the data is not valid JSON for the type
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON string to an object of the specified type.
     * @param json JSON string
     * @param type target class
     * @return deserialized object
     * @throws JsonException if the data is not valid JSON for the type
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;
}
