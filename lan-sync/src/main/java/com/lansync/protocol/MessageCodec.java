package com.lansync.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Turns messages into single JSON records and back.
 *
 * Framing is not done here: the connection pipeline splits the stream on newlines and
 * hands this class one record at a time. Jackson never emits raw newlines in compact
 * output (they are escaped inside strings), so an encoded record is always one line.
 *
 * Validation happens once, at decode time:
 * - the {@code type} discriminant must be present and known
 * - required fields must be present
 * - primitives must already have the right JSON type ("5" is not an int, 1.5 is not an int)
 * Unknown fields are ignored so newer peers can add fields.
 *
 * The codec is thread-safe - ObjectMapper is thread-safe after configuration.
 */
public class MessageCodec {

    private final ObjectMapper objectMapper;

    public MessageCodec() {
        this.objectMapper = JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .build();
    }

    /**
     * Serializes a message to one JSON record, without the trailing newline.
     *
     * @param message The message to serialize
     * @return JSON text
     */
    public String encode(Message message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            // Every message type is a plain immutable bean; failing here is a programming error.
            throw new IllegalStateException("Failed to serialize " + message.getType(), e);
        }
    }

    /**
     * Parses and validates one JSON record.
     *
     * @param line One record, without its newline
     * @return The decoded message
     * @throws MalformedMessageException if the record is not valid JSON, has a missing or
     *         unknown type, or misses or mistypes a required field
     */
    public Message decode(String line) throws MalformedMessageException {
        if (line == null || line.isBlank()) {
            throw new MalformedMessageException("Empty record");
        }
        try {
            return objectMapper.readValue(line, Message.class);
        } catch (InvalidTypeIdException e) {
            throw new MalformedMessageException("Unknown or missing message type: " + e.getTypeId(), e);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Invalid record: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Creates a new JSON object node for building opaque blobs (lobby settings, level data).
     */
    public ObjectNode createObjectNode() {
        return objectMapper.createObjectNode();
    }

    /**
     * Gets the underlying ObjectMapper for advanced operations.
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
