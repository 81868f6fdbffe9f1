package com.libragraph.drive.core.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.drive.types.ContentCategory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Map;

/**
 * JSON form of {@link ContentMetadata} as stored in {@code file_record.metadata}.
 */
@ApplicationScoped
public class MetadataCodec {

    private final ObjectMapper objectMapper;

    @Inject
    public MetadataCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ContentMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode metadata " + metadata, e);
        }
    }

    public ContentMetadata decode(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ContentMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed metadata: " + json, e);
        }
    }

    /**
     * Builds the typed variant for a category from loose key/value attributes
     * (e.g. {@code width}, {@code height}, {@code format} for images). Anything that
     * does not fit the category's variant is kept as {@link ContentMetadata.Opaque}.
     */
    public ContentMetadata fromAttributes(ContentCategory category, Map<String, Object> attributes) {
        try {
            switch (category) {
                case IMAGE:
                    return new ContentMetadata.Image(
                            intValue(attributes, "width"),
                            intValue(attributes, "height"),
                            stringValue(attributes, "format"));
                case VIDEO:
                    return new ContentMetadata.Video(
                            ((Number) required(attributes, "duration")).doubleValue(),
                            stringValue(attributes, "codec"),
                            intValue(attributes, "width"),
                            intValue(attributes, "height"));
                case DOCUMENT:
                    return new ContentMetadata.Document(
                            intValue(attributes, "pages"),
                            stringValue(attributes, "author"));
                default:
                    return new ContentMetadata.Opaque(attributes);
            }
        } catch (ClassCastException | IllegalArgumentException e) {
            return new ContentMetadata.Opaque(attributes);
        }
    }

    private static Object required(Map<String, Object> attributes, String key) {
        Object value = attributes.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing attribute: " + key);
        }
        return value;
    }

    private static int intValue(Map<String, Object> attributes, String key) {
        return ((Number) required(attributes, key)).intValue();
    }

    private static String stringValue(Map<String, Object> attributes, String key) {
        Object value = attributes.get(key);
        return value == null ? null : value.toString();
    }
}
