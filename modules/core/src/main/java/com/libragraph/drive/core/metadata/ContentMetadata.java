package com.libragraph.drive.core.metadata;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.libragraph.drive.types.ContentCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed, per-category attributes extracted by background processing.
 * {@link Opaque} carries attributes no variant models.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ContentMetadata.Image.class, name = "image"),
        @JsonSubTypes.Type(value = ContentMetadata.Video.class, name = "video"),
        @JsonSubTypes.Type(value = ContentMetadata.Document.class, name = "document"),
        @JsonSubTypes.Type(value = ContentMetadata.Opaque.class, name = "opaque")
})
public sealed interface ContentMetadata {

    ContentCategory category();

    record Image(int width, int height, String format) implements ContentMetadata {
        @Override
        public ContentCategory category() {
            return ContentCategory.IMAGE;
        }
    }

    record Video(double durationSeconds, String codec, int width, int height) implements ContentMetadata {
        @Override
        public ContentCategory category() {
            return ContentCategory.VIDEO;
        }
    }

    record Document(int pageCount, String author) implements ContentMetadata {
        @Override
        public ContentCategory category() {
            return ContentCategory.DOCUMENT;
        }
    }

    record Opaque(Map<String, Object> attributes) implements ContentMetadata {
        public Opaque {
            attributes = attributes == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        @Override
        public ContentCategory category() {
            return ContentCategory.OTHER;
        }
    }
}
