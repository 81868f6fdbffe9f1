package com.libragraph.drive.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ContentCategoryTest {

    @Test
    void shouldClassifyByMimePrefix() {
        assertThat(ContentCategory.fromMimeType("image/png")).isEqualTo(ContentCategory.IMAGE);
        assertThat(ContentCategory.fromMimeType("video/mp4")).isEqualTo(ContentCategory.VIDEO);
        assertThat(ContentCategory.fromMimeType("application/pdf")).isEqualTo(ContentCategory.DOCUMENT);
        assertThat(ContentCategory.fromMimeType("application/zip")).isEqualTo(ContentCategory.OTHER);
    }

    @Test
    void shouldIgnoreParametersAndCase() {
        assertThat(ContentCategory.fromMimeType("Text/Plain; charset=UTF-8"))
                .isEqualTo(ContentCategory.DOCUMENT);
    }

    @Test
    void shouldTreatMissingTypeAsOther() {
        assertThat(ContentCategory.fromMimeType(null)).isEqualTo(ContentCategory.OTHER);
        assertThat(ContentCategory.fromMimeType("  ")).isEqualTo(ContentCategory.OTHER);
    }

    @Test
    void shouldReportCompressibility() {
        assertThat(ContentCategory.IMAGE.compressible()).isTrue();
        assertThat(ContentCategory.DOCUMENT.compressible()).isTrue();
        assertThat(ContentCategory.VIDEO.compressible()).isFalse();
    }
}
