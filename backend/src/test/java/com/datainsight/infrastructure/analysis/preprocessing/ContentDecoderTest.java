package com.datainsight.infrastructure.analysis.preprocessing;

import com.datainsight.domain.analysis.exception.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentDecoderTest {

    private final ContentDecoder decoder = new ContentDecoder();

    @Test
    @DisplayName("Valid UTF-8 is decoded unchanged")
    void decodes_utf8() {
        String text = "caf\u00E9, na\u00EFve";
        assertThat(decoder.decode(text.getBytes(StandardCharsets.UTF_8))).isEqualTo(text);
    }

    @Test
    @DisplayName("A leading byte order mark is dropped")
    void strips_bom() {
        byte[] bytes = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'a', ',', 'b'};
        assertThat(decoder.decode(bytes)).isEqualTo("a,b");
    }

    @Test
    @DisplayName("Malformed UTF-8 is invalid input")
    void malformed() {
        byte[] bytes = {(byte) 0xC3, (byte) 0x28};
        assertThatThrownBy(() -> decoder.decode(bytes))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("UTF-8");
    }

    @Test
    @DisplayName("Empty or missing content is invalid input")
    void empty() {
        assertThatThrownBy(() -> decoder.decode(new byte[0])).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> decoder.decode(null)).isInstanceOf(InvalidInputException.class);
    }
}
