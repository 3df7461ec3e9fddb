package com.datainsight.infrastructure.analysis.preprocessing;

import com.datainsight.domain.analysis.exception.InvalidInputException;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decodes uploaded bytes as strict UTF-8.
 */
@Component
public class ContentDecoder {

    private static final char BOM = '\uFEFF';

    public String decode(byte[] content) {
        if (content == null || content.length == 0) {
            throw new InvalidInputException("Content must not be empty");
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = decoder.decode(ByteBuffer.wrap(content)).toString();
            if (!text.isEmpty() && text.charAt(0) == BOM) {
                text = text.substring(1);
            }
            return text;
        } catch (CharacterCodingException e) {
            throw new InvalidInputException("Content is not valid UTF-8 text", e);
        }
    }
}
