package org.forcecom.restapi.rest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;

/**
 * Best-effort conversion of decoded UTF-8 field text into a target charset.
 * <p>
 * A value that cannot be represented in the target charset is returned unchanged
 * and a warning is logged; conversion never fails the page being decoded.
 * </p>
 */
public class FieldTextNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(FieldTextNormalizer.class);

    private final Charset targetCharset;

    /**
     * @param targetCharset Charset field values must be representable in
     * @throws IllegalArgumentException If the charset does not support encoding
     */
    public FieldTextNormalizer(Charset targetCharset) {
        if (!targetCharset.canEncode()) {
            throw new IllegalArgumentException("Charset " + targetCharset + " does not support encoding");
        }
        this.targetCharset = targetCharset;
    }

    public Charset getTargetCharset() {
        return targetCharset;
    }

    /**
     * Round-trips a value through the target charset.
     *
     * @param fieldName Field the value belongs to, used for the warning only
     * @param value     Decoded value, may be null
     * @return The converted value, or {@code value} itself if it cannot be converted
     */
    public String normalize(String fieldName, String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        try {
            ByteBuffer encoded = targetCharset.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(value));
            return targetCharset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(encoded)
                    .toString();
        } catch (CharacterCodingException e) {
            logger.warn("Value of field '{}' cannot be represented in {}, keeping it unconverted: {}",
                    fieldName, targetCharset, e.toString());
            return value;
        }
    }
}
