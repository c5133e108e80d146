package com.rms.relay.nats.local;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * How text in bus payloads is turned into characters and back.
 *
 * <ul>
 *   <li>{@link #UTF8_STRICT}: malformed UTF-8 fails the message.</li>
 *   <li>{@link #UTF8_REPLACE}: malformed sequences become U+FFFD.</li>
 *   <li>{@link #LATIN1}: bytes map 1:1 to ISO-8859-1 characters; unmappable
 *       characters are replaced on the way out.</li>
 * </ul>
 */
public enum TextEncodingPolicy {

    UTF8_STRICT(StandardCharsets.UTF_8, CodingErrorAction.REPORT),
    UTF8_REPLACE(StandardCharsets.UTF_8, CodingErrorAction.REPLACE),
    LATIN1(StandardCharsets.ISO_8859_1, CodingErrorAction.REPLACE);

    private final Charset charset;
    private final CodingErrorAction onError;

    TextEncodingPolicy(Charset charset, CodingErrorAction onError) {
        this.charset = charset;
        this.onError = onError;
    }

    public String decode(byte[] bytes) throws CharacterCodingException {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(onError)
                .onUnmappableCharacter(onError);
        CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes == null ? new byte[0] : bytes));
        return chars.toString();
    }

    public byte[] encode(String text) {
        return text.getBytes(charset);
    }
}
