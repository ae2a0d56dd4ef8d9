package com.can.autodiscovery.codec;

import java.nio.charset.StandardCharsets;

/**
 * Anahtar ve değerleri UTF-8 ile kodlayan codec. Null değerler boş diziye
 * dönüşür.
 */
public final class StringCodec implements Codec<String>
{
    public static final StringCodec UTF8 = new StringCodec();
    private StringCodec(){}

    @Override
    public byte[] encode(String obj) {
        return obj == null ? new byte[0] : obj.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String decode(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
