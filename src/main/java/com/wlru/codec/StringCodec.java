package com.wlru.codec;

import java.nio.charset.StandardCharsets;

/**
 * {@link String} değerlerini UTF-8 ile kodlayan codec. Null değer boş diziye,
 * boş dizi boş string'e dönüşür.
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

    @Override
    public int encodedLength(String obj) {
        if (obj == null) return 0;
        int length = 0;
        for (int i = 0; i < obj.length(); i++) {
            char c = obj.charAt(i);
            if (c < 0x80) {
                length += 1;
            } else if (c < 0x800) {
                length += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < obj.length()
                    && Character.isLowSurrogate(obj.charAt(i + 1))) {
                length += 4;
                i++;
            } else {
                // lone surrogates are replaced by '?' when encoded
                length += Character.isSurrogate(c) ? 1 : 3;
            }
        }
        return length;
    }
}
