package com.wlru.core;

import com.wlru.codec.Codec;

import java.util.Locale;

/**
 * Yapılandırmadan seçilebilen hazır ağırlık hesaplayıcıları.
 */
public enum WeigherType
{
    /** Every entry weighs one unit, so capacity bounds the entry count. */
    ENTRY_COUNT {
        @Override
        public <K,V> Weigher<K,V> create(Codec<K> keyCodec, Codec<V> valueCodec)
        {
            return (key, value) -> 1L;
        }
    },
    /** Encoded key plus encoded value length in bytes, never less than one. */
    UTF8_BYTES {
        @Override
        public <K,V> Weigher<K,V> create(Codec<K> keyCodec, Codec<V> valueCodec)
        {
            return (key, value) -> Math.max(1L,
                    (long) keyCodec.encodedLength(key) + valueCodec.encodedLength(value));
        }
    };

    public abstract <K,V> Weigher<K,V> create(Codec<K> keyCodec, Codec<V> valueCodec);

    public static WeigherType fromConfig(String value)
    {
        if (value == null || value.isBlank()) return ENTRY_COUNT;
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return WeigherType.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown weigher: " + value, ex);
        }
    }
}
