package com.wlru.codec;

/**
 * Anahtar ve değerlerin bayt karşılığını üreten kodlayıcı sözleşmesidir.
 * Önbellekte girdinin kapladığı yer, kodlanmış hâlinin uzunluğundan hesaplanabilir.
 */
public interface Codec<T>
{
    byte[] encode(T obj);
    T decode(byte[] bytes);

    /** Length of the encoded form; codecs that know it cheaply may override. */
    default int encodedLength(T obj)
    {
        return encode(obj).length;
    }
}
