package com.wlru.core;

/**
 * Girdileri anahtar, değer ve ağırlık üçlüsü olarak tüketen fonksiyonel arayüzdür.
 */
@FunctionalInterface
public interface EntryConsumer<K,V>
{
    void accept(K key, V value, long weight);
}
