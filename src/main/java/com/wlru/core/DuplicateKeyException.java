package com.wlru.core;

/**
 * Thrown by {@link EntryStore#insert(Object, int)} when the key is already indexed.
 */
public class DuplicateKeyException extends CacheCorruptionException
{
    public DuplicateKeyException(Object key)
    {
        super("Key already present in entry store: " + key);
    }
}
