package com.wlru.core;

/**
 * Önbelleğin iç tutarlılığı bozulduğunda fırlatılır. Doğru çalışan bir
 * önbellekte hiçbir zaman görülmemesi gerekir; yakalanıp devam edilmemelidir.
 */
public class CacheCorruptionException extends IllegalStateException
{
    public CacheCorruptionException(String message)
    {
        super(message);
    }
}
