package com.wlru.core.model;

/**
 * {@code put} çağrısının sonucunu temsil eder. Reddedilen yazmalarda önbellek
 * hiç değişmeden kalır; hata istisna olarak fırlatılmaz, çağırana döndürülür.
 */
public enum PutResult
{
    /** Girdi saklandı; gerekiyorsa eski değer ve LRU girdileri çıkarıldı. */
    STORED,
    /** Ağırlık sıfır veya negatif. */
    INVALID_WEIGHT,
    /** Ağırlık önbelleğin toplam kapasitesinden büyük. */
    WEIGHT_EXCEEDS_CAPACITY;

    public boolean isStored()
    {
        return this == STORED;
    }
}
