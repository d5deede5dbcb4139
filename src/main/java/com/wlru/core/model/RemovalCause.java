package com.wlru.core.model;

/**
 * Bir girdinin önbellekten neden ayrıldığını belirtir.
 */
public enum RemovalCause
{
    /** {@code remove} ile açıkça silindi. */
    EXPLICIT,
    /** Aynı anahtara yapılan yeni bir {@code put} tarafından değiştirildi. */
    REPLACED,
    /** Yeni bir girdiye yer açmak için en eski erişilen girdi olarak çıkarıldı. */
    EVICTED
}
