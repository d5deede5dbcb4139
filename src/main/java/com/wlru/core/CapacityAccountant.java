package com.wlru.core;

/**
 * Toplam ağırlığı sabit kapasiteye karşı izleyen defter. Kendi hata yolu yoktur;
 * çağıranlar {@link #admit(long)} öncesinde {@link #wouldExceed(long)} ile yer
 * olup olmadığını kontrol eder.
 */
final class CapacityAccountant
{
    private final long capacity;
    private long currentWeight;

    CapacityAccountant(long capacity)
    {
        this.capacity = capacity;
    }

    void admit(long weight)
    {
        currentWeight += weight;
    }

    void release(long weight)
    {
        currentWeight -= weight;
    }

    // capacity - currentWeight never underflows while currentWeight <= capacity
    boolean wouldExceed(long weight)
    {
        return weight > capacity - currentWeight;
    }

    long capacity()
    {
        return capacity;
    }

    long currentWeight()
    {
        return currentWeight;
    }

    void reset()
    {
        currentWeight = 0L;
    }
}
