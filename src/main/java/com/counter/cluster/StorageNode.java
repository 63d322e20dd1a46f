package com.counter.cluster;

/**
 * Bir depolama düğümünün sayaç katmanına sunması gereken ilkel işlemleri tarif
 * eder: atomik artırma, nokta okuma, silme ve hafif bir canlılık yoklaması.
 * Uygulamalar hata durumunda {@link StorageNodeException} fırlatır; yeniden deneme
 * ve sağlık takibi {@link ShardRegistry} tarafından yapılır.
 */
public interface StorageNode extends AutoCloseable
{
    long incrementBy(String key, long delta);

    /** Anahtar hiç yazılmadıysa {@code null}. */
    Long get(String key);

    boolean delete(String key);

    void ping();

    String id();

    String address();

    @Override
    default void close() {
    }
}
