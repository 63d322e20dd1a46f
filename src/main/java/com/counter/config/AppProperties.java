package com.counter.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;
import java.util.Optional;

/**
 * Uygulama yapılandırma değerlerini tip güvenli bir şekilde okumak için kullanılan
 * konfigürasyon arayüzüdür. Depolama düğümlerinin adresleri ve bağlantı süreleri,
 * sanal düğüm sayısı, önbellek TTL/kapasitesi, toplu yazma aralığı ile tampon
 * sınırı ve metrik raporlama sıklığı {@code application.properties} içindeki
 * "app" önekiyle başlayan değerlerden okunur.
 */
@ConfigMapping(prefix = "app")
public interface AppProperties
{
    Storage storage();
    Cache cache();
    Batch batch();
    Metrics metrics();
    Worker worker();

    interface Storage {
        List<String> nodes();

        Optional<String> password();

        @WithDefault("-1")
        int database();

        @WithDefault("100")
        int virtualNodes();

        @WithDefault("2000")
        int connectTimeoutMillis();

        @WithDefault("5000")
        long requestTimeoutMillis();

        @WithDefault("3")
        int retryAttempts();

        @WithDefault("100")
        long retryBackoffMillis();

        @WithDefault("30")
        long healthCheckIntervalSeconds();

        @WithDefault("visits:")
        String keyPrefix();
    }

    interface Cache {
        @WithDefault("5")
        long ttlSeconds();

        @WithDefault("1000")
        int capacity();

        @WithDefault("8")
        int segments();

        @WithDefault("100")
        long cleanerPollMillis();
    }

    interface Batch {
        @WithDefault("5000")
        long intervalMillis();

        @WithDefault("1000")
        int sizeLimit();

        @WithDefault("5000")
        long shutdownGraceMillis();
    }

    interface Metrics {
        @WithDefault("60")
        long reportIntervalSeconds();
    }

    interface Worker {
        @WithDefault("8")
        int poolSize();
    }
}
