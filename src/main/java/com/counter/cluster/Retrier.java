package com.counter.cluster;

import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Depolama ilkel işlemlerini sınırlı sayıda deneme ile çalıştıran küçük yardımcı
 * sınıftır. Yalnızca {@link StorageNodeException} yeniden denenir; her başarısız
 * denemeden sonra {@code backoff × deneme} kadar beklenir ve son denemenin hatası
 * çağırana aynen fırlatılır. Diğer hatalar ilk denemede olduğu gibi yükselir.
 * get, increment ve reset aynı yeniden deneme mantığını paylaşır.
 */
public final class Retrier
{
    private static final Logger LOG = Logger.getLogger(Retrier.class);

    private final int maxAttempts;
    private final long backoffMillis;
    private final Sleeper sleeper;

    public Retrier(int maxAttempts, long backoffMillis)
    {
        this(maxAttempts, backoffMillis, Thread::sleep);
    }

    public Retrier(int maxAttempts, long backoffMillis, Sleeper sleeper)
    {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMillis = Math.max(0L, backoffMillis);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public <T> T call(String description, Supplier<T> operation)
    {
        StorageNodeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.get();
            } catch (StorageNodeException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                LOG.debugf(e, "Attempt %d/%d of %s failed", attempt, maxAttempts, description);
                if (!pause(backoffMillis * attempt)) {
                    break;
                }
            }
        }
        LOG.debugf("Giving up on %s after %d attempts", description, maxAttempts);
        throw last;
    }

    public void run(String description, Runnable operation)
    {
        call(description, () -> {
            operation.run();
            return null;
        });
    }

    public int maxAttempts()
    {
        return maxAttempts;
    }

    private boolean pause(long millis)
    {
        if (millis <= 0L) {
            return true;
        }
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Denemeler arasındaki beklemeyi soyutlar; testlerde sahte uyku verilebilir. */
    @FunctionalInterface
    public interface Sleeper
    {
        void sleep(long millis) throws InterruptedException;
    }
}
