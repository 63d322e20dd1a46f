package com.counter;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;

/**
 * Quarkus uygulaması için giriş noktasıdır. Ana thread'i Quarkus runtime üzerinde
 * tutarak HTTP yüzeyinin ve arka plan zamanlayıcılarının ayakta kalmasını sağlar.
 */
@QuarkusMain
public class CounterApplication implements QuarkusApplication
{
    @Override
    public int run(String... args)
    {
        Quarkus.waitForExit();
        return 0;
    }

    public static void main(String... args) {
        Quarkus.run(CounterApplication.class, args);
    }
}
