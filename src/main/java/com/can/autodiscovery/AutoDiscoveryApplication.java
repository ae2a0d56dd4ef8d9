package com.can.autodiscovery;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;

/**
 * Quarkus giriş noktası. Ana thread'i runtime üzerinde tutar; önbellek ve
 * REST kaynağı CDI tarafından ayağa kaldırılır.
 */
@QuarkusMain
public class AutoDiscoveryApplication implements QuarkusApplication
{
    @Override
    public int run(String... args)
    {
        Quarkus.waitForExit();
        return 0;
    }

    public static void main(String... args) {
        Quarkus.run(AutoDiscoveryApplication.class, args);
    }
}
