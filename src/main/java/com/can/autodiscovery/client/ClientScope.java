package com.can.autodiscovery.client;

import com.can.autodiscovery.core.CacheConfigurationException;

import java.util.Locale;

/**
 * İstemci tutamacının nerede saklanacağını belirler: arka uç örneği başına
 * tek bir paylaşılan istemci ya da çağıran her thread için ayrı bir istemci.
 */
public enum ClientScope
{
    SHARED {
        @Override
        public ClientStorage createStorage()
        {
            return new ClientStorage.Shared();
        }
    },
    THREAD {
        @Override
        public ClientStorage createStorage()
        {
            return new ClientStorage.PerThread();
        }
    };

    public abstract ClientStorage createStorage();

    public static ClientScope fromConfig(String value)
    {
        if (value == null || value.isBlank()) return SHARED;
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ClientScope.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new CacheConfigurationException("Unknown client scope: " + value, ex);
        }
    }
}
