package com.can.autodiscovery.core;

/**
 * Önbellek arka ucunun yapılandırması geçersiz olduğunda, herhangi bir ağ
 * çağrısı yapılmadan önce fırlatılır. Birden fazla sunucu tanımı, hatalı
 * {@code host:port} biçimi veya tanınmayan istemci ayarları bu gruba girer.
 */
public class CacheConfigurationException extends RuntimeException
{
    public CacheConfigurationException(String message)
    {
        super(message);
    }

    public CacheConfigurationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
