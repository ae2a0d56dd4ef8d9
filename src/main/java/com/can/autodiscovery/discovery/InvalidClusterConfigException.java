package com.can.autodiscovery.discovery;

/**
 * Yapılandırma uç noktasının yanıtı beklenen biçimde olmadığında fırlatılır.
 */
public class InvalidClusterConfigException extends IllegalStateException
{
    public InvalidClusterConfigException(String message)
    {
        super(message);
    }

    public InvalidClusterConfigException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
