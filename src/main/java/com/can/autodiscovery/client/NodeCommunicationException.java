package com.can.autodiscovery.client;

/**
 * Bir önbellek düğümüyle konuşurken oluşan taşıma veya protokol hatası.
 */
public class NodeCommunicationException extends IllegalStateException
{
    public NodeCommunicationException(String message)
    {
        super(message);
    }

    public NodeCommunicationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
