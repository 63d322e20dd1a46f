package com.counter.cluster;

/**
 * Anahtarın sahibi olan düğüme yeniden denemelere rağmen ulaşılamadığını ya da
 * düğümün sağlıksız işaretlendiğini bildirir. Sağlık yoklaması düğümü geri
 * getirene kadar aynı anahtar için aynı hata döner.
 */
public final class StorageUnavailableException extends RuntimeException
{
    private final String nodeId;

    public StorageUnavailableException(String nodeId, String message)
    {
        super(message);
        this.nodeId = nodeId;
    }

    public StorageUnavailableException(String nodeId, String message, Throwable cause)
    {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public String nodeId()
    {
        return nodeId;
    }
}
