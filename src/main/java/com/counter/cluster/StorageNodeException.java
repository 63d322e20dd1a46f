package com.counter.cluster;

/**
 * Tek bir depolama çağrısının başarısız olduğunu bildirir. Yeniden deneme
 * bütçesi içinde kalan hatalar bu türdedir; bütçe tükendiğinde çağırana
 * {@link StorageUnavailableException} olarak yansır.
 */
public class StorageNodeException extends RuntimeException
{
    public StorageNodeException(String message)
    {
        super(message);
    }

    public StorageNodeException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
