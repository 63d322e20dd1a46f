package com.counter.cluster;

/**
 * Halka boş olduğunda ya da hiç depolama düğümü yapılandırılmadığında fırlatılır.
 * Başlangıçta ölümcül kabul edilir ve yeniden denenmez.
 */
public final class NoAvailableNodeException extends IllegalStateException
{
    public NoAvailableNodeException(String message)
    {
        super(message);
    }
}
