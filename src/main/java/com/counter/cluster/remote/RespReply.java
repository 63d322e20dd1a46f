package com.counter.cluster.remote;

import com.counter.cluster.StorageNodeException;
import com.counter.constants.RespProtocol;

/**
 * Tek bir RESP2 yanıtını temsil eder. Tamsayı yanıtlarında değer {@code number}
 * alanında, metin ve hata yanıtlarında {@code text} alanında taşınır. Bulk
 * string yanıtında {@code text == null} anahtarın bulunmadığını gösterir.
 */
record RespReply(byte type, String text, long number)
{
    static RespReply simple(String text)
    {
        return new RespReply(RespProtocol.SIMPLE_STRING, text, 0L);
    }

    static RespReply error(String text)
    {
        return new RespReply(RespProtocol.ERROR, text, 0L);
    }

    static RespReply integer(long value)
    {
        return new RespReply(RespProtocol.INTEGER, null, value);
    }

    static RespReply bulk(String text)
    {
        return new RespReply(RespProtocol.BULK_STRING, text, 0L);
    }

    boolean isError()
    {
        return type == RespProtocol.ERROR;
    }

    long requireInteger(String command)
    {
        if (type != RespProtocol.INTEGER) {
            throw unexpected(command);
        }
        return number;
    }

    String requireBulk(String command)
    {
        if (type != RespProtocol.BULK_STRING) {
            throw unexpected(command);
        }
        return text;
    }

    String requireSimple(String command)
    {
        if (type != RespProtocol.SIMPLE_STRING) {
            throw unexpected(command);
        }
        return text;
    }

    private StorageNodeException unexpected(String command)
    {
        return new StorageNodeException("unexpected reply type '" + (char) type + "' to " + command);
    }
}
