package com.counter.cluster.remote;

import com.counter.constants.RespProtocol;
import io.vertx.core.buffer.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Parça parça gelen soket verisinden tek bir RESP2 yanıtı çözer. Dizi yanıtları
 * bu düğümün gönderdiği komutlarda beklenmediği için desteklenmez.
 */
final class ReplyParser
{
    private enum State { TYPE, LINE, BULK }

    private final ByteBufferReader reader = new ByteBufferReader();
    private State state = State.TYPE;
    private byte type;
    private int bulkLength;
    private boolean complete;
    private RespReply result;

    void handle(Buffer buffer) throws IOException
    {
        reader.append(buffer);
        parse();
    }

    boolean completed()
    {
        return complete;
    }

    RespReply result()
    {
        return result;
    }

    private void parse() throws IOException
    {
        while (!complete) {
            switch (state) {
                case TYPE -> {
                    if (!reader.has(1)) {
                        return;
                    }
                    type = reader.readByte();
                    if (type != RespProtocol.SIMPLE_STRING && type != RespProtocol.ERROR
                            && type != RespProtocol.INTEGER && type != RespProtocol.BULK_STRING) {
                        throw new IOException("unsupported reply type: " + (char) type);
                    }
                    state = State.LINE;
                }
                case LINE -> {
                    String line = reader.readLine();
                    if (line == null) {
                        return;
                    }
                    if (type == RespProtocol.SIMPLE_STRING) {
                        finish(RespReply.simple(line));
                    } else if (type == RespProtocol.ERROR) {
                        finish(RespReply.error(line));
                    } else if (type == RespProtocol.INTEGER) {
                        finish(RespReply.integer(parseLong(line)));
                    } else {
                        bulkLength = (int) parseLong(line);
                        if (bulkLength < 0) {
                            finish(RespReply.bulk(null));
                        } else {
                            state = State.BULK;
                        }
                    }
                }
                case BULK -> {
                    if (!reader.has(bulkLength + 2)) {
                        return;
                    }
                    byte[] data = reader.readBytes(bulkLength);
                    if (reader.readByte() != RespProtocol.CR || reader.readByte() != RespProtocol.LF) {
                        throw new IOException("bulk string not terminated by CRLF");
                    }
                    finish(RespReply.bulk(new String(data, StandardCharsets.UTF_8)));
                }
            }
        }
    }

    private void finish(RespReply reply)
    {
        result = reply;
        complete = true;
    }

    private static long parseLong(String line) throws IOException
    {
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new IOException("malformed number in reply: " + line, e);
        }
    }

    private static final class ByteBufferReader
    {
        private final Buffer buffer = Buffer.buffer();
        private int readIndex;

        void append(Buffer chunk)
        {
            buffer.appendBuffer(chunk);
        }

        boolean has(int bytes)
        {
            return buffer.length() - readIndex >= bytes;
        }

        byte readByte()
        {
            byte value = buffer.getByte(readIndex);
            readIndex += 1;
            return value;
        }

        byte[] readBytes(int length)
        {
            byte[] data = buffer.getBytes(readIndex, readIndex + length);
            readIndex += length;
            return data;
        }

        /** CRLF ile biten satırı döndürür; satır henüz tamamlanmadıysa {@code null}. */
        String readLine()
        {
            for (int i = readIndex; i + 1 < buffer.length(); i++) {
                if (buffer.getByte(i) == RespProtocol.CR && buffer.getByte(i + 1) == RespProtocol.LF) {
                    String line = buffer.getString(readIndex, i, StandardCharsets.UTF_8.name());
                    readIndex = i + 2;
                    return line;
                }
            }
            return null;
        }
    }
}
