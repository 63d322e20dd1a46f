package com.counter.cluster.remote;

import com.counter.constants.RespProtocol;
import io.vertx.core.buffer.Buffer;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ReplyParserTest
{
    private static RespReply parse(String... chunks) throws IOException {
        ReplyParser parser = new ReplyParser();
        for (String chunk : chunks) {
            assertFalse(parser.completed());
            parser.handle(Buffer.buffer(chunk));
        }
        assertTrue(parser.completed());
        return parser.result();
    }

    // Bu test her yanıt türünün doğru ayrıştırıldığını doğrular.
    @Test
    void parsesEachReplyType() throws IOException {
        assertEquals(RespReply.simple("PONG"), parse("+PONG\r\n"));
        assertEquals(RespReply.integer(42L), parse(":42\r\n"));
        assertEquals(RespReply.bulk("17"), parse("$2\r\n17\r\n"));
        assertEquals(RespReply.bulk(null), parse("$-1\r\n"));
        assertTrue(parse("-ERR boom\r\n").isError());
    }

    // Bu test satır ve gövde parçalar halinde geldiğinde de çözümlemenin tamamlandığını gösterir.
    @Test
    void parsesFragmentedInput() throws IOException {
        assertEquals(RespReply.integer(-7L), parse(":-", "7\r", "\n"));
        assertEquals(RespReply.bulk("hello"), parse("$5\r\nhe", "llo", "\r\n"));
    }

    // Bu test desteklenmeyen ya da bozuk yanıtların hata verdiğini doğrular.
    @Test
    void rejectsUnsupportedInput() {
        assertThrows(IOException.class, () -> new ReplyParser().handle(Buffer.buffer("*1\r\n")));
        assertThrows(IOException.class, () -> new ReplyParser().handle(Buffer.buffer(":abc\r\n")));
        assertThrows(IOException.class, () -> new ReplyParser().handle(Buffer.buffer("$2\r\nabXY")));
    }

    // Bu test komutların bulk string dizisi olarak kodlandığını doğrular.
    @Test
    void encodesCommandAsArray() {
        Buffer encoded = RedisStorageNode.encode(RespProtocol.CMD_INCRBY, "visits:ş", "3");
        assertEquals("*3\r\n$6\r\nINCRBY\r\n$9\r\nvisits:ş\r\n$1\r\n3\r\n", encoded.toString());
    }
}
