package com.counter.constants;

public interface RespProtocol
{
    // '+' yanıtı, basit metin (ör. OK, PONG) döndüğünü belirtir.
    byte SIMPLE_STRING = '+';

    // '-' yanıtı, sunucunun komutu hata ile reddettiğini bildirir.
    byte ERROR = '-';

    // ':' yanıtı, INCRBY ve DEL gibi komutların tamsayı sonucunu taşır.
    byte INTEGER = ':';

    // '$' yanıtı, uzunluk önekli bir bulk string gelir; -1 uzunluk anahtarın olmadığını gösterir.
    byte BULK_STRING = '$';

    // '*' önekiyle komutlar bulk string dizisi olarak gönderilir.
    byte ARRAY = '*';

    byte CR = '\r';

    byte LF = '\n';

    String CMD_INCRBY = "INCRBY";

    String CMD_GET = "GET";

    String CMD_DEL = "DEL";

    String CMD_PING = "PING";

    String CMD_AUTH = "AUTH";

    String CMD_SELECT = "SELECT";
}
