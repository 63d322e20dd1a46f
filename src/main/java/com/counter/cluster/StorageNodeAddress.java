package com.counter.cluster;

import java.util.Locale;
import java.util.Objects;

/**
 * Yapılandırmadaki depolama düğümü adresini temsil eder. Desteklenen biçimler
 * {@code redis://host:port[/db]} ve {@code mem://isim} şeklindedir; hatalı bir
 * adres uygulama başlarken reddedilir.
 *
 * @param database yalnızca redis adreslerinde anlamlıdır, belirtilmezse -1
 */
public record StorageNodeAddress(String scheme, String host, int port, int database)
{
    public static final String REDIS_SCHEME = "redis";
    public static final String MEMORY_SCHEME = "mem";
    private static final int DEFAULT_REDIS_PORT = 6379;

    public StorageNodeAddress {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
    }

    public static StorageNodeAddress parse(String raw)
    {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Storage node address must not be blank");
        }
        String value = raw.trim();
        int schemeEnd = value.indexOf("://");
        if (schemeEnd <= 0) {
            throw new IllegalArgumentException("Invalid storage node address: " + raw);
        }
        String scheme = value.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
        String rest = value.substring(schemeEnd + 3);
        if (rest.isEmpty()) {
            throw new IllegalArgumentException("Invalid storage node address: " + raw);
        }

        switch (scheme) {
            case MEMORY_SCHEME:
                return new StorageNodeAddress(MEMORY_SCHEME, rest, -1, -1);
            case REDIS_SCHEME:
                return parseRedis(raw, rest);
            default:
                throw new IllegalArgumentException("Unsupported storage node scheme '" + scheme + "' in " + raw);
        }
    }

    private static StorageNodeAddress parseRedis(String raw, String rest)
    {
        int database = -1;
        int slash = rest.indexOf('/');
        if (slash >= 0) {
            String db = rest.substring(slash + 1);
            rest = rest.substring(0, slash);
            if (!db.isEmpty()) {
                database = parseNumber(db, raw);
            }
        }
        String host = rest;
        int port = DEFAULT_REDIS_PORT;
        int colon = rest.lastIndexOf(':');
        if (colon >= 0) {
            host = rest.substring(0, colon);
            port = parseNumber(rest.substring(colon + 1), raw);
        }
        if (host.isEmpty() || port <= 0 || port > 65_535) {
            throw new IllegalArgumentException("Invalid storage node address: " + raw);
        }
        return new StorageNodeAddress(REDIS_SCHEME, host, port, database);
    }

    private static int parseNumber(String text, String raw)
    {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid storage node address: " + raw, e);
        }
    }

    public boolean inMemory()
    {
        return MEMORY_SCHEME.equals(scheme);
    }

    /** Halka ve sağlık tablosunda kullanılan düğüm kimliği. */
    public String nodeId()
    {
        return inMemory() ? host : host + ':' + port;
    }

    @Override
    public String toString()
    {
        if (inMemory()) {
            return MEMORY_SCHEME + "://" + host;
        }
        return REDIS_SCHEME + "://" + host + ':' + port + (database >= 0 ? "/" + database : "");
    }
}
