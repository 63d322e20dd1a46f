package com.counter.cluster;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Tutarlı hash halkasında anahtarları ve sanal düğüm konumlarını aynı sayısal
 * uzaya yerleştirmek için kullanılan fonksiyonun sözleşmesidir. Halka, hem
 * anahtar hem de "düğüm-id:replika-indeksi" baytlarını aynı fonksiyonla
 * imzaladığı için yönlendirme deterministik kalır.
 */
@FunctionalInterface
public interface HashFn
{
    int hash(byte[] keyBytes);

    /**
     * MD5 özetinin ilk dört baytını büyük-endian tamsayıya çevirir. Yakın
     * anahtarlar (page1, page2, ...) halka üzerinde birbirinden uzağa düşer.
     */
    HashFn MD5 = keyBytes -> {
        byte[] digest = md5().digest(keyBytes);
        return ((digest[0] & 0xff) << 24)
                | ((digest[1] & 0xff) << 16)
                | ((digest[2] & 0xff) << 8)
                | (digest[3] & 0xff);
    };

    private static MessageDigest md5()
    {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest is not available", e);
        }
    }
}
