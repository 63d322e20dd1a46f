package com.counter.service;

/** Dönen sayacın nereden geldiğini belirtir. */
public enum Source
{
    /** Süresi dolmamış önbellek kaydı. */
    CACHE,
    /** Depolamadaki değer, üzerine eklenmiş bekleyen artışla birlikte. */
    STORAGE,
    /** Depolamada kayıt yok; değer yalnızca henüz yazılmamış artışlardan oluşuyor. */
    BUFFER
}
