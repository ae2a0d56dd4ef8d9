package com.can.autodiscovery.codec;

/**
 * Anahtarların hash halkasına yerleştirilmek ve tel protokolüne yazılmak için
 * bayt dizisine dönüştürülmesini sağlayan kodlayıcı sözleşmesidir.
 */
public interface Codec<T>
{
    byte[] encode(T obj);
    T decode(byte[] bytes);
}
