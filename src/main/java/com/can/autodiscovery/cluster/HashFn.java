package com.can.autodiscovery.cluster;

/**
 * Anahtar baytlarını hash halkası üzerindeki konuma dönüştüren fonksiyon
 * sözleşmesi. Düğümler ve anahtarlar aynı fonksiyonla yerleştirilir.
 */
@FunctionalInterface
public interface HashFn
{
    int hash(byte[] keyBytes);
}
