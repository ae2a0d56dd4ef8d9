package com.can.autodiscovery.cluster;

import java.util.Locale;

/**
 * İstemci ayarlarıyla seçilebilen hash fonksiyonları.
 */
public enum HashAlgorithm implements HashFn
{
    FNV1A_32 {
        @Override
        public int hash(byte[] keyBytes)
        {
            int hash = 0x811c9dc5;
            for (byte b : keyBytes) {
                hash ^= (b & 0xff);
                hash *= 0x01000193;
            }
            return hash;
        }
    },
    CRC32 {
        @Override
        public int hash(byte[] keyBytes)
        {
            java.util.zip.CRC32 crc = new java.util.zip.CRC32();
            crc.update(keyBytes);
            return (int) crc.getValue();
        }
    };

    public static HashAlgorithm fromConfig(String value)
    {
        if (value == null || value.isBlank()) return FNV1A_32;
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return HashAlgorithm.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown hash algorithm: " + value, ex);
        }
    }
}
