package io.meshgraph.decode;

import io.meshgraph.config.ConfigurationException;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AES-CTR channel decryption. Keys are configured per channel id as base64; a one-byte
 * key {@code n} selects the well-known default PSK with its last byte bumped by
 * {@code n - 1}, and a zero-byte key disables encryption for the channel.
 */
public final class ChannelDecryptor {
    public static final String DEFAULT_KEY = "AQ==";
    private static final byte[] DEFAULT_PSK = {
            (byte) 0xd4, (byte) 0xf1, (byte) 0xbb, (byte) 0x3a,
            (byte) 0x20, (byte) 0x29, (byte) 0x07, (byte) 0x59,
            (byte) 0xf0, (byte) 0xbc, (byte) 0xff, (byte) 0xab,
            (byte) 0xcf, (byte) 0x4e, (byte) 0x69, (byte) 0x01
    };

    private final Map<String, SecretKeySpec> channelKeys;
    private final SecretKeySpec defaultKey;

    public ChannelDecryptor(Map<String, String> configured) {
        this.channelKeys = new LinkedHashMap<>();
        if (configured != null) {
            for (Map.Entry<String, String> e : configured.entrySet()) {
                SecretKeySpec key = toKey(e.getKey(), e.getValue());
                if (key != null) {
                    channelKeys.put(e.getKey(), key);
                }
            }
        }
        this.defaultKey = toKey("default", DEFAULT_KEY);
    }

    public static ChannelDecryptor defaults() {
        return new ChannelDecryptor(Map.of());
    }

    /**
     * Keys to try for a channel, most specific first.
     */
    public List<SecretKeySpec> candidates(String channelId) {
        List<SecretKeySpec> out = new ArrayList<>(2);
        SecretKeySpec specific = channelId == null ? null : channelKeys.get(channelId);
        if (specific != null) {
            out.add(specific);
        }
        if (specific == null || !Arrays.equals(specific.getEncoded(), defaultKey.getEncoded())) {
            out.add(defaultKey);
        }
        return out;
    }

    public byte[] decrypt(SecretKeySpec key, long packetId, long fromId, byte[] cipherText) {
        try {
            Cipher cipher = Cipher.getInstance("AES/CTR/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(nonce(packetId, fromId)));
            return cipher.doFinal(cipherText);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-CTR is not usable with the configured key", e);
        }
    }

    public byte[] encrypt(SecretKeySpec key, long packetId, long fromId, byte[] plainText) {
        try {
            Cipher cipher = Cipher.getInstance("AES/CTR/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(nonce(packetId, fromId)));
            return cipher.doFinal(plainText);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-CTR is not usable with the configured key", e);
        }
    }

    /**
     * Packet id as 64-bit little-endian, sender id as 32-bit little-endian, zero padded.
     */
    static byte[] nonce(long packetId, long fromId) {
        byte[] nonce = new byte[16];
        long id = packetId & 0xFFFFFFFFL;
        for (int i = 0; i < 8; i++) {
            nonce[i] = (byte) (id >>> (8 * i));
        }
        for (int i = 0; i < 4; i++) {
            nonce[8 + i] = (byte) (fromId >>> (8 * i));
        }
        return nonce;
    }

    static byte[] expandKey(String channel, String base64) {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(base64 == null ? "" : base64.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("CHANNEL_KEYS entry for " + channel + " is not valid base64", e);
        }
        if (raw.length == 0) {
            return new byte[0];
        }
        if (raw.length == 1) {
            int index = raw[0] & 0xFF;
            if (index == 0) {
                return new byte[0];
            }
            byte[] psk = DEFAULT_PSK.clone();
            psk[psk.length - 1] = (byte) (psk[psk.length - 1] + index - 1);
            return psk;
        }
        if (raw.length > 32) {
            throw new ConfigurationException("CHANNEL_KEYS entry for " + channel + " is longer than 32 bytes");
        }
        return Arrays.copyOf(raw, raw.length <= 16 ? 16 : 32);
    }

    private static SecretKeySpec toKey(String channel, String base64) {
        byte[] bytes = expandKey(channel, base64);
        return bytes.length == 0 ? null : new SecretKeySpec(bytes, "AES");
    }
}
