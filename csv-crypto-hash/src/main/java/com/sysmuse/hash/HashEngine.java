package com.sysmuse.hash;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.Provider;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.encoders.Hex;

/**
 * Stateless digest function. Every call works on a freshly created MessageDigest,
 * so no hash state can leak from one value into the next.
 */
public final class HashEngine {

    // RIPEMD-160 is not shipped with the JDK providers
    private static final Provider BOUNCY_CASTLE = new BouncyCastleProvider();

    private HashEngine() {
    }

    /**
     * Digest the UTF-8 bytes of a value
     *
     * @param value plaintext, empty is allowed; null is treated as empty
     * @param algorithm selected algorithm, must not be NONE
     * @return lowercase hexadecimal digest
     * @throws ConfigurationException if no algorithm is selected
     */
    public static String digest(String value, HashAlgorithm algorithm) {
        MessageDigest md = newDigest(algorithm);
        byte[] bytes = (value == null ? "" : value).getBytes(StandardCharsets.UTF_8);
        return Hex.toHexString(md.digest(bytes));
    }

    static MessageDigest newDigest(HashAlgorithm algorithm) {
        if (algorithm == null || !algorithm.isSelected()) {
            throw new ConfigurationException("Hash engine invoked with no algorithm selected");
        }
        try {
            if (algorithm == HashAlgorithm.RIPEMD160) {
                return MessageDigest.getInstance(algorithm.getJcaName(), BOUNCY_CASTLE);
            }
            return MessageDigest.getInstance(algorithm.getJcaName());
        } catch (NoSuchAlgorithmException e) {
            throw new ConfigurationException("Digest not available: " + algorithm.getJcaName(), e);
        }
    }
}
