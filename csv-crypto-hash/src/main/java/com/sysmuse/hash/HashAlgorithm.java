package com.sysmuse.hash;

/**
 * Digest algorithms offered for pseudonymization. NONE means nothing has been selected yet.
 */
public enum HashAlgorithm {
    NONE(0, null, null),
    RIPEMD160(1, "RIPEMD160", "ripemd160"),
    SHA224(2, "SHA-224", "sha224"),
    SHA256(3, "SHA-256", "sha256"),
    SHA384(4, "SHA-384", "sha384"),
    SHA512(5, "SHA-512", "sha512");

    private final int code;
    private final String jcaName;
    private final String fileToken;

    HashAlgorithm(int code, String jcaName, String fileToken) {
        this.code = code;
        this.jcaName = jcaName;
        this.fileToken = fileToken;
    }

    /**
     * Numeric selector accepted in configuration (0 = none .. 5 = SHA-512)
     */
    public int getCode() {
        return code;
    }

    /**
     * Name of the algorithm as registered with the security provider
     */
    public String getJcaName() {
        return jcaName;
    }

    /**
     * Lowercase token used in output file names, e.g. "sha256"
     */
    public String getFileToken() {
        if (this == NONE) {
            throw new ConfigurationException("No hash algorithm selected");
        }
        return fileToken;
    }

    public boolean isSelected() {
        return this != NONE;
    }

    public static HashAlgorithm fromCode(int code) {
        for (HashAlgorithm algorithm : values()) {
            if (algorithm.code == code) {
                return algorithm;
            }
        }
        throw new ConfigurationException("Unknown hash algorithm code: " + code);
    }

    /**
     * Parse an algorithm name. Accepts the enum name, the file token, the JCA name
     * or the numeric code, ignoring case and the separators '-' and '_'.
     */
    public static HashAlgorithm fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return NONE;
        }
        String normalized = name.trim().replace("-", "").replace("_", "").toUpperCase();
        if (normalized.chars().allMatch(Character::isDigit)) {
            return fromCode(Integer.parseInt(normalized));
        }
        if ("RIPEMD".equals(normalized)) {
            return RIPEMD160;
        }
        for (HashAlgorithm algorithm : values()) {
            if (algorithm.name().equals(normalized)) {
                return algorithm;
            }
        }
        throw new ConfigurationException("Unknown hash algorithm: " + name);
    }
}
