package com.assignmenttracker.backend.modules.auth.domain;

import java.util.Arrays;

/**
 * Digest and salt produced from a plaintext password. Arrays are copied in and out.
 */
public final class DerivedCredential {

    private final byte[] digest;
    private final byte[] salt;

    public DerivedCredential(byte[] digest, byte[] salt) {
        this.digest = digest == null ? null : digest.clone();
        this.salt = salt == null ? null : salt.clone();
    }

    public byte[] digest() {
        return digest == null ? null : digest.clone();
    }

    public byte[] salt() {
        return salt == null ? null : salt.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DerivedCredential that)) {
            return false;
        }
        return Arrays.equals(digest, that.digest) && Arrays.equals(salt, that.salt);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(digest) + Arrays.hashCode(salt);
    }

    @Override
    public String toString() {
        return "DerivedCredential[digest=<redacted>, salt=<redacted>]";
    }
}
