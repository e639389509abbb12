package com.assignmenttracker.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import com.assignmenttracker.backend.modules.auth.domain.DerivedCredential;

import org.springframework.stereotype.Service;

/**
 * Derives and verifies password digests as HMAC-SHA512 keyed with a random per-user salt.
 */
@Service
public class CredentialService {

    static final String HMAC_SHA_512 = "HmacSHA512";
    static final int SALT_LENGTH_BYTES = 128;

    private final SecureRandom secureRandom;

    public CredentialService(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public DerivedCredential derive(String password) {
        if (password == null) {
            throw new InvalidCredentialDataException("password must not be null");
        }
        byte[] salt = new byte[SALT_LENGTH_BYTES];
        secureRandom.nextBytes(salt);
        return new DerivedCredential(hmac(password, salt), salt);
    }

    public boolean verify(String password, byte[] digest, byte[] salt) {
        if (password == null) {
            throw new InvalidCredentialDataException("password must not be null");
        }
        if (digest == null || digest.length == 0) {
            throw new InvalidCredentialDataException("stored password digest is missing");
        }
        if (salt == null || salt.length == 0) {
            throw new InvalidCredentialDataException("stored password salt is missing");
        }
        byte[] computed = hmac(password, salt);
        return MessageDigest.isEqual(computed, digest);
    }

    public boolean verify(String password, DerivedCredential credential) {
        if (credential == null) {
            throw new InvalidCredentialDataException("stored credential is missing");
        }
        return verify(password, credential.digest(), credential.salt());
    }

    private byte[] hmac(String password, byte[] salt) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA_512);
            mac.init(new SecretKeySpec(salt, HMAC_SHA_512));
            return mac.doFinal(password.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HmacSHA512 is not available", e);
        }
    }
}
