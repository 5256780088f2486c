package com.securevault.crypto;

import com.securevault.error.VaultIntegrityException;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.Security;

/**
 * AES-256-GCM through the Bouncy Castle JCA provider.
 *
 * <p>One call gives confidentiality and tamper detection: the 128-bit tag is
 * appended to the ciphertext on encrypt and checked on decrypt. Every call
 * builds its own {@link Cipher}, so the instance is safe to share across
 * threads.
 */
public class AuthenticatedCipher {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private static final String AES_ALGO = "AES/GCM/NoPadding";
    private static final int KEY_SIZE = 32;   // AES-256
    private static final int TAG_SIZE = 128;  // 128-bit authentication tag

    public byte[] encrypt(byte[] plaintext, byte[] key, byte[] iv) {
        try {
            return newCipher(Cipher.ENCRYPT_MODE, key, iv).doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * @throws VaultIntegrityException when the tag does not verify (wrong key or
     *                                 modified salt, iv or ciphertext)
     */
    public byte[] decrypt(byte[] ciphertext, byte[] key, byte[] iv) {
        Cipher cipher;
        try {
            cipher = newCipher(Cipher.DECRYPT_MODE, key, iv);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM initialisation failed", e);
        }
        try {
            return cipher.doFinal(ciphertext);
        } catch (BadPaddingException e) {
            // AEADBadTagException, or BC's "data too short" for a truncated tag
            throw new VaultIntegrityException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption failed", e);
        }
    }

    private static Cipher newCipher(int mode, byte[] key, byte[] iv) throws GeneralSecurityException {
        if (key == null || key.length != KEY_SIZE) {
            throw new IllegalArgumentException("key must be " + KEY_SIZE + " bytes");
        }
        if (iv == null || iv.length != EncryptedBlob.IV_SIZE) {
            throw new IllegalArgumentException("iv must be " + EncryptedBlob.IV_SIZE + " bytes");
        }
        Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
        cipher.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE, iv));
        return cipher;
    }
}
