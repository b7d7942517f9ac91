package com.example.backupengine.crypto;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

import com.example.backupengine.error.BackupException;

/**
 * Camada de criptografia do payload.
 *
 * - Derivação de chave: PBKDF2-HMAC-SHA256 com salt aleatório de 16 bytes (lento de propósito);
 * - Selagem: AES-256-GCM com nonce de 12 bytes e tag de 16 bytes, separada do ciphertext para
 *   caber no layout do arquivo (a tag vai no fim);
 * - Abertura falha fechada: tag incorreta ou chave errada vira AUTHENTICATION_FAILED e nenhum byte
 *   decifrado é devolvido.
 */
public final class CryptoLayer {

    public static final int SALT_LENGTH = 16;
    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;
    public static final int DEFAULT_ITERATIONS = 210_000;

    private static final String KDF = "PBKDF2WithHmacSHA256";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH_BITS = 256;
    private static final int TAG_LENGTH_BITS = TAG_LENGTH * 8;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final int iterations;

    public CryptoLayer() {
        this(DEFAULT_ITERATIONS);
    }

    public CryptoLayer(int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("Iterações do KDF devem ser positivas: " + iterations);
        }
        this.iterations = iterations;
    }

    public int iterations() {
        return iterations;
    }

    public static byte[] newSalt() {
        return randomBytes(SALT_LENGTH);
    }

    public static byte[] newNonce() {
        return randomBytes(NONCE_LENGTH);
    }

    /**
     * Deriva a chave AES a partir da senha e do salt.
     */
    public SecretKey deriveKey(String password, byte[] salt) throws BackupException {
        Objects.requireNonNull(password, "password");
        requireLength(salt, SALT_LENGTH, "salt");
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, iterations, KEY_LENGTH_BITS);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(KDF);
            byte[] raw = factory.generateSecret(spec).getEncoded();
            try {
                return new SecretKeySpec(raw, "AES");
            } finally {
                Arrays.fill(raw, (byte) 0);
            }
        } catch (GeneralSecurityException e) {
            throw new BackupException(BackupException.Kind.IO_ERROR, "KDF indisponível: " + KDF, e);
        } finally {
            spec.clearPassword();
        }
    }

    /**
     * Cifra {@code plaintext}, autenticando também {@code aad} (cabeçalho e manifest).
     */
    public Sealed seal(SecretKey key, byte[] nonce, byte[] aad, byte[] plaintext) throws BackupException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(plaintext, "plaintext");
        requireLength(nonce, NONCE_LENGTH, "nonce");
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            if (aad != null && aad.length > 0) {
                cipher.updateAAD(aad);
            }
            byte[] all = cipher.doFinal(plaintext);
            byte[] ciphertext = Arrays.copyOfRange(all, 0, all.length - TAG_LENGTH);
            byte[] tag = Arrays.copyOfRange(all, all.length - TAG_LENGTH, all.length);
            return new Sealed(ciphertext, tag);
        } catch (GeneralSecurityException e) {
            throw new BackupException(BackupException.Kind.IO_ERROR, "Falha ao cifrar payload: " + e.getMessage(), e);
        }
    }

    /**
     * Decifra e autentica. Qualquer divergência de tag (senha errada, byte alterado no cabeçalho,
     * manifest ou payload) resulta em AUTHENTICATION_FAILED.
     */
    public byte[] open(SecretKey key, byte[] nonce, byte[] aad, byte[] ciphertext, byte[] tag) throws BackupException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(ciphertext, "ciphertext");
        requireLength(nonce, NONCE_LENGTH, "nonce");
        requireLength(tag, TAG_LENGTH, "tag");
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            if (aad != null && aad.length > 0) {
                cipher.updateAAD(aad);
            }
            byte[] all = new byte[ciphertext.length + TAG_LENGTH];
            System.arraycopy(ciphertext, 0, all, 0, ciphertext.length);
            System.arraycopy(tag, 0, all, ciphertext.length, TAG_LENGTH);
            return cipher.doFinal(all);
        } catch (AEADBadTagException e) {
            throw new BackupException(BackupException.Kind.AUTHENTICATION_FAILED,
                    "Autenticação falhou: senha incorreta ou arquivo adulterado", e);
        } catch (GeneralSecurityException e) {
            throw new BackupException(BackupException.Kind.IO_ERROR, "Falha ao decifrar payload: " + e.getMessage(), e);
        }
    }

    /** Para uso em testes e diagnóstico; não expõe a chave. */
    @Override
    public String toString() {
        return "CryptoLayer{kdf=" + KDF + ", iterations=" + iterations + ", cipher=" + TRANSFORMATION + "}";
    }

    private static byte[] randomBytes(int length) {
        byte[] b = new byte[length];
        RANDOM.nextBytes(b);
        return b;
    }

    private static void requireLength(byte[] value, int expected, String name) {
        Objects.requireNonNull(value, name);
        if (value.length != expected) {
            throw new IllegalArgumentException(name + " deve ter " + expected + " bytes, recebeu " + value.length);
        }
    }

    /**
     * Resultado da selagem: ciphertext (mesmo tamanho do texto claro) e tag GCM.
     */
    public static final class Sealed {
        private final byte[] ciphertext;
        private final byte[] tag;

        public Sealed(byte[] ciphertext, byte[] tag) {
            this.ciphertext = Objects.requireNonNull(ciphertext, "ciphertext");
            this.tag = Objects.requireNonNull(tag, "tag");
        }

        public byte[] ciphertext() { return ciphertext; }
        public byte[] tag() { return tag; }
    }
}
