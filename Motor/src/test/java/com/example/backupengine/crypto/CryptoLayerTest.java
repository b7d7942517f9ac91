package com.example.backupengine.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.Test;

import com.example.backupengine.crypto.CryptoLayer.Sealed;
import com.example.backupengine.error.BackupException;
import com.example.backupengine.error.BackupException.Kind;

class CryptoLayerTest {

    private final CryptoLayer crypto = new CryptoLayer(1_000);
    private final byte[] aad = "BKP1-cabecalho".getBytes(StandardCharsets.US_ASCII);
    private final byte[] plaintext = "conteúdo secreto".getBytes(StandardCharsets.UTF_8);

    @Test
    void sealThenOpenReturnsPlaintext() throws BackupException {
        byte[] salt = CryptoLayer.newSalt();
        byte[] nonce = CryptoLayer.newNonce();
        SecretKey key = crypto.deriveKey("secret", salt);

        Sealed sealed = crypto.seal(key, nonce, aad, plaintext);

        assertThat(sealed.tag()).hasSize(CryptoLayer.TAG_LENGTH);
        assertThat(sealed.ciphertext()).hasSameSizeAs(plaintext).isNotEqualTo(plaintext);
        assertThat(crypto.open(key, nonce, aad, sealed.ciphertext(), sealed.tag())).isEqualTo(plaintext);
    }

    @Test
    void keyDerivationIsDeterministicPerSaltAndPassword() throws BackupException {
        byte[] salt = CryptoLayer.newSalt();

        assertThat(crypto.deriveKey("secret", salt).getEncoded())
                .isEqualTo(crypto.deriveKey("secret", salt.clone()).getEncoded())
                .isNotEqualTo(crypto.deriveKey("Secret", salt).getEncoded())
                .hasSize(32);
        assertThat(crypto.deriveKey("secret", CryptoLayer.newSalt()).getEncoded())
                .isNotEqualTo(crypto.deriveKey("secret", salt).getEncoded());
    }

    @Test
    void wrongPasswordFailsAuthentication() throws BackupException {
        byte[] salt = CryptoLayer.newSalt();
        byte[] nonce = CryptoLayer.newNonce();
        Sealed sealed = crypto.seal(crypto.deriveKey("secret", salt), nonce, aad, plaintext);
        SecretKey wrong = crypto.deriveKey("errada", salt);

        assertThatThrownBy(() -> crypto.open(wrong, nonce, aad, sealed.ciphertext(), sealed.tag()))
                .isInstanceOfSatisfying(BackupException.class,
                        e -> assertThat(e.kind()).isEqualTo(Kind.AUTHENTICATION_FAILED));
    }

    @Test
    void anyTamperingFailsAuthentication() throws BackupException {
        byte[] salt = CryptoLayer.newSalt();
        byte[] nonce = CryptoLayer.newNonce();
        SecretKey key = crypto.deriveKey("secret", salt);
        Sealed sealed = crypto.seal(key, nonce, aad, plaintext);

        byte[] badCipher = sealed.ciphertext().clone();
        badCipher[0] ^= 1;
        byte[] badTag = sealed.tag().clone();
        badTag[15] ^= (byte) 0x80;
        byte[] badAad = aad.clone();
        badAad[2] ^= 1;

        assertAuthFailure(() -> crypto.open(key, nonce, aad, badCipher, sealed.tag()));
        assertAuthFailure(() -> crypto.open(key, nonce, aad, sealed.ciphertext(), badTag));
        assertAuthFailure(() -> crypto.open(key, nonce, badAad, sealed.ciphertext(), sealed.tag()));
    }

    @Test
    void saltsAndNoncesAreFreshAndSized() {
        assertThat(CryptoLayer.newSalt()).hasSize(16).isNotEqualTo(CryptoLayer.newSalt());
        assertThat(CryptoLayer.newNonce()).hasSize(12).isNotEqualTo(CryptoLayer.newNonce());
    }

    @Test
    void rejectsMalformedParameters() {
        assertThatThrownBy(() -> new CryptoLayer(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> crypto.deriveKey("x", new byte[4])).isInstanceOf(IllegalArgumentException.class);
    }

    private static void assertAuthFailure(ThrowingCallable call) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(BackupException.class,
                        e -> assertThat(e.kind()).isEqualTo(Kind.AUTHENTICATION_FAILED));
    }
}
