package com.example.backupengine.error;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.Objects;

/**
 * Falha tipada do motor de backup.
 *
 * Estende {@link IOException} para seguir o mesmo contrato de propagação do restante do
 * código (tudo que toca disco lança IOException), mas carrega um {@link Kind} que permite
 * ao chamador decidir sem inspecionar mensagens.
 */
public final class BackupException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Categorias de erro expostas pelo motor.
     */
    public enum Kind {
        /** Origem/destino inexistente ou inacessível. */
        INVALID_PATH,
        PERMISSION_DENIED,
        /** Regex de filtro malformada. */
        INVALID_FILTER,
        /** Magic/versão/algoritmo desconhecidos na leitura. */
        UNSUPPORTED_FORMAT,
        /** Senha errada ou arquivo adulterado. */
        AUTHENTICATION_FAILED,
        /** Estrutura inválida mesmo após a autenticação. */
        CORRUPT_ARCHIVE,
        IO_ERROR,
        /** Disparo duplicado de uma mesma tarefa. */
        ALREADY_RUNNING
    }

    private final Kind kind;

    public BackupException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public BackupException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Converte uma IOException qualquer em BackupException, preservando o tipo quando já for uma.
     * NoSuchFile/NotDirectory viram INVALID_PATH e AccessDenied vira PERMISSION_DENIED.
     */
    public static BackupException classify(IOException e, String context) {
        if (e instanceof BackupException) {
            return (BackupException) e;
        }
        Kind kind;
        if (e instanceof NoSuchFileException || e instanceof NotDirectoryException) {
            kind = Kind.INVALID_PATH;
        } else if (e instanceof AccessDeniedException) {
            kind = Kind.PERMISSION_DENIED;
        } else {
            kind = Kind.IO_ERROR;
        }
        return new BackupException(kind, context + ": " + e.getMessage(), e);
    }

    @Override
    public String toString() {
        return "BackupException{" + kind + ": " + getMessage() + "}";
    }
}
