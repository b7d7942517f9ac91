package com.example.backupengine.filter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.example.backupengine.error.BackupException;

/**
 * Seleção de arquivos para o backup.
 *
 * {@link FilterOptions} é o valor imutável configurado pelo chamador; {@link #compile(FilterOptions)}
 * transforma esse valor em um matcher pronto para uso durante a varredura. A regex só é compilada
 * aqui, então uma expressão malformada falha na construção do filtro e não no meio do walk.
 */
public final class FileFilter {

    private static final FileFilter ACCEPT_ALL = new FileFilter(FilterOptions.disabled(), null);

    private final FilterOptions options;
    private final Pattern namePattern;

    private FileFilter(FilterOptions options, Pattern namePattern) {
        this.options = options;
        this.namePattern = namePattern;
    }

    /**
     * Filtro que aceita tudo.
     */
    public static FileFilter acceptAll() {
        return ACCEPT_ALL;
    }

    /**
     * Compila as opções.
     *
     * @throws BackupException INVALID_FILTER se {@code nameRegex} não compilar
     */
    public static FileFilter compile(FilterOptions options) throws BackupException {
        Objects.requireNonNull(options, "options");
        if (!options.enabled()) {
            return new FileFilter(options, null);
        }
        Pattern pattern = null;
        if (!options.nameRegex().isEmpty()) {
            try {
                pattern = Pattern.compile(options.nameRegex());
            } catch (PatternSyntaxException e) {
                throw new BackupException(BackupException.Kind.INVALID_FILTER,
                        "Regex de filtro inválida: " + options.nameRegex() + " (" + e.getDescription() + ")", e);
            }
        }
        return new FileFilter(options, pattern);
    }

    public FilterOptions options() {
        return options;
    }

    /**
     * Regras de sufixo, regex e tamanho. Restrições de data e dono não se aplicam aqui.
     */
    public boolean matches(Path path, long size) {
        return matches(path, size, null, null);
    }

    /**
     * Avalia todas as regras. {@code modifiedAt} ou {@code owner} nulos significam "desconhecido"
     * e a regra correspondente não é aplicada.
     * <p>
     * Palavras-chave não substituem a regex: com as duas configuradas, o nome precisa casar a regex
     * e conter ao menos uma palavra-chave.
     */
    public boolean matches(Path path, long size, Instant modifiedAt, String owner) {
        Objects.requireNonNull(path, "path");
        if (!options.enabled()) {
            return true;
        }
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString() : path.toString();

        if (!options.suffixes().isEmpty() && !options.suffixes().contains(extensionOf(name))) {
            return false;
        }
        if (namePattern != null && !namePattern.matcher(name).find()) {
            return false;
        }
        if (!options.nameKeywords().isEmpty() && options.nameKeywords().stream().noneMatch(name::contains)) {
            return false;
        }
        if (size < options.minSize()) {
            return false;
        }
        if (options.maxSize() != 0 && size > options.maxSize()) {
            return false;
        }
        if (modifiedAt != null) {
            if (options.modifiedAfter() != null && modifiedAt.isBefore(options.modifiedAfter())) {
                return false;
            }
            if (options.modifiedBefore() != null && modifiedAt.isAfter(options.modifiedBefore())) {
                return false;
            }
        }
        if (owner != null && !options.owner().isEmpty() && !options.owner().equals(owner)) {
            return false;
        }
        return true;
    }

    /** Extensão em minúsculas com o ponto (".txt"), ou "" se não houver. */
    static String extensionOf(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    // ==================== OPÇÕES ====================

    /**
     * Configuração imutável do filtro.
     *
     * Com {@code enabled=false} todo arquivo passa, independente dos demais campos.
     * {@code maxSize == 0} significa sem limite superior.
     */
    public static final class FilterOptions {
        private final boolean enabled;
        private final Set<String> suffixes;
        private final String nameRegex;
        private final List<String> nameKeywords;
        private final long minSize;
        private final long maxSize;
        private final Instant modifiedAfter;
        private final Instant modifiedBefore;
        private final String owner;

        private FilterOptions(Builder b) {
            this.enabled = b.enabled;
            this.suffixes = Set.copyOf(b.suffixes);
            this.nameRegex = b.nameRegex;
            this.nameKeywords = List.copyOf(b.nameKeywords);
            this.minSize = b.minSize;
            this.maxSize = b.maxSize;
            this.modifiedAfter = b.modifiedAfter;
            this.modifiedBefore = b.modifiedBefore;
            this.owner = b.owner;
        }

        public static FilterOptions disabled() {
            return builder().enabled(false).build();
        }

        /** Builder já habilitado. */
        public static Builder builder() {
            return new Builder();
        }

        public boolean enabled() { return enabled; }
        public Set<String> suffixes() { return suffixes; }
        public String nameRegex() { return nameRegex; }
        public List<String> nameKeywords() { return nameKeywords; }
        public long minSize() { return minSize; }
        public long maxSize() { return maxSize; }
        public Instant modifiedAfter() { return modifiedAfter; }
        public Instant modifiedBefore() { return modifiedBefore; }
        public String owner() { return owner; }

        @Override
        public String toString() {
            return "FilterOptions{enabled=" + enabled +
                    ", suffixes=" + suffixes +
                    ", regex=" + (nameRegex.isEmpty() ? "none" : nameRegex) +
                    ", keywords=" + nameKeywords +
                    ", size=[" + minSize + ", " + (maxSize == 0 ? "inf" : maxSize) + "]" +
                    ", owner=" + (owner.isEmpty() ? "any" : owner) + "}";
        }

        public static final class Builder {
            private boolean enabled = true;
            private final Set<String> suffixes = new LinkedHashSet<>();
            private String nameRegex = "";
            private final List<String> nameKeywords = new ArrayList<>();
            private long minSize = 0;
            private long maxSize = 0;
            private Instant modifiedAfter;
            private Instant modifiedBefore;
            private String owner = "";

            public Builder enabled(boolean v) { this.enabled = v; return this; }

            /** Aceita "txt", ".txt" ou ".TXT"; tudo é normalizado para ".txt". */
            public Builder suffix(String suffix) {
                Objects.requireNonNull(suffix, "suffix");
                String s = suffix.trim().toLowerCase(Locale.ROOT);
                if (!s.isEmpty()) {
                    suffixes.add(s.startsWith(".") ? s : "." + s);
                }
                return this;
            }

            public Builder suffixes(Collection<String> values) {
                values.forEach(this::suffix);
                return this;
            }

            public Builder nameRegex(String regex) { this.nameRegex = regex == null ? "" : regex; return this; }

            public Builder nameKeyword(String keyword) {
                if (keyword != null && !keyword.isEmpty()) {
                    nameKeywords.add(keyword);
                }
                return this;
            }

            public Builder minSize(long v) {
                if (v < 0) throw new IllegalArgumentException("minSize negativo: " + v);
                this.minSize = v;
                return this;
            }

            public Builder maxSize(long v) {
                if (v < 0) throw new IllegalArgumentException("maxSize negativo: " + v);
                this.maxSize = v;
                return this;
            }

            public Builder modifiedAfter(Instant v) { this.modifiedAfter = v; return this; }
            public Builder modifiedBefore(Instant v) { this.modifiedBefore = v; return this; }
            public Builder owner(String v) { this.owner = v == null ? "" : v.trim(); return this; }

            public FilterOptions build() {
                return new FilterOptions(this);
            }
        }
    }
}
