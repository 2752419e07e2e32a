package com.sysmuse.hash;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import com.sysmuse.hash.store.StoreType;

/**
 * Immutable settings of one hashing run. Built once, validated, then handed to every
 * stage of the pipeline; nothing in a run writes back into it.
 */
public final class RunConfig {

    public static final String DEFAULT_EXTENSION = ".csv";
    public static final String DEFAULT_NO_MAPPING_MARKER = "NO_MAPPING";
    public static final long DEFAULT_AUTO_THRESHOLD_BYTES = 64L * 1024 * 1024;
    public static final String DEFAULT_ARCHIVE_SUFFIX = "_archive";

    private final List<Path> inputFiles;
    private final Path outputDirectory;
    private final List<String> fields;
    private final HashAlgorithm algorithm;
    private final DelimitedFormat inputFormat;
    private final DelimitedFormat outputFormat;
    private final Charset inputCharset;
    private final String outputExtension;
    private final String noMappingMarker;
    private final boolean hashEmptyValues;
    private final RewriteScope rewriteScope;
    private final StoreType storeType;
    private final long autoThresholdBytes;
    private final Path scratchDirectory;
    private final boolean archiveEnabled;
    private final String archiveSuffix;
    private final String archivePassword;
    private final boolean keepOriginals;

    private RunConfig(Builder b) {
        this.inputFiles = Collections.unmodifiableList(new ArrayList<>(b.inputFiles));
        this.outputDirectory = b.outputDirectory;
        this.fields = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(b.fields)));
        this.algorithm = b.algorithm;
        this.inputFormat = b.inputFormat;
        this.outputFormat = b.outputFormat;
        this.inputCharset = b.inputCharset;
        this.outputExtension = b.outputExtension;
        this.noMappingMarker = b.noMappingMarker;
        this.hashEmptyValues = b.hashEmptyValues;
        this.rewriteScope = b.rewriteScope;
        this.storeType = b.storeType;
        this.autoThresholdBytes = b.autoThresholdBytes;
        this.scratchDirectory = b.scratchDirectory;
        this.archiveEnabled = b.archiveEnabled;
        this.archiveSuffix = b.archiveSuffix;
        this.archivePassword = b.archivePassword;
        this.keepOriginals = b.keepOriginals;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Path> getInputFiles() {
        return inputFiles;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * Selected field names, duplicates removed, selection order kept
     */
    public List<String> getFields() {
        return fields;
    }

    public HashAlgorithm getAlgorithm() {
        return algorithm;
    }

    public DelimitedFormat getInputFormat() {
        return inputFormat;
    }

    public DelimitedFormat getOutputFormat() {
        return outputFormat;
    }

    public Charset getInputCharset() {
        return inputCharset;
    }

    /**
     * Extension of the mapfiles, with leading dot
     */
    public String getOutputExtension() {
        return outputExtension;
    }

    public String getNoMappingMarker() {
        return noMappingMarker;
    }

    public boolean isHashEmptyValues() {
        return hashEmptyValues;
    }

    public RewriteScope getRewriteScope() {
        return rewriteScope;
    }

    public StoreType getStoreType() {
        return storeType;
    }

    public long getAutoThresholdBytes() {
        return autoThresholdBytes;
    }

    public Path getScratchDirectory() {
        return scratchDirectory;
    }

    public boolean isArchiveEnabled() {
        return archiveEnabled;
    }

    public String getArchiveSuffix() {
        return archiveSuffix;
    }

    public String getArchivePassword() {
        return archivePassword;
    }

    public boolean isKeepOriginals() {
        return keepOriginals;
    }

    @Override
    public String toString() {
        return "RunConfig[files=" + inputFiles.size() +
                ", fields=" + fields +
                ", algorithm=" + algorithm +
                ", input=" + inputFormat +
                ", output=" + outputFormat + " -> " + outputDirectory +
                ", store=" + storeType +
                ", rewriteScope=" + rewriteScope +
                ", archive=" + archiveEnabled + "]";
    }

    public static final class Builder {
        private final List<Path> inputFiles = new ArrayList<>();
        private Path outputDirectory;
        private final List<String> fields = new ArrayList<>();
        private HashAlgorithm algorithm = HashAlgorithm.NONE;
        private DelimitedFormat inputFormat = DelimitedFormat.CSV;
        private DelimitedFormat outputFormat = DelimitedFormat.CSV;
        private Charset inputCharset = StandardCharsets.UTF_8;
        private String outputExtension;
        private String noMappingMarker = DEFAULT_NO_MAPPING_MARKER;
        private boolean hashEmptyValues = false;
        private RewriteScope rewriteScope = RewriteScope.GLOBAL;
        private StoreType storeType = StoreType.AUTO;
        private long autoThresholdBytes = DEFAULT_AUTO_THRESHOLD_BYTES;
        private Path scratchDirectory;
        private boolean archiveEnabled = false;
        private String archiveSuffix = DEFAULT_ARCHIVE_SUFFIX;
        private String archivePassword;
        private boolean keepOriginals = true;

        private Builder() {
        }

        public Builder inputFile(Path file) {
            inputFiles.add(file);
            return this;
        }

        public Builder inputFiles(Collection<Path> files) {
            inputFiles.addAll(files);
            return this;
        }

        public Builder outputDirectory(Path dir) {
            this.outputDirectory = dir;
            return this;
        }

        public Builder field(String field) {
            fields.add(field);
            return this;
        }

        public Builder fields(Collection<String> names) {
            fields.addAll(names);
            return this;
        }

        public Builder algorithm(HashAlgorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder inputFormat(DelimitedFormat format) {
            this.inputFormat = format;
            return this;
        }

        public Builder outputFormat(DelimitedFormat format) {
            this.outputFormat = format;
            return this;
        }

        public Builder inputCharset(Charset charset) {
            this.inputCharset = charset;
            return this;
        }

        public Builder outputExtension(String extension) {
            this.outputExtension = extension;
            return this;
        }

        public Builder noMappingMarker(String marker) {
            this.noMappingMarker = marker;
            return this;
        }

        public Builder hashEmptyValues(boolean hashEmpty) {
            this.hashEmptyValues = hashEmpty;
            return this;
        }

        public Builder rewriteScope(RewriteScope scope) {
            this.rewriteScope = scope;
            return this;
        }

        public Builder storeType(StoreType type) {
            this.storeType = type;
            return this;
        }

        public Builder autoThresholdBytes(long bytes) {
            this.autoThresholdBytes = bytes;
            return this;
        }

        public Builder scratchDirectory(Path dir) {
            this.scratchDirectory = dir;
            return this;
        }

        public Builder archive(boolean enabled, String suffix, String password, boolean keepOriginals) {
            this.archiveEnabled = enabled;
            this.archiveSuffix = suffix;
            this.archivePassword = password;
            this.keepOriginals = keepOriginals;
            return this;
        }

        /**
         * Validate and freeze the settings
         *
         * @throws ConfigurationException if a required setting is missing or invalid
         */
        public RunConfig build() {
            if (algorithm == null || !algorithm.isSelected()) {
                throw new ConfigurationException("No hash algorithm selected");
            }
            if (inputFiles.isEmpty()) {
                throw new ConfigurationException("No input files selected");
            }
            if (fields.isEmpty()) {
                throw new ConfigurationException("No fields selected for hashing");
            }
            if (outputDirectory == null) {
                Path parent = inputFiles.get(0).toAbsolutePath().getParent();
                outputDirectory = parent;
            }
            if (!Files.isDirectory(outputDirectory)) {
                throw new ConfigurationException("Output directory does not exist or is not a directory: "
                        + outputDirectory);
            }
            for (Path file : inputFiles) {
                Path parent = file.toAbsolutePath().getParent();
                if (parent == null || !Files.isDirectory(parent)) {
                    throw new ConfigurationException("Input directory does not exist: " + parent);
                }
            }
            if (outputExtension == null || outputExtension.isEmpty()) {
                outputExtension = extensionOf(inputFiles.get(0));
            } else if (!outputExtension.startsWith(".")) {
                outputExtension = "." + outputExtension;
            }
            if (noMappingMarker == null) {
                noMappingMarker = "";
            }
            if (scratchDirectory == null) {
                scratchDirectory = Path.of(System.getProperty("java.io.tmpdir"));
            }
            if (archiveSuffix == null) {
                archiveSuffix = DEFAULT_ARCHIVE_SUFFIX;
            }
            if (autoThresholdBytes < 0) {
                throw new ConfigurationException("Negative store threshold: " + autoThresholdBytes);
            }
            return new RunConfig(this);
        }
    }

    /**
     * Extension of a file name including the dot, or ".csv" when it has none
     */
    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : DEFAULT_EXTENSION;
    }

    /**
     * File name without its extension
     */
    static String stemOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
