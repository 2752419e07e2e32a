package com.sysmuse.hash;

import java.io.*;
import java.nio.charset.Charset;
import java.nio.file.*;
import java.util.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.sysmuse.hash.store.StoreType;

/**
 * HashConfig - Loads and saves the JSON configuration of the hashing tool.
 * Editable holder for the settings; {@link #toRunConfig()} turns it into the
 * validated, immutable configuration of one run.
 */
public class HashConfig {

    // Input
    private String inputPath = "";
    private List<String> inputFiles = new ArrayList<>();
    private String inputDelimiter = ",";
    private String quoteChar = "\"";
    private String inputEncoding = "UTF-8";

    // Output
    private String outputDirectory = "";
    private String outputDelimiter = ",";
    private String outputExtension = "";
    private String noMappingMarker = RunConfig.DEFAULT_NO_MAPPING_MARKER;

    // Hashing
    private HashAlgorithm algorithm = HashAlgorithm.NONE;
    private List<String> fields = new ArrayList<>();
    private boolean hashEmptyValues = false;
    private RewriteScope rewriteScope = RewriteScope.GLOBAL;

    // Mapping store
    private StoreType storeType = StoreType.AUTO;
    private long storeAutoThresholdBytes = RunConfig.DEFAULT_AUTO_THRESHOLD_BYTES;
    private String scratchDirectory = "";

    // Archive configuration
    private boolean archiveEnabled = false;
    private String archiveSuffix = RunConfig.DEFAULT_ARCHIVE_SUFFIX;
    private String archivePassword = null;
    private boolean keepOriginalFiles = true;

    // Logging configuration
    private String loggingLevel = "INFO";
    private boolean consoleLoggingEnabled = true;
    private boolean fileLoggingEnabled = false;
    private String logFileName = "csvhash.log";

    /**
     * Default constructor
     */
    public HashConfig() {
    }

    /**
     * Constructor that loads from file
     */
    public HashConfig(String configFilePath) throws IOException {
        loadFromFile(configFilePath);
    }

    /**
     * Load configuration from JSON file. A missing file leaves the defaults in place.
     */
    public void loadFromFile(String configFilePath) throws IOException {
        File configFile = new File(configFilePath);
        if (!configFile.exists()) {
            LoggingUtil.warn("Hash config file not found: " + configFilePath);
            LoggingUtil.info("Using default hash configuration");
            return;
        }

        ObjectMapper mapper = new ObjectMapper();
        JsonNode configJson = mapper.readTree(configFile);
        if (configJson == null || !configJson.isObject()) {
            throw new ConfigurationException("Hash config is not a JSON object: " + configFilePath);
        }

        if (configJson.has("input")) {
            JsonNode inputNode = configJson.get("input");

            if (inputNode.has("path")) {
                inputPath = inputNode.get("path").asText();
            }

            if (inputNode.has("files")) {
                inputFiles.clear();
                JsonNode filesNode = inputNode.get("files");
                if (filesNode.isArray()) {
                    for (JsonNode fileNode : filesNode) {
                        inputFiles.add(fileNode.asText());
                    }
                } else if (filesNode.isTextual()) {
                    String fileValue = filesNode.asText();
                    if (fileValue.endsWith(".list")) {
                        readListFile(fileValue);
                    } else {
                        inputFiles.add(fileValue);
                    }
                }
            }

            if (inputNode.has("delimiter")) {
                inputDelimiter = inputNode.get("delimiter").asText();
            }

            if (inputNode.has("quote")) {
                quoteChar = inputNode.get("quote").asText();
            }

            if (inputNode.has("encoding")) {
                inputEncoding = inputNode.get("encoding").asText();
            }
        }

        if (configJson.has("output")) {
            JsonNode outputNode = configJson.get("output");

            if (outputNode.has("directory")) {
                outputDirectory = outputNode.get("directory").asText();
            }

            if (outputNode.has("delimiter")) {
                outputDelimiter = outputNode.get("delimiter").asText();
            }

            if (outputNode.has("extension")) {
                outputExtension = outputNode.get("extension").asText();
            }

            if (outputNode.has("noMappingMarker")) {
                noMappingMarker = outputNode.get("noMappingMarker").asText();
            }
        }

        if (configJson.has("hashing")) {
            JsonNode hashingNode = configJson.get("hashing");

            if (hashingNode.has("algorithm")) {
                JsonNode algorithmNode = hashingNode.get("algorithm");
                algorithm = algorithmNode.isInt()
                        ? HashAlgorithm.fromCode(algorithmNode.asInt())
                        : HashAlgorithm.fromName(algorithmNode.asText());
            }

            if (hashingNode.has("fields")) {
                fields.clear();
                JsonNode fieldsNode = hashingNode.get("fields");
                if (fieldsNode.isArray()) {
                    for (JsonNode fieldNode : fieldsNode) {
                        fields.add(fieldNode.asText());
                    }
                } else {
                    fields.add(fieldsNode.asText());
                }
            }

            if (hashingNode.has("hashEmptyValues")) {
                hashEmptyValues = hashingNode.get("hashEmptyValues").asBoolean();
            }

            if (hashingNode.has("rewriteScope")) {
                rewriteScope = RewriteScope.fromName(hashingNode.get("rewriteScope").asText());
            }
        }

        if (configJson.has("store")) {
            JsonNode storeNode = configJson.get("store");

            if (storeNode.has("type")) {
                storeType = StoreType.fromName(storeNode.get("type").asText());
            }

            if (storeNode.has("autoThresholdBytes")) {
                storeAutoThresholdBytes = storeNode.get("autoThresholdBytes").asLong();
            }

            if (storeNode.has("scratchDirectory")) {
                scratchDirectory = storeNode.get("scratchDirectory").asText();
            }
        }

        if (configJson.has("archive")) {
            JsonNode archiveNode = configJson.get("archive");

            if (archiveNode.has("enabled")) {
                archiveEnabled = archiveNode.get("enabled").asBoolean();
            }

            if (archiveNode.has("suffix")) {
                archiveSuffix = archiveNode.get("suffix").asText();
            }

            if (archiveNode.has("password")) {
                archivePassword = archiveNode.get("password").asText();
                LoggingUtil.info("Archive password configured (not logged)");
            }

            if (archiveNode.has("keepOriginals")) {
                keepOriginalFiles = archiveNode.get("keepOriginals").asBoolean();
            }
        }

        if (configJson.has("logging")) {
            JsonNode loggingNode = configJson.get("logging");

            if (loggingNode.has("level")) {
                loggingLevel = loggingNode.get("level").asText();
            }

            if (loggingNode.has("console")) {
                consoleLoggingEnabled = loggingNode.get("console").asBoolean();
            }

            if (loggingNode.has("file")) {
                fileLoggingEnabled = loggingNode.get("file").asBoolean();
            }

            if (loggingNode.has("filename")) {
                logFileName = loggingNode.get("filename").asText();
            }
        }

        LoggingUtil.info("Loaded hash configuration from: " + configFilePath);
    }

    private void readListFile(String listFileName) throws IOException {
        Path listPath = Paths.get(inputPath, listFileName);
        try {
            for (String line : Files.readAllLines(listPath)) {
                if (!line.trim().isEmpty()) {
                    inputFiles.add(line.trim());
                }
            }
            LoggingUtil.info("Read " + inputFiles.size() + " input files from list " + listPath);
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("Input list file not found: " + listPath, e);
        }
    }

    /**
     * Save configuration to a JSON file
     */
    public void saveToFile(String configFilePath) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);

        ObjectNode rootNode = mapper.createObjectNode();

        ObjectNode inputNode = rootNode.putObject("input");
        inputNode.put("path", inputPath);
        ArrayNode filesArray = inputNode.putArray("files");
        for (String file : inputFiles) {
            filesArray.add(file);
        }
        inputNode.put("delimiter", inputDelimiter);
        inputNode.put("quote", quoteChar);
        inputNode.put("encoding", inputEncoding);

        ObjectNode outputNode = rootNode.putObject("output");
        outputNode.put("directory", outputDirectory);
        outputNode.put("delimiter", outputDelimiter);
        outputNode.put("extension", outputExtension);
        outputNode.put("noMappingMarker", noMappingMarker);

        ObjectNode hashingNode = rootNode.putObject("hashing");
        hashingNode.put("algorithm", algorithm.isSelected() ? algorithm.getFileToken() : "none");
        ArrayNode fieldsArray = hashingNode.putArray("fields");
        for (String field : fields) {
            fieldsArray.add(field);
        }
        hashingNode.put("hashEmptyValues", hashEmptyValues);
        hashingNode.put("rewriteScope", rewriteScope.name().toLowerCase());

        ObjectNode storeNode = rootNode.putObject("store");
        storeNode.put("type", storeType.name().toLowerCase());
        storeNode.put("autoThresholdBytes", storeAutoThresholdBytes);
        storeNode.put("scratchDirectory", scratchDirectory);

        ObjectNode archiveNode = rootNode.putObject("archive");
        archiveNode.put("enabled", archiveEnabled);
        archiveNode.put("suffix", archiveSuffix);
        if (archivePassword != null) {
            archiveNode.put("password", archivePassword);
        }
        archiveNode.put("keepOriginals", keepOriginalFiles);

        ObjectNode loggingNode = rootNode.putObject("logging");
        loggingNode.put("level", loggingLevel);
        loggingNode.put("console", consoleLoggingEnabled);
        loggingNode.put("file", fileLoggingEnabled);
        loggingNode.put("filename", logFileName);

        mapper.writeValue(new File(configFilePath), rootNode);
        LoggingUtil.info("Saved hash configuration to: " + configFilePath);
    }

    /**
     * Resolve paths, parse delimiters and validate into an immutable run configuration
     *
     * @throws ConfigurationException if the settings cannot describe a run
     */
    public RunConfig toRunConfig() {
        RunConfig.Builder builder = RunConfig.builder();

        for (String file : inputFiles) {
            builder.inputFile(Paths.get(inputPath, file));
        }
        if (!outputDirectory.isEmpty()) {
            builder.outputDirectory(Paths.get(outputDirectory));
        } else if (!inputPath.isEmpty()) {
            builder.outputDirectory(Paths.get(inputPath));
        }

        Charset charset;
        try {
            charset = Charset.forName(inputEncoding);
        } catch (IllegalArgumentException e) {
            // unknown or illegal charset name
            throw new ConfigurationException("Unsupported input encoding: " + inputEncoding, e);
        }

        builder.fields(fields)
                .algorithm(algorithm)
                .inputFormat(DelimitedFormat.parse(inputDelimiter, quoteChar))
                .outputFormat(DelimitedFormat.parse(outputDelimiter, quoteChar))
                .inputCharset(charset)
                .outputExtension(outputExtension)
                .noMappingMarker(noMappingMarker)
                .hashEmptyValues(hashEmptyValues)
                .rewriteScope(rewriteScope)
                .storeType(storeType)
                .autoThresholdBytes(storeAutoThresholdBytes)
                .archive(archiveEnabled, archiveSuffix, archivePassword, keepOriginalFiles);

        if (!scratchDirectory.isEmpty()) {
            builder.scratchDirectory(Paths.get(scratchDirectory));
        }
        return builder.build();
    }

    /**
     * Print configuration at debug level
     */
    public void printDebug() {
        LoggingUtil.debug("==== HashConfig Debug Information ====");
        LoggingUtil.debug("Input Path: " + inputPath);
        LoggingUtil.debug("Input Files: " + inputFiles);
        LoggingUtil.debug("Input Delimiter: " + inputDelimiter + ", Quote: " + quoteChar + ", Encoding: " + inputEncoding);
        LoggingUtil.debug("Output Directory: " + outputDirectory);
        LoggingUtil.debug("Output Delimiter: " + outputDelimiter + ", Extension: " + outputExtension);
        LoggingUtil.debug("Algorithm: " + algorithm);
        LoggingUtil.debug("Fields: " + fields);
        LoggingUtil.debug("Hash Empty Values: " + hashEmptyValues);
        LoggingUtil.debug("Rewrite Scope: " + rewriteScope);
        LoggingUtil.debug("Store: " + storeType + " (auto threshold " + storeAutoThresholdBytes + " bytes)");
        LoggingUtil.debug("Archive Enabled: " + archiveEnabled);
        LoggingUtil.debug("Logging Level: " + loggingLevel);
        LoggingUtil.debug("======================================");
    }

    // Getters and setters

    public String getInputPath() {
        return inputPath;
    }

    public void setInputPath(String inputPath) {
        this.inputPath = inputPath;
    }

    public List<String> getInputFiles() {
        return inputFiles;
    }

    public void setInputFiles(List<String> inputFiles) {
        this.inputFiles = new ArrayList<>(inputFiles);
    }

    public String getInputDelimiter() {
        return inputDelimiter;
    }

    public void setInputDelimiter(String inputDelimiter) {
        this.inputDelimiter = inputDelimiter;
    }

    public String getQuoteChar() {
        return quoteChar;
    }

    public void setQuoteChar(String quoteChar) {
        this.quoteChar = quoteChar;
    }

    public String getInputEncoding() {
        return inputEncoding;
    }

    public void setInputEncoding(String inputEncoding) {
        this.inputEncoding = inputEncoding;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public String getOutputDelimiter() {
        return outputDelimiter;
    }

    public void setOutputDelimiter(String outputDelimiter) {
        this.outputDelimiter = outputDelimiter;
    }

    public String getOutputExtension() {
        return outputExtension;
    }

    public void setOutputExtension(String outputExtension) {
        this.outputExtension = outputExtension;
    }

    public String getNoMappingMarker() {
        return noMappingMarker;
    }

    public void setNoMappingMarker(String noMappingMarker) {
        this.noMappingMarker = noMappingMarker;
    }

    public HashAlgorithm getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(HashAlgorithm algorithm) {
        this.algorithm = algorithm;
    }

    public List<String> getFields() {
        return fields;
    }

    public void setFields(List<String> fields) {
        this.fields = new ArrayList<>(fields);
    }

    public boolean isHashEmptyValues() {
        return hashEmptyValues;
    }

    public void setHashEmptyValues(boolean hashEmptyValues) {
        this.hashEmptyValues = hashEmptyValues;
    }

    public RewriteScope getRewriteScope() {
        return rewriteScope;
    }

    public void setRewriteScope(RewriteScope rewriteScope) {
        this.rewriteScope = rewriteScope;
    }

    public StoreType getStoreType() {
        return storeType;
    }

    public void setStoreType(StoreType storeType) {
        this.storeType = storeType;
    }

    public long getStoreAutoThresholdBytes() {
        return storeAutoThresholdBytes;
    }

    public void setStoreAutoThresholdBytes(long storeAutoThresholdBytes) {
        this.storeAutoThresholdBytes = storeAutoThresholdBytes;
    }

    public String getScratchDirectory() {
        return scratchDirectory;
    }

    public void setScratchDirectory(String scratchDirectory) {
        this.scratchDirectory = scratchDirectory;
    }

    public boolean isArchiveEnabled() {
        return archiveEnabled;
    }

    public void setArchiveEnabled(boolean archiveEnabled) {
        this.archiveEnabled = archiveEnabled;
    }

    public String getArchiveSuffix() {
        return archiveSuffix;
    }

    public void setArchiveSuffix(String archiveSuffix) {
        this.archiveSuffix = archiveSuffix;
    }

    public String getArchivePassword() {
        return archivePassword;
    }

    public void setArchivePassword(String archivePassword) {
        this.archivePassword = archivePassword;
    }

    public boolean isKeepOriginalFiles() {
        return keepOriginalFiles;
    }

    public void setKeepOriginalFiles(boolean keepOriginalFiles) {
        this.keepOriginalFiles = keepOriginalFiles;
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public void setLoggingLevel(String loggingLevel) {
        this.loggingLevel = loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public void setConsoleLoggingEnabled(boolean consoleLoggingEnabled) {
        this.consoleLoggingEnabled = consoleLoggingEnabled;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public void setFileLoggingEnabled(boolean fileLoggingEnabled) {
        this.fileLoggingEnabled = fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }

    public void setLogFileName(String logFileName) {
        this.logFileName = logFileName;
    }
}
