package com.sysmuse.hash;

import java.io.IOException;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;

import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.exception.ZipException;
import net.lingala.zip4j.model.ZipParameters;
import net.lingala.zip4j.model.enums.AesKeyStrength;
import net.lingala.zip4j.model.enums.EncryptionMethod;

/**
 * Packs the mapfiles of a run, which hold plaintext, into one zip archive,
 * AES-256 encrypted when a password is configured. Hashed inputs are never archived.
 */
public class MapfileArchiver {

    /**
     * Archive name for a run, e.g. Hash_MapFiles_sha256_archive.zip
     */
    public static String archiveName(RunConfig config) {
        return "Hash_MapFiles_" + config.getAlgorithm().getFileToken() + config.getArchiveSuffix() + ".zip";
    }

    /**
     * Archive the given mapfiles and, unless originals are kept, delete them afterwards
     *
     * @return the archive
     * @throws WriteException if the archive cannot be created
     */
    public Path archive(List<Path> mapfiles, RunConfig config) {
        Path zipPath = config.getOutputDirectory().resolve(archiveName(config));
        LoggingUtil.info("Creating ZIP archive: " + zipPath + " with " + mapfiles.size() + " mapfiles");

        try {
            Files.deleteIfExists(zipPath);
            try (ZipFile zipFile = new ZipFile(zipPath.toFile())) {
                ZipParameters zipParameters = new ZipParameters();
                String password = config.getArchivePassword();

                if (password != null && !password.trim().isEmpty()) {
                    LoggingUtil.info("Creating password-protected archive");
                    zipFile.setPassword(password.toCharArray());
                    zipParameters.setEncryptFiles(true);
                    zipParameters.setEncryptionMethod(EncryptionMethod.AES);
                    zipParameters.setAesKeyStrength(AesKeyStrength.KEY_STRENGTH_256);
                } else {
                    LoggingUtil.warn("Mapfile archive is not password protected");
                }

                for (Path mapfile : mapfiles) {
                    zipParameters.setFileNameInZip(mapfile.getFileName().toString());
                    zipFile.addFile(mapfile.toFile(), zipParameters);
                    LoggingUtil.debug("Added to archive: " + mapfile.getFileName());
                }
            }
        } catch (IOException e) {
            deleteQuietly(zipPath);
            throw new WriteException(zipPath, "Failed to create mapfile archive", e);
        }

        if (!config.isKeepOriginals()) {
            cleanupArchivedFiles(mapfiles);
        }
        return zipPath;
    }

    /**
     * Delete the files that went into the archive
     *
     * @return files actually deleted
     */
    List<Path> cleanupArchivedFiles(List<Path> archivedFiles) {
        LoggingUtil.info("Cleaning up " + archivedFiles.size() + " archived mapfiles");
        List<Path> deleted = new ArrayList<>();
        for (Path file : archivedFiles) {
            try {
                Files.deleteIfExists(file);
                deleted.add(file);
            } catch (IOException e) {
                LoggingUtil.warn("Failed to delete archived mapfile: " + file + " - " + e.getMessage());
            }
        }
        return deleted;
    }

    /**
     * Test if a ZIP file is password protected
     */
    public static boolean isPasswordProtected(Path zipPath) {
        try (ZipFile zipFile = new ZipFile(zipPath.toFile())) {
            return zipFile.isEncrypted();
        } catch (IOException e) {
            throw new WriteException(zipPath, "Cannot inspect archive", e);
        }
    }

    /**
     * Extract an archive, decrypting it with the password when it is encrypted
     */
    public static void extract(Path zipPath, Path extractPath, String password) throws IOException {
        try (ZipFile zipFile = new ZipFile(zipPath.toFile())) {
            if (zipFile.isEncrypted()) {
                if (password == null || password.trim().isEmpty()) {
                    throw new IOException("ZIP file is password protected but no password provided");
                }
                zipFile.setPassword(password.toCharArray());
            }
            zipFile.extractAll(extractPath.toString());
        } catch (ZipException e) {
            throw new IOException("Failed to extract archive " + zipPath, e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LoggingUtil.warn("Could not remove incomplete archive " + file + " - " + e.getMessage());
        }
    }
}
