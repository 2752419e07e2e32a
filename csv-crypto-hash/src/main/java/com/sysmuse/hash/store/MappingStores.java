package com.sysmuse.hash.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.sysmuse.hash.LoggingUtil;

/**
 * Opens the mapping store a run should use.
 */
public final class MappingStores {

    private MappingStores() {
    }

    /**
     * @param type requested backing mechanism
     * @param inputFiles files of the run, sized up when the type is AUTO
     * @param autoThresholdBytes combined input size above which AUTO picks H2
     * @param scratchDirectory parent directory for H2 scratch files
     */
    public static MappingStore open(StoreType type, List<Path> inputFiles, long autoThresholdBytes,
                                    Path scratchDirectory) {
        StoreType resolved = type;
        if (type == StoreType.AUTO) {
            long total = totalSize(inputFiles);
            resolved = total > autoThresholdBytes ? StoreType.H2 : StoreType.MEMORY;
            LoggingUtil.info("Input size " + total + " bytes, using " + resolved + " mapping store");
        }
        if (resolved == StoreType.H2) {
            return new H2MappingStore(scratchDirectory);
        }
        return new InMemoryMappingStore();
    }

    static long totalSize(List<Path> files) {
        long total = 0;
        for (Path file : files) {
            try {
                total += Files.size(file);
            } catch (IOException e) {
                // unreadable files are reported when they are collected
                LoggingUtil.debug("Cannot size " + file + ": " + e.getMessage());
            }
        }
        return total;
    }
}
