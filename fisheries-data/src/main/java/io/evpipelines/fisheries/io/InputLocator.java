package io.evpipelines.fisheries.io;

import io.evpipelines.fisheries.DatasetVariant;
import io.evpipelines.fisheries.InputLoadException;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds a variant's input CSV in a directory: the variant's primary glob first, then its fallback glob minus
 * excluded names. The first match in name order wins.
 */
public class InputLocator {
    private final Path inputDir;

    public InputLocator(Path inputDir) {
        this.inputDir = inputDir;
    }

    public Path locate(DatasetVariant variant) throws InputLoadException {
        if (!Files.isDirectory(inputDir)) {
            throw new InputLoadException(variant, "Input directory does not exist: " + inputDir);
        }
        try {
            List<Path> matches = list(variant.inputGlob(), null);
            if (matches.isEmpty()) {
                matches = list(variant.fallbackGlob(), variant.fallbackExclude());
            }
            if (matches.isEmpty()) {
                throw new InputLoadException(variant, "No " + variant.key() + " data file found in " + inputDir);
            }
            return matches.get(0);
        } catch (IOException e) {
            throw new InputLoadException(variant, "Cannot list input directory " + inputDir, e);
        }
    }

    private List<Path> list(String glob, String exclude) throws IOException {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(inputDir, glob)) {
            for (Path p : ds) {
                if (!Files.isRegularFile(p)) continue;
                if (exclude != null && p.getFileName().toString().contains(exclude)) continue;
                out.add(p);
            }
        }
        out.sort(null);
        return out;
    }
}
