package com.exifworker.core.files;

import com.exifworker.core.exception.WorkerException;
import com.exifworker.core.model.InputFile;
import com.exifworker.core.model.OutputFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Names every output file after a random UUID so that artifacts never
 * collide inside a shared output directory.
 *
 * The file itself is not created here; the writer creates it.
 */
public class UuidOutputFileAllocator implements OutputFileAllocator {

    public static final String ERROR_CODE = "OUTPUT_ALLOCATION_FAILED";

    @Override
    public OutputFile allocate(String outputDirectory, String displayName, String extension, String dataType) {
        return allocate(outputDirectory, displayName, extension, dataType, null, null);
    }

    @Override
    public OutputFile allocate(String outputDirectory, InputFile source, String extension, String dataType) {
        return allocate(outputDirectory, source.displayName(), extension, dataType, source.id(), source.path());
    }

    private OutputFile allocate(String outputDirectory, String displayName, String extension,
                                String dataType, String sourceFileId, String originalPath) {
        if (outputDirectory == null || outputDirectory.isBlank()) {
            throw new IllegalArgumentException("Output directory must not be empty");
        }

        Path directory = Path.of(outputDirectory);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new WorkerException(ERROR_CODE,
                "Cannot create output directory " + directory, e);
        }

        String normalizedExtension = normalizeExtension(extension);
        String uuid = UUID.randomUUID().toString().replace("-", "");

        return new OutputFile(
            uuid,
            directory.resolve(uuid + normalizedExtension).toString(),
            displayName(displayName, uuid, normalizedExtension),
            normalizedExtension,
            dataType,
            sourceFileId,
            originalPath
        );
    }

    static String normalizeExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return "";
        }
        return extension.startsWith(".") ? extension : "." + extension;
    }

    private static String displayName(String displayName, String uuid, String extension) {
        String base = displayName == null || displayName.isBlank() ? uuid : displayName;
        return base.endsWith(extension) ? base : base + extension;
    }
}
