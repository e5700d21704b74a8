package com.eyelevel.ocrprocessor.service.file;

import com.eyelevel.ocrprocessor.exception.UnsupportedFileTypeException;
import com.eyelevel.ocrprocessor.model.FileCategory;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps a file name to the {@link FileCategory} that processes it, using the extension table declared on
 * the categories. Matching is case-insensitive. Pure and stateless.
 */
@Slf4j
@Service
public class FileTypeResolver {

    private final Map<String, FileCategory> categoriesByExtension;

    public FileTypeResolver() {
        this.categoriesByExtension = Collections.unmodifiableMap(Arrays.stream(FileCategory.values())
                .flatMap(category -> category.getExtensions().stream()
                        .map(extension -> Map.entry(extension, category)))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue)));
    }

    /**
     * @param fileName A file name, optionally with path information.
     * @return The category for the file's extension, or empty when the extension is missing or unknown, or when
     * the name is nothing but an extension (such as {@code .pdf}).
     */
    public Optional<FileCategory> resolve(final String fileName) {
        if (!StringUtils.hasText(fileName)) {
            return Optional.empty();
        }
        final String name = FilenameUtils.getName(fileName);
        if (!StringUtils.hasText(FilenameUtils.getBaseName(name))) {
            log.trace("Rejected '{}': no base name.", fileName);
            return Optional.empty();
        }
        final String extension = FilenameUtils.getExtension(name).toLowerCase(Locale.ROOT);
        final Optional<FileCategory> category = Optional.ofNullable(categoriesByExtension.get(extension));
        log.trace("Resolved '{}' (extension '{}') to {}", fileName, extension, category.map(FileCategory::getValue).orElse("unsupported"));
        return category;
    }

    /**
     * Like {@link #resolve(String)}, but an unsupported file is a client error.
     *
     * @throws UnsupportedFileTypeException if the extension is not supported.
     */
    public FileCategory require(final String fileName) {
        final Optional<FileCategory> category = resolve(fileName);
        if (category.isPresent()) {
            return category.get();
        }
        final String name = FilenameUtils.getName(fileName);
        final String extension = FilenameUtils.getExtension(name);
        if (!StringUtils.hasText(extension) || !StringUtils.hasText(FilenameUtils.getBaseName(name))) {
            throw new UnsupportedFileTypeException("Unsupported file type: '" + fileName + "' has no extension");
        }
        throw new UnsupportedFileTypeException("Unsupported file type: ." + extension);
    }

    /**
     * The extensions accepted by a category, with leading dots, for error messages.
     */
    public String describe(final FileCategory category) {
        return category.getExtensions().stream().sorted().map(ext -> "." + ext)
                .collect(Collectors.joining(", "));
    }
}
