package org.sharehub.thumbnails.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Source formats accepted for thumbnail generation, with the CloudConvert engine used for each.
 */
@Getter
@RequiredArgsConstructor
public enum InputFormat {

    PPT("application/vnd.ms-powerpoint", "ppt", "libreoffice"),
    PPTX("application/vnd.openxmlformats-officedocument.presentationml.presentation", "pptx", "office"),
    PDF("application/pdf", "pdf", "graphicsmagick");

    private final String mimeType;
    private final String extension;
    private final String engine;

    public static Optional<InputFormat> fromMimeType(String mimeType) {
        if (mimeType == null) {
            return Optional.empty();
        }
        String normalized = mimeType.trim().toLowerCase();
        int parameters = normalized.indexOf(';');
        String base = parameters >= 0 ? normalized.substring(0, parameters).trim() : normalized;
        return Arrays.stream(values())
                .filter(format -> format.mimeType.equals(base))
                .findFirst();
    }

    public static boolean isSupported(String mimeType) {
        return fromMimeType(mimeType).isPresent();
    }
}
