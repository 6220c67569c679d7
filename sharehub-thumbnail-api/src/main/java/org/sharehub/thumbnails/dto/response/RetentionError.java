package org.sharehub.thumbnails.dto.response;

import java.util.UUID;

public record RetentionError(UUID slideId, String storageKey, String error) {
}
