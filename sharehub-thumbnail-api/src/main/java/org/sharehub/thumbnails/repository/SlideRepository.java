package org.sharehub.thumbnails.repository;

import org.sharehub.thumbnails.entity.Slide;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import java.util.UUID;

public interface SlideRepository extends ReactiveCrudRepository<Slide, UUID> {
}
