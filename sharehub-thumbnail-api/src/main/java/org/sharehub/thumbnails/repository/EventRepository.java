package org.sharehub.thumbnails.repository;

import org.sharehub.thumbnails.entity.Event;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import java.util.UUID;

public interface EventRepository extends ReactiveCrudRepository<Event, UUID> {
}
