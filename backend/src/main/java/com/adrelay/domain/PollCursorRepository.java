package com.adrelay.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for poll_cursors, one document per receiving address.
 */
public interface PollCursorRepository extends MongoRepository<PollCursor, String>, PollCursorRepositoryCustom {

    Optional<PollCursor> findByReceivingAddress(String receivingAddress);
}
