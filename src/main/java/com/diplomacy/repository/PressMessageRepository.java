package com.diplomacy.repository;

import com.diplomacy.model.PressMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for press messages.
 */
@Repository
public interface PressMessageRepository extends JpaRepository<PressMessage, String> {

    List<PressMessage> findByRecipientOrderBySentAtAsc(String recipient);
}
