package com.diplomacy.repository;

import com.diplomacy.model.PhaseLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for phase log entries.
 */
@Repository
public interface PhaseLogRepository extends JpaRepository<PhaseLogEntry, String> {

    List<PhaseLogEntry> findAllByOrderBySequenceAsc();

    @Query("SELECT COALESCE(MAX(e.sequence), 0) FROM PhaseLogEntry e")
    long findMaxSequence();
}
