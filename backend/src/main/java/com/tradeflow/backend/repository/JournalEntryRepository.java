package com.tradeflow.backend.repository;

import com.tradeflow.backend.entity.JournalEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JournalEntryRepository extends JpaRepository<JournalEntry, Long> {
    List<JournalEntry> findByReferenceIdOrderByRecordedAtAsc(String referenceId);
}
