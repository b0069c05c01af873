package io.github.drompincen.reportscheduler.persistence.repository;

import io.github.drompincen.reportscheduler.persistence.document.ReportRunDocument;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface ReportRunRepository extends MongoRepository<ReportRunDocument, String> {
    Page<ReportRunDocument> findByScheduleIdOrderByFiredAtDesc(String scheduleId, Pageable pageable);
    Page<ReportRunDocument> findAllByOrderByFiredAtDesc(Pageable pageable);
    List<ReportRunDocument> findByFiredAtBetween(Instant from, Instant to);
}
