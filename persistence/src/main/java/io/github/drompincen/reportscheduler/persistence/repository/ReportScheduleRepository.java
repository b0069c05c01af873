package io.github.drompincen.reportscheduler.persistence.repository;

import io.github.drompincen.reportscheduler.persistence.document.ReportScheduleDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ReportScheduleRepository extends MongoRepository<ReportScheduleDocument, String> {
    List<ReportScheduleDocument> findAllByOrderByCreatedAtDesc();
    List<ReportScheduleDocument> findByEnabledOrderByCreatedAtDesc(boolean enabled);
    List<ReportScheduleDocument> findByErrorStateTrue();
}
