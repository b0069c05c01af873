package io.github.drompincen.reportscheduler.runtime.store;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.reportscheduler.persistence.document.ReportScheduleDocument;
import io.github.drompincen.reportscheduler.runtime.scheduler.OutcomeWrite;
import io.github.drompincen.reportscheduler.runtime.scheduler.Schedule;
import io.github.drompincen.reportscheduler.runtime.scheduler.ScheduleStore;
import io.github.drompincen.reportscheduler.runtime.scheduler.ScheduleUpdate;
import io.github.drompincen.reportscheduler.runtime.scheduler.SchedulerProperties;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * {@link ScheduleStore} on the {@code report_schedules} collection. Every mutation is a conditional
 * {@code updateFirst}, so concurrent instances never overwrite each other's claims.
 */
@Component
public class MongoScheduleStore implements ScheduleStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    private final String instanceId;
    private final Duration claimLease;

    public MongoScheduleStore(MongoTemplate mongoTemplate, Clock clock, SchedulerProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
        this.instanceId = properties.instanceId();
        this.claimLease = properties.claimLease();
    }

    @Override
    public List<Schedule> fetchDue(Instant now) {
        Query query = new Query(Criteria.where("enabled").is(true)
                .and("errorState").ne(true)
                .and("nextRun").lte(now)
                .orOperator(claimFree(now)))
                .with(Sort.by(Sort.Direction.ASC, "nextRun"));
        return mongoTemplate.find(query, ReportScheduleDocument.class).stream()
                .map(ScheduleMapper::toSchedule)
                .toList();
    }

    @Override
    public List<Schedule> fetchUninitialized(int limit) {
        Query query = new Query(Criteria.where("enabled").is(true)
                .and("errorState").ne(true)
                .and("nextRun").is(null))
                .limit(limit);
        return mongoTemplate.find(query, ReportScheduleDocument.class).stream()
                .map(ScheduleMapper::toSchedule)
                .toList();
    }

    @Override
    public boolean claim(String scheduleId, Instant expectedNextRun) {
        Instant now = clock.instant();
        Query query = new Query(Criteria.where("_id").is(scheduleId)
                .and("enabled").is(true)
                .and("errorState").ne(true)
                .and("nextRun").is(expectedNextRun)
                .orOperator(claimFree(now)));
        Update update = new Update()
                .set("claimOwner", instanceId)
                .set("claimLeaseUntil", now.plus(claimLease))
                .inc("version", 1);
        UpdateResult result = mongoTemplate.updateFirst(query, update, ReportScheduleDocument.class);
        return result.getModifiedCount() == 1;
    }

    @Override
    public boolean renewClaim(String scheduleId) {
        Query query = new Query(Criteria.where("_id").is(scheduleId).and("claimOwner").is(instanceId));
        Update update = new Update().set("claimLeaseUntil", clock.instant().plus(claimLease));
        return mongoTemplate.updateFirst(query, update, ReportScheduleDocument.class).getModifiedCount() == 1;
    }

    @Override
    public OutcomeWrite update(String scheduleId, ScheduleUpdate outcome) {
        Query stillClaimed = new Query(Criteria.where("_id").is(scheduleId)
                .and("claimOwner").is(instanceId)
                .and("enabled").is(true)
                .and("nextRun").is(outcome.claimedNextRun()));
        Update advance = runRecorded(outcome)
                .set("nextRun", outcome.nextRun())
                .set("errorState", outcome.errorState())
                .unset("claimOwner")
                .unset("claimLeaseUntil");
        if (matched(stillClaimed, advance)) {
            return OutcomeWrite.APPLIED;
        }

        // disabled, rescheduled or triggered while rendering: the stored nextRun wins
        Query ownClaim = new Query(Criteria.where("_id").is(scheduleId).and("claimOwner").is(instanceId));
        Update release = runRecorded(outcome)
                .unset("claimOwner")
                .unset("claimLeaseUntil");
        if (matched(ownClaim, release)) {
            return OutcomeWrite.NEXT_RUN_KEPT;
        }

        if (matched(new Query(Criteria.where("_id").is(scheduleId)), runRecorded(outcome))) {
            return OutcomeWrite.CLAIM_LOST;
        }
        return OutcomeWrite.MISSING;
    }

    @Override
    public boolean flagError(String scheduleId, Instant expectedNextRun, String error) {
        Query query = new Query(Criteria.where("_id").is(scheduleId).and("nextRun").is(expectedNextRun));
        Update update = new Update()
                .set("errorState", true)
                .set("lastError", error)
                .set("updatedAt", clock.instant())
                .inc("version", 1);
        return matched(query, update);
    }

    @Override
    public boolean initializeNextRun(String scheduleId, Instant nextRun) {
        Query query = new Query(Criteria.where("_id").is(scheduleId)
                .and("enabled").is(true)
                .and("nextRun").is(null));
        Update update = new Update()
                .set("nextRun", nextRun)
                .set("updatedAt", clock.instant())
                .inc("version", 1);
        return mongoTemplate.updateFirst(query, update, ReportScheduleDocument.class).getModifiedCount() == 1;
    }

    private Update runRecorded(ScheduleUpdate outcome) {
        Update update = new Update()
                .inc("runCount", 1)
                .max("lastRun", outcome.lastRun())
                .set("updatedAt", clock.instant())
                .inc("version", 1);
        if (outcome.failed()) {
            update.inc("failureCount", 1);
        }
        if (outcome.lastError() != null) {
            update.set("lastError", outcome.lastError());
        } else {
            update.unset("lastError");
        }
        return update;
    }

    private boolean matched(Query query, Update update) {
        return mongoTemplate.updateFirst(query, update, ReportScheduleDocument.class).getMatchedCount() == 1;
    }

    private static Criteria[] claimFree(Instant now) {
        return new Criteria[]{
                Criteria.where("claimOwner").is(null),
                Criteria.where("claimLeaseUntil").lt(now)
        };
    }
}
