package io.github.drompincen.reportscheduler.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.reportscheduler")
@EnableMongoRepositories(basePackages = "io.github.drompincen.reportscheduler.persistence.repository")
public class ReportSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportSchedulerApplication.class, args);
    }
}
