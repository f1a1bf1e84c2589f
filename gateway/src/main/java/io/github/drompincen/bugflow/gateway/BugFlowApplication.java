package io.github.drompincen.bugflow.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.bugflow")
@EnableMongoRepositories(basePackages = "io.github.drompincen.bugflow.persistence.repository")
public class BugFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(BugFlowApplication.class, args);
    }
}
