package uk.gegc.reviewscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReviewSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReviewSchedulerApplication.class, args);
    }
}
