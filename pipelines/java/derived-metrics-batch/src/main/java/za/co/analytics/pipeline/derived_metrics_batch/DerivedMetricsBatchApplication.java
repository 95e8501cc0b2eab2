package za.co.analytics.pipeline.derived_metrics_batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DerivedMetricsBatchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DerivedMetricsBatchApplication.class, args)));
    }
}
