package com.phillippitts.makeready;

import com.phillippitts.makeready.config.properties.ReportProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ReportProperties.class
})
public class MakeReadyApplication {

    public static void main(String[] args) {
        SpringApplication.run(MakeReadyApplication.class, args);
    }

}
