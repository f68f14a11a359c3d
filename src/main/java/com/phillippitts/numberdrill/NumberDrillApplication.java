package com.phillippitts.numberdrill;

import com.phillippitts.numberdrill.config.properties.ValidationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ValidationProperties.class)
public class NumberDrillApplication {

    public static void main(String[] args) {
        SpringApplication.run(NumberDrillApplication.class, args);
    }

}
