package org.showvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@EnableAsync
@SpringBootApplication
public class ShowvaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShowvaultApplication.class, args);
    }
}
