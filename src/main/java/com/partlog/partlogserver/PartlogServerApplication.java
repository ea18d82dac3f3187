package com.partlog.partlogserver;

import com.partlog.partlogserver.config.ChangeLogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ChangeLogProperties.class)
public class PartlogServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PartlogServerApplication.class, args);
    }

}
