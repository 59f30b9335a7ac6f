package com.csd.reqaudit;

import com.csd.reqaudit.cli.CliScanRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class RequirementsAuditApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(RequirementsAuditApplication.class, args);
        if (!context.getBeansOfType(CliScanRunner.class).isEmpty()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
