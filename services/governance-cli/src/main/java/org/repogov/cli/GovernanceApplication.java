package org.repogov.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GovernanceApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GovernanceApplication.class, args)));
    }
}
