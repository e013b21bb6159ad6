package com.gomflow.smartagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Smart Agent Service Application
 *
 * Verifies payment proof screenshots submitted by buyers: recognizes the
 * transfer details, matches them against pending order submissions and
 * decides whether the payment can be approved without a human.
 */
@SpringBootApplication
@EnableFeignClients(basePackages = "com.gomflow.smartagent.client")
@EnableJpaRepositories(basePackages = "com.gomflow.smartagent.repository")
@ConfigurationPropertiesScan(basePackages = "com.gomflow.smartagent.config")
@EnableTransactionManagement
@EnableScheduling
public class SmartAgentServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmartAgentServiceApplication.class, args);
    }
}
