package com.work.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口：定时扫描配置的 channel，并提供手动扫描的 REST 接口。
 */
@SpringBootApplication
@EnableScheduling
public class RelayerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayerApplication.class, args);
    }
}
