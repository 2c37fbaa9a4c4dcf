package com.work.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口：装配各链的 nonce / pending / gas / watcher 组件。
 */
@SpringBootApplication
@EnableScheduling
public class TxGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(TxGatewayApplication.class, args);
    }
}
