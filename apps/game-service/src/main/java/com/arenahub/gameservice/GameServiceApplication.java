package com.arenahub.gameservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * game-service 启动入口。
 * 通过 @ConfigurationPropertiesScan 启用 arena.* 配置绑定。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GameServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameServiceApplication.class, args);
    }
}
