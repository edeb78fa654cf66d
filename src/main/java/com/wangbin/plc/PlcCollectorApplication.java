package com.wangbin.plc;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
@Slf4j
public class PlcCollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlcCollectorApplication.class, args);
        log.info("=== PLC 采集服务启动成功 ===");
    }
}
