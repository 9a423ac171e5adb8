package org.ifcserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class McpServerApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(McpServerApplication.class, args);
    }

    /**
     * 提前创建日志目录（logback 的 RollingFileAppender 不会自行创建缺失的父目录链）。
     * <p>
     * 规则与 logback-spring.xml 一致：优先读取系统属性/环境变量 LOG_PATH，默认 ./logs
     */
    static Path ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        Path dir = Path.of(logPath);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            // stdout 承载 MCP 协议，只能写 stderr
            System.err.println("Failed to create log directory " + dir + ": " + e.getMessage());
        }
        return dir;
    }
}
