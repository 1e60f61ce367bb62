package org.liveindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LiveIndexApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(LiveIndexApplication.class, args);
    }

    /**
     * 提前创建日志目录，RollingFileAppender 不会自己创建父目录之外的路径。
     * <p>
     * 规则与 logback-spring.xml 一致：优先系统属性，其次环境变量 LOG_PATH，默认 ./logs
     */
    private static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            // 日志系统尚未初始化
            System.err.println("无法创建日志目录 " + logPath + "：" + e.getMessage());
        }
    }
}
