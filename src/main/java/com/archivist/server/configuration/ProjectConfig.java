package com.archivist.server.configuration;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;

@Configuration
public class ProjectConfig implements WebMvcConfigurer {

    private final ThreadPoolTaskExecutor eventStreamExecutor;

    @Autowired
    public ProjectConfig(@Qualifier("eventStreamExecutor") ThreadPoolTaskExecutor eventStreamExecutor) {
        this.eventStreamExecutor = eventStreamExecutor;
    }

    // 所有 "now" 都从这里取, 测试中替换为固定时钟
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setTaskExecutor(this.eventStreamExecutor);
        // SSE 连接不超时, 由 keepalive 维持
        configurer.setDefaultTimeout(-1);
    }
}
