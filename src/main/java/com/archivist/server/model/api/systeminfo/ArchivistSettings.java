package com.archivist.server.model.api.systeminfo;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("archivist.server")
@Component
@Data
@NoArgsConstructor
public class ArchivistSettings {

    private Borgmatic borgmatic = new Borgmatic();

    private Scheduler scheduler = new Scheduler();

    private Events events = new Events();

    @Data
    public static class Borgmatic {
        private String executable = "borgmatic";

        // 可信的默认配置文件, 不经过 PathSanitizer
        private String configPath = "/etc/borgmatic/config.yaml";

        // 所有命令的工作目录, 相对路径的 repository 在其下解析
        private String backupPath = "/backups";

        private List<String> repositories = new ArrayList<>();

        private long defaultTimeoutSec = 300;

        private long backupTimeoutSec = 3600;

        private long validateTimeoutSec = 30;

        public Duration getDefaultTimeout() {
            return Duration.ofSeconds(this.defaultTimeoutSec);
        }

        public Duration getBackupTimeout() {
            return Duration.ofSeconds(this.backupTimeoutSec);
        }

        public Duration getValidateTimeout() {
            return Duration.ofSeconds(this.validateTimeoutSec);
        }
    }

    @Data
    public static class Scheduler {
        @JsonSerialize(using = ToStringSerializer.class)
        private Long pollIntervalMillis = 60_000L;

        @JsonSerialize(using = ToStringSerializer.class)
        private Long initialDelayMillis = 10_000L;
    }

    @Data
    public static class Events {
        private long keepaliveSec = 30;

        private int queueCapacity = 1000;

        @JsonSerialize(using = ToStringSerializer.class)
        private Long systemStatusIntervalMillis = 30_000L;

        public Duration getKeepalive() {
            return Duration.ofSeconds(this.keepaliveSec);
        }
    }
}
