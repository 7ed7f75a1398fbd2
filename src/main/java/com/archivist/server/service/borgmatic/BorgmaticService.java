package com.archivist.server.service.borgmatic;

import com.archivist.server.exception.BusinessException;
import com.archivist.server.exception.JsonException;
import com.archivist.server.exception.ResourceNotFoundException;
import com.archivist.server.exception.ValidationException;
import com.archivist.server.model.api.systeminfo.ArchivistSettings;
import com.archivist.server.model.borgmatic.BorgArchive;
import com.archivist.server.model.borgmatic.ConfigValidationResult;
import com.archivist.server.model.borgmatic.RepositoryStatus;
import com.archivist.server.model.borgmatic.RetentionPolicy;
import com.archivist.server.model.borgmatic.SystemInfo;
import com.archivist.server.model.exec.CommandResult;
import com.archivist.server.service.exec.ProcessRunner;
import com.archivist.server.util.JsonUtil;
import com.archivist.server.util.PathSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Translates backup operations into borgmatic invocations. Every externally supplied repository,
 * path or archive name is checked before a command line is built; a rejected value comes back as a
 * failed {@link CommandResult} and no process is started.
 */
@Slf4j
@Service
public class BorgmaticService {

    public static final String DEFAULT_REPOSITORY_KEY = "default";

    private static final String UNKNOWN_VERSION = "Unknown";

    private final ProcessRunner processRunner;

    private final ArchivistSettings.Borgmatic settings;

    // 正在执行 create 的 repository
    private final Set<String> runningRepositories = ConcurrentHashMap.newKeySet();

    private final ReentrantLock repositoryLock = new ReentrantLock();

    @Autowired
    public BorgmaticService(ProcessRunner processRunner, ArchivistSettings archivistSettings) {
        this.processRunner = processRunner;
        this.settings = archivistSettings.getBorgmatic();
    }

    /**
     * Runs {@code borgmatic create}. At most one backup per repository is in flight; a second call
     * for the same repository fails immediately instead of waiting.
     */
    public CommandResult runBackup(String repository, String configFile) {
        List<String> args = new ArrayList<>();
        args.add("create");
        if (StringUtils.isNotEmpty(repository)) {
            if (!PathSanitizer.validate(repository)) {
                return rejected("Invalid repository path: contains dangerous characters");
            }
            args.add("--repository");
            args.add(PathSanitizer.sanitize(repository));
        }
        if (StringUtils.isNotEmpty(configFile)) {
            if (!PathSanitizer.validate(configFile)) {
                return rejected("Invalid config file path: contains dangerous characters");
            }
            args.add("--config");
            args.add(PathSanitizer.sanitize(configFile));
        } else if (StringUtils.isNotBlank(this.settings.getConfigPath())) {
            args.add("--config");
            args.add(this.settings.getConfigPath());
        }
        String lockKey = lockKey(repository);
        List<String> lockedKeys = this.tryLock(repository);
        if (CollectionUtils.isEmpty(lockedKeys)) {
            log.warn("runBackup rejected. backup already running. repository:{}", lockKey);
            return rejected("Backup already running for repository %s".formatted(lockKey));
        }
        try {
            return this.run(args, this.settings.getBackupTimeout());
        } finally {
            this.unlock(lockedKeys);
        }
    }

    /**
     * A backup without repository covers every repository of the config file, so it conflicts with
     * any running backup.
     */
    public boolean isRepositoryBusy(String repository) {
        if (StringUtils.isBlank(repository)) {
            return !this.runningRepositories.isEmpty();
        }
        return this.runningRepositories.contains(DEFAULT_REPOSITORY_KEY) ||
                this.runningRepositories.contains(repository);
    }

    // 检查和加锁必须是一个原子操作, 全量 backup 要一次占住多个 key
    private List<String> tryLock(String repository) {
        this.repositoryLock.lock();
        try {
            if (this.isRepositoryBusy(repository)) {
                return List.of();
            }
            List<String> keys = new ArrayList<>();
            keys.add(lockKey(repository));
            if (StringUtils.isBlank(repository) && CollectionUtils.isNotEmpty(this.settings.getRepositories())) {
                keys.addAll(this.settings.getRepositories());
            }
            this.runningRepositories.addAll(keys);
            return keys;
        } finally {
            this.repositoryLock.unlock();
        }
    }

    private void unlock(List<String> keys) {
        this.repositoryLock.lock();
        try {
            keys.forEach(this.runningRepositories::remove);
        } finally {
            this.repositoryLock.unlock();
        }
    }

    public CommandResult listArchives(String repository) {
        if (!PathSanitizer.validate(repository)) {
            return rejected("Invalid repository path: contains dangerous characters");
        }
        return this.run(
                List.of("list", "--repository", PathSanitizer.sanitize(repository), "--json"),
                this.settings.getDefaultTimeout());
    }

    public CommandResult getArchiveInfo(String repository, String archive) {
        CommandResult rejected = checkRepositoryAndArchive(repository, archive);
        if (ObjectUtils.isNotEmpty(rejected)) {
            return rejected;
        }
        return this.run(
                List.of("info", "--repository", repository, "--archive", archive, "--json"),
                this.settings.getDefaultTimeout());
    }

    public CommandResult listArchiveContents(String repository, String archive, String path) {
        CommandResult rejected = checkRepositoryAndArchive(repository, archive);
        if (ObjectUtils.isNotEmpty(rejected)) {
            return rejected;
        }
        List<String> args = new ArrayList<>(List.of(
                "list", "--repository", repository, "--archive", archive, "--json"));
        if (StringUtils.isNotEmpty(path)) {
            if (!PathSanitizer.validate(path)) {
                return rejected("Invalid path: contains dangerous characters");
            }
            args.add("--path");
            args.add(path);
        }
        return this.run(args, this.settings.getDefaultTimeout());
    }

    public CommandResult extractArchive(
            String repository,
            String archive,
            List<String> paths,
            String destination,
            boolean dryRun) {
        CommandResult rejected = checkRepositoryAndArchive(repository, archive);
        if (ObjectUtils.isNotEmpty(rejected)) {
            return rejected;
        }
        if (!PathSanitizer.validate(destination)) {
            return rejected("Invalid destination path: contains dangerous characters");
        }
        List<String> args = new ArrayList<>();
        args.add("extract");
        if (dryRun) {
            args.add("--dry-run");
        }
        args.addAll(List.of("--repository", repository, "--archive", archive, "--destination", destination));
        if (CollectionUtils.isNotEmpty(paths)) {
            for (String path : paths) {
                if (!PathSanitizer.validate(path)) {
                    return rejected("Invalid path %s: contains dangerous characters".formatted(
                            PathSanitizer.sanitize(path)));
                }
                args.add("--path");
                args.add(path);
            }
        }
        return this.run(args, this.settings.getBackupTimeout());
    }

    public CommandResult deleteArchive(String repository, String archive) {
        CommandResult rejected = checkRepositoryAndArchive(repository, archive);
        if (ObjectUtils.isNotEmpty(rejected)) {
            return rejected;
        }
        return this.run(
                List.of("delete", "--repository", repository, "--archive", archive),
                this.settings.getDefaultTimeout());
    }

    public CommandResult pruneArchives(String repository, RetentionPolicy retentionPolicy)
            throws ValidationException {
        RetentionPolicy policy = ObjectUtils.defaultIfNull(retentionPolicy, RetentionPolicy.defaultPolicy());
        policy.validate();
        if (!PathSanitizer.validate(repository)) {
            return rejected("Invalid repository path: contains dangerous characters");
        }
        return this.run(
                List.of("prune",
                        "--repository", repository,
                        "--keep-daily", String.valueOf(policy.getKeepDaily()),
                        "--keep-weekly", String.valueOf(policy.getKeepWeekly()),
                        "--keep-monthly", String.valueOf(policy.getKeepMonthly()),
                        "--keep-yearly", String.valueOf(policy.getKeepYearly())),
                this.settings.getDefaultTimeout());
    }

    public CommandResult checkRepository(String repository) {
        if (!PathSanitizer.validate(repository)) {
            return rejected("Invalid repository path: contains dangerous characters");
        }
        return this.run(List.of("check", "--repository", repository), this.settings.getDefaultTimeout());
    }

    public CommandResult compactRepository(String repository) {
        if (!PathSanitizer.validate(repository)) {
            return rejected("Invalid repository path: contains dangerous characters");
        }
        return this.run(List.of("compact", "--repository", repository), this.settings.getDefaultTimeout());
    }

    /**
     * Lists archives of every configured repository. A repository whose listing fails or cannot be
     * parsed is reported with status error; the others are still reported.
     */
    public List<RepositoryStatus> getRepositoryStatus() {
        List<RepositoryStatus> result = new ArrayList<>();
        List<String> repositories = this.settings.getRepositories();
        if (CollectionUtils.isEmpty(repositories)) {
            return result;
        }
        for (String repository : repositories) {
            RepositoryStatus repositoryStatus;
            try {
                repositoryStatus = this.getSingleRepositoryStatus(repository);
            } catch (RuntimeException e) {
                log.warn("getRepositoryStatus failed. repository:{}", repository, e);
                repositoryStatus = RepositoryStatus.error(repository, e.getMessage());
            }
            repositoryStatus.setBackupRunning(this.isRepositoryBusy(repository));
            result.add(repositoryStatus);
        }
        return result;
    }

    private RepositoryStatus getSingleRepositoryStatus(String repository) throws JsonException {
        CommandResult listResult = this.listArchives(repository);
        if (!listResult.isSuccess()) {
            return RepositoryStatus.error(repository, listResult.getStderr());
        }
        List<BorgArchive> archives = BorgmaticParser.flattenArchives(
                BorgmaticParser.parseListings(listResult.getStdout()));
        return RepositoryStatus.healthy(
                repository,
                archives.size(),
                BorgmaticParser.latestArchiveTime(archives));
    }

    public Map<String, Object> getConfigInfo() throws ResourceNotFoundException, JsonException {
        String configPath = this.settings.getConfigPath();
        if (StringUtils.isBlank(configPath) || !Files.isRegularFile(Path.of(configPath))) {
            throw new ResourceNotFoundException("getConfigInfo failed. configuration file not found. " +
                    "configPath is %s".formatted(configPath));
        }
        return JsonUtil.readYamlFile(Path.of(configPath));
    }

    /**
     * Runs {@code borgmatic config validate} against {@code content} written to a temporary file.
     * The temporary file is always removed.
     */
    public ConfigValidationResult validateConfig(String content) throws ValidationException, BusinessException {
        if (StringUtils.isBlank(content)) {
            throw new ValidationException("validateConfig failed. content is blank");
        }
        Path tempFile;
        try {
            tempFile = Files.createTempFile("borgmatic-config-", ".yaml");
            Files.writeString(tempFile, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BusinessException("validateConfig failed. can't write temporary config file.", e);
        }
        try {
            CommandResult validateResult = this.run(
                    List.of("config", "validate", "--config", tempFile.toString()),
                    this.settings.getValidateTimeout());
            ConfigValidationResult result = BorgmaticParser.classifyValidationOutput(
                    validateResult.isSuccess(),
                    validateResult.getStdout(),
                    validateResult.getStderr(),
                    tempFile.toString());
            if (result.isValid()) {
                result.setConfig(JsonUtil.parseYamlString(content));
            }
            return result;
        } finally {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException e) {
                log.warn("validateConfig. can't delete temporary config file {}", tempFile, e);
            }
        }
    }

    public CommandResult getVersion() {
        return this.run(List.of("--version"), this.settings.getDefaultTimeout());
    }

    public SystemInfo getSystemInfo() {
        CommandResult versionResult = this.getVersion();
        CommandResult helpResult = this.run(List.of("--help"), this.settings.getDefaultTimeout());
        SystemInfo systemInfo = new SystemInfo();
        systemInfo.setBorgmaticVersion(versionResult.isSuccess() ?
                versionResult.getStdout().trim() :
                UNKNOWN_VERSION);
        systemInfo.setConfigPath(this.settings.getConfigPath());
        systemInfo.setBackupPath(this.settings.getBackupPath());
        systemInfo.setHelpAvailable(helpResult.isSuccess());
        return systemInfo;
    }

    private CommandResult run(List<String> args, Duration timeout) {
        return this.processRunner.execute(
                this.settings.getExecutable(),
                args,
                null,
                this.settings.getBackupPath(),
                timeout);
    }

    private static CommandResult checkRepositoryAndArchive(String repository, String archive) {
        if (!PathSanitizer.validate(repository)) {
            return rejected("Invalid repository path: contains dangerous characters");
        }
        if (!PathSanitizer.validateArgument(archive)) {
            return rejected("Invalid archive name: contains dangerous characters");
        }
        return null;
    }

    private static CommandResult rejected(String message) {
        return CommandResult.failed(message);
    }

    private static String lockKey(String repository) {
        return StringUtils.isBlank(repository) ? DEFAULT_REPOSITORY_KEY : repository;
    }
}
