package com.archivist.server.util;

import com.archivist.server.exception.ValidationException;
import com.archivist.server.model.api.schedule.CreateScheduledJobRequest;
import com.archivist.server.model.api.schedule.UpdateScheduledJobRequest;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

public class EntityValidationUtil {

    private static final int MAX_NAME_LENGTH = 255;

    public static void isCreateScheduledJobRequestValid(
            CreateScheduledJobRequest createScheduledJobRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(createScheduledJobRequest)) {
            throw new ValidationException("isCreateScheduledJobRequestValid failed. " +
                    "createScheduledJobRequest is null");
        }
        if (StringUtils.isAnyBlank(
                createScheduledJobRequest.getName(),
                createScheduledJobRequest.getCronExpression())) {
            throw new ValidationException("isCreateScheduledJobRequestValid failed. " +
                    "name:%s or cronExpression:%s is null".formatted(
                            createScheduledJobRequest.getName(),
                            createScheduledJobRequest.getCronExpression()));
        }
        isNameValid(createScheduledJobRequest.getName());
        // 非法 cron 在入库前拒绝
        CronUtil.parse(createScheduledJobRequest.getCronExpression());
        isOptionalPathValid("repository", createScheduledJobRequest.getRepository());
        isOptionalPathValid("configFile", createScheduledJobRequest.getConfigFile());
    }

    public static void isUpdateScheduledJobRequestValid(
            UpdateScheduledJobRequest updateScheduledJobRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(updateScheduledJobRequest)) {
            throw new ValidationException("isUpdateScheduledJobRequestValid failed. " +
                    "updateScheduledJobRequest is null");
        }
        if (ObjectUtils.isNotEmpty(updateScheduledJobRequest.getName())) {
            isNameValid(updateScheduledJobRequest.getName());
        }
        if (ObjectUtils.isNotEmpty(updateScheduledJobRequest.getCronExpression())) {
            CronUtil.parse(updateScheduledJobRequest.getCronExpression());
        }
        isOptionalPathValid("repository", updateScheduledJobRequest.getRepository());
        isOptionalPathValid("configFile", updateScheduledJobRequest.getConfigFile());
    }

    private static void isNameValid(String name) throws ValidationException {
        if (StringUtils.isBlank(name) || name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("isNameValid failed. name must be 1 to %s characters. name is %s"
                    .formatted(MAX_NAME_LENGTH, name));
        }
    }

    private static void isOptionalPathValid(String field, String path) throws ValidationException {
        if (StringUtils.isEmpty(path)) {
            return;
        }
        if (!PathSanitizer.validate(path)) {
            throw new ValidationException("isOptionalPathValid failed. %s contains dangerous characters. %s is %s"
                    .formatted(field, field, PathSanitizer.sanitize(path)));
        }
    }
}
