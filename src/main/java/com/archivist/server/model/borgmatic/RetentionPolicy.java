package com.archivist.server.model.borgmatic;

import com.archivist.server.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class RetentionPolicy {

    @JsonProperty("keep_daily")
    private int keepDaily = 7;

    @JsonProperty("keep_weekly")
    private int keepWeekly = 4;

    @JsonProperty("keep_monthly")
    private int keepMonthly = 6;

    @JsonProperty("keep_yearly")
    private int keepYearly = 1;

    public static RetentionPolicy defaultPolicy() {
        return new RetentionPolicy();
    }

    public void validate() throws ValidationException {
        if (keepDaily < 0 || keepWeekly < 0 || keepMonthly < 0 || keepYearly < 0) {
            throw new ValidationException("retention policy is invalid. keep values must not be negative. " +
                    "policy is %s".formatted(this));
        }
        if (keepDaily + keepWeekly + keepMonthly + keepYearly == 0) {
            throw new ValidationException("retention policy is invalid. at least one keep value is required.");
        }
    }
}
