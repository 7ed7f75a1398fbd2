package com.archivist.server.model.api.schedule;

import lombok.Data;

@Data
public class ValidateCronRequest {

    private String minute = "*";

    private String hour = "*";

    private String dayOfMonth = "*";

    private String month = "*";

    private String dayOfWeek = "*";
}
