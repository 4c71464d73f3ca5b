package com.sensor.dashboard.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "sensor.dashboard")
public class DashboardProperties {

    @NotBlank
    @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*", message = "must be a plain SQL identifier")
    private String tableName = "sensor_data";
}
