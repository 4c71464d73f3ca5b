package com.sensor.common.config;

import com.sensor.common.store.StoreSettings;
import com.sensor.common.store.StoreTarget;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;

import java.time.Duration;

/**
 * Store connection options shared by the ETL job and the dashboard.
 * Each application binds it to {@code sensor.store.*}.
 */
@Data
public class StoreProperties {

    @NotBlank
    private String connectionTarget = "sqlite:///data/processed.db";

    /**
     * Overrides the user embedded in the connection target when set.
     */
    private String username;

    @ToString.Exclude
    private String password;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration queryTimeout = Duration.ofSeconds(30);

    @Min(1)
    private int poolSize = 5;

    @Min(1)
    private int batchSize = 500;

    public StoreTarget toTarget() {
        return StoreTarget.parse(connectionTarget).withCredentials(username, password);
    }

    public StoreSettings toSettings() {
        return new StoreSettings(connectTimeout, queryTimeout, poolSize, batchSize);
    }
}
