package com.ivirs.backend.config;

import com.ivirs.backend.service.DispatchKeyPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Runtime settings for the report pipeline, bound from {@code ivirs.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ivirs")
public class IvirsProperties {

    @Valid
    private Simulation simulation = new Simulation();
    @Valid
    private Feed feed = new Feed();
    @Valid
    private Coverage coverage = new Coverage();
    @Valid
    private Witness witness = new Witness();
    @Valid
    private Validation validation = new Validation();
    @Valid
    private Dispatch dispatch = new Dispatch();
    @Valid
    private Telemetry telemetry = new Telemetry();

    @Data
    public static class Simulation {
        /** Master toggle for the scheduled tick loop. */
        private boolean enabled = true;
        @Positive
        private long tickIntervalMs = 100;
        /** Simulated seconds per synthetic feed step. */
        @Positive
        private double stepSeconds = 1.0;
        /** The run ends once the snapshot clock passes this value. */
        @Positive
        private double maxTime = 1000.0;
        private long seed = 42L;
    }

    @Data
    public static class Feed {
        @NotNull
        private FeedMode mode = FeedMode.SYNTHETIC;
        @Min(1)
        private int pushCapacity = 1024;
        @Valid
        private Synthetic synthetic = new Synthetic();
    }

    public enum FeedMode {
        SYNTHETIC,
        PUSH
    }

    @Data
    public static class Synthetic {
        @Min(1)
        private int maxVehicles = 200;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double spawnProbability = 0.8;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double maliciousRatio = 0.1;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double emergencyRatio = 0.02;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double honestRatio = 0.6;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double breakdownProbability = 0.05;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double crashProbability = 0.03;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double fakeReportProbability = 0.8;
    }

    @Data
    public static class Coverage {
        @NotBlank
        private String layoutResource = "roadside-layout.xml";
        @Positive
        private double defaultRadius = 500.0;
    }

    @Data
    public static class Witness {
        @Positive
        private double radius = 200.0;
    }

    @Data
    public static class Validation {
        /** Validate node queues concurrently, one task per node. */
        private boolean parallel = false;
    }

    @Data
    public static class Dispatch {
        @NotNull
        private DispatchKeyPolicy keyPolicy = DispatchKeyPolicy.REPORTER_AND_TIMESTAMP;
    }

    @Data
    public static class Telemetry {
        @Min(1)
        private int statsIntervalTicks = 100;
        /** Directory for the JSON-lines logs. Blank disables file output. */
        private String outputDir = "results";
    }
}
