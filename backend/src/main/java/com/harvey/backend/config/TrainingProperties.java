package com.harvey.backend.config;

import com.harvey.backend.service.training.ModelType;
import com.harvey.backend.service.training.ValidationThreshold;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "harvey.training")
@Data
@Validated
public class TrainingProperties {

    public enum Mode { SERVER, ONCE, SCHEDULED, INCREMENTAL }

    private Mode mode = Mode.SERVER;

    private boolean force = false;

    private boolean schedulerEnabled = false;

    /** Stop the process after a one-shot CLI run. */
    private boolean exitAfterRun = true;

    @NotBlank
    private String baseDir = "/home/harvey/harvey-backend/ml_training";

    @NotBlank
    private String modelsDir = "/home/harvey/harvey-backend/ml_training/models";

    @NotBlank
    private String stagingDir = "/home/harvey/harvey-backend/ml_training/staging";

    @NotBlank
    private String backupDir = "/opt/harvey-intelligence/model-backups";

    @NotBlank
    private String metricsFile = "/home/harvey/harvey-backend/ml_training/training_metrics.json";

    @NotBlank
    private String statusFile = "/var/log/harvey/training_status.json";

    @NotBlank
    private String artifactExtension = ".pkl";

    /** Tokens of the training command; {model} and {dir} are substituted per job. */
    @NotEmpty
    private List<String> trainCommand = new ArrayList<>(List.of(
            "python", "train.py", "--model", "{model}", "--save-dir", "{dir}"));

    /** Globs of the files a backup snapshot captures. */
    @NotEmpty
    private List<String> backupPatterns = new ArrayList<>(List.of(
            "*.pkl", "*.joblib", "*.h5", "*.pt", "*.metrics.json"));

    @Valid
    private List<Model> models = new ArrayList<>();

    @Min(0)
    private int freshnessDays = 7;

    @Min(0)
    private int incrementalAgeDays = 3;

    @Positive
    private long jobTimeoutSeconds = 3600;

    @Min(0)
    private long interModelDelaySeconds = 5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double healthySuccessRate = 0.80;

    @Min(1)
    private int backupRetention = 7;

    @NotBlank
    private String inferenceService = "ml_api";

    @NotBlank
    private String trainingService = "ml_training";

    @Valid
    private Schedule schedule = new Schedule();

    @Valid
    private Notification notification = new Notification();

    @Valid
    private Validation validation = new Validation();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Model {
        @NotBlank
        private String name;

        @NotNull
        private ModelType type;
    }

    @Data
    public static class Schedule {
        private String fullCron = "0 0 2 * * *";
        private String incrementalCron = "0 0 */6 * * *";
        private String validationCron = "0 0 */12 * * *";
    }

    @Data
    public static class Notification {
        private String webhookUrl;

        @Min(1)
        private int maxAttempts = 3;

        @Min(0)
        private long retryDelayMs = 500;

        @Positive
        private int connectTimeoutMs = 5000;

        @Positive
        private int readTimeoutMs = 10000;
    }

    @Data
    public static class Validation {
        private ValidationThreshold regression = ValidationThreshold.above("test_r2", 0.70);
        private ValidationThreshold classification = ValidationThreshold.above("test_accuracy", 0.80);
        private ValidationThreshold clustering = ValidationThreshold.above("silhouette_score", 0.30);
        private ValidationThreshold anomalyDetection = ValidationThreshold.within("test_anomaly_pct", 0.05, 0.20);

        public ValidationThreshold forType(ModelType type) {
            if (type == null) {
                return null;
            }
            return switch (type) {
                case REGRESSION -> regression;
                case CLASSIFICATION -> classification;
                case CLUSTERING -> clustering;
                case ANOMALY_DETECTION -> anomalyDetection;
            };
        }
    }
}
