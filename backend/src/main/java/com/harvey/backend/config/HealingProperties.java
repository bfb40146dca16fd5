package com.harvey.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
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
@ConfigurationProperties(prefix = "harvey.healing")
@Data
@Validated
public class HealingProperties {

    @Valid
    private Monitor monitor = new Monitor();

    @Valid
    private RemoteControl remoteControl = new RemoteControl();

    @Valid
    private Probe probe = new Probe();

    /**
     * Upper bound on how long a recovery waits for another restart of the same service.
     */
    @Min(0)
    private long lockWaitSeconds = 120;

    @Valid
    private List<Service> services = new ArrayList<>();

    @Data
    public static class Monitor {
        private boolean enabled = true;

        @Positive
        private long intervalSeconds = 60;

        @Positive
        private long cooldownSeconds = 60;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double recoveryThreshold = 0.5;
    }

    @Data
    public static class RemoteControl {
        /**
         * Command tokens; {target} and {action} are substituted per call.
         */
        @NotEmpty
        private List<String> command = new ArrayList<>(List.of(
                "ssh", "azureuser@localhost", "sudo systemctl {action} {target}"));

        @Positive
        private long timeoutSeconds = 30;
    }

    @Data
    public static class Probe {
        @Positive
        private int connectTimeoutMs = 5000;

        @Positive
        private int readTimeoutMs = 5000;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Service {
        @NotBlank
        private String name;

        @Min(1)
        private int failureThreshold = 5;

        @Min(0)
        private long timeoutSeconds = 60;

        /** Unit handed to the remote control, e.g. harvey-ml or harvey-ml-training.timer. */
        private String target;

        private String action = "restart";

        @Min(0)
        private long settleSeconds = 0;

        /** Probed after the settle delay; blank means the remote-control result decides. */
        private String healthUrl;
    }
}
