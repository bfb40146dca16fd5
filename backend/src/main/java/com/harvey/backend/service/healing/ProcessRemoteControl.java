package com.harvey.backend.service.healing;

import com.harvey.backend.config.HealingProperties;
import com.harvey.backend.util.CommandRunner;
import com.harvey.backend.util.CommandRunner.CommandResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Remote control backed by a local command template, by default
 * {@code ssh <host> sudo systemctl {action} {target}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessRemoteControl implements RemoteControl {

    private final HealingProperties healingProperties;
    private final CommandRunner commandRunner;

    @Override
    public RemoteControlResult execute(String target, String action) {
        HealingProperties.RemoteControl config = healingProperties.getRemoteControl();
        List<String> command = config.getCommand().stream()
                .map(token -> token.replace("{target}", target).replace("{action}", action))
                .toList();
        try {
            CommandResult result = commandRunner.run(command, null, Duration.ofSeconds(config.getTimeoutSeconds()));
            if (result.timedOut()) {
                return new RemoteControlResult(false, result.stdout(),
                        "timed out after " + config.getTimeoutSeconds() + "s");
            }
            if (!result.succeeded()) {
                log.warn("Remote control failed target={} action={} exit={} stderr={}",
                        target, action, result.exitCode(), result.stderr().strip());
            }
            return new RemoteControlResult(result.succeeded(), result.stdout(), result.stderr());
        } catch (IOException e) {
            log.error("Remote control could not run target={} action={}", target, action, e);
            return RemoteControlResult.failed(e.getMessage());
        }
    }
}
