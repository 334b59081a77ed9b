package com.bko.gateway.agent.cli;

import com.bko.gateway.agent.AgentTurn;
import com.bko.gateway.config.GatewayProperties;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps a turn onto the agent CLI's non-interactive {@code exec} invocation.
 */
public class CliCommandBuilder {

    private final GatewayProperties.CliConfig config;

    public CliCommandBuilder(GatewayProperties.CliConfig config) {
        this.config = config;
    }

    public String executable() {
        return config.getBinary();
    }

    public List<String> build(AgentTurn turn) {
        List<String> command = new ArrayList<>();
        command.add(config.getBinary());
        command.add("exec");
        command.add("--skip-git-repo-check");
        command.add("--yolo");
        if (turn.isResume()) {
            command.add("resume");
            command.add(turn.resumeToken());
        }
        command.add(promptWithImages(turn.prompt(), turn.images()));
        if (StringUtils.hasText(turn.model())) {
            command.add("-c");
            command.add("model=" + turn.model());
        }
        if (StringUtils.hasText(config.getApprovalPolicy())) {
            command.add("-c");
            command.add("approval_policy=" + config.getApprovalPolicy());
        }
        if (StringUtils.hasText(config.getReasoningEffort())) {
            command.add("-c");
            command.add("model_reasoning_effort=" + config.getReasoningEffort());
        }
        return command;
    }

    static String promptWithImages(String prompt, List<Path> images) {
        if (images.isEmpty()) {
            return prompt;
        }
        String paths = images.stream().map(Path::toString).collect(Collectors.joining("\n"));
        return paths + "\n\n" + prompt;
    }
}
