package com.bko.gateway.agent.sdk;

import com.bko.gateway.agent.AgentBackend;
import com.bko.gateway.agent.AgentKind;
import com.bko.gateway.agent.AgentTurn;
import com.bko.gateway.cancel.CancellationToken;
import com.bko.gateway.stream.EventSink;
import com.bko.gateway.stream.GenerationEvents;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.memory.ChatMemory;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Sinks;

import java.nio.file.Path;

/**
 * Runs a turn through a Spring AI chat model. The conversation is remembered under the gateway session id, which
 * doubles as the resume token for the next turn.
 */
@Component
@Slf4j
public class SdkAgentBackend implements AgentBackend {

    private final ObjectProvider<ChatClient> chatClientProvider;
    private final GenerationEvents events;

    public SdkAgentBackend(ObjectProvider<ChatClient> chatClientProvider, GenerationEvents events) {
        this.chatClientProvider = chatClientProvider;
        this.events = events;
    }

    @Override
    public AgentKind kind() {
        return AgentKind.SDK;
    }

    @Override
    public void run(AgentTurn turn, EventSink sink) {
        if (turn.cancellation().isCancelled()) {
            return;
        }
        ChatClient chatClient = chatClientProvider.getIfAvailable();
        if (chatClient == null) {
            throw new IllegalStateException("No chat model is configured. "
                    + "Check that spring.ai.openai.api-key is set.");
        }
        String conversationId = turn.isResume() ? turn.resumeToken() : turn.sessionId();
        if (!turn.isResume()) {
            turn.internalSessionIdListener().accept(conversationId);
        }
        sink.emit(events.sdkInit(conversationId, turn.model()));

        Sinks.Empty<Void> cancelled = Sinks.empty();
        CancellationToken.Registration registration = turn.cancellation().onCancel(cancelled::tryEmitEmpty);
        StringBuilder content = new StringBuilder();
        try {
            requestSpec(chatClient, turn, conversationId)
                    .stream()
                    .content()
                    .takeUntilOther(cancelled.asMono())
                    .doOnNext(chunk -> {
                        content.append(chunk);
                        sink.emit(events.assistantChunk(conversationId, chunk));
                    })
                    .blockLast();
        } finally {
            registration.remove();
        }
        if (turn.cancellation().isCancelled()) {
            log.info("Chat turn for session {} cancelled after {} characters", turn.sessionId(), content.length());
            return;
        }
        sink.emit(events.result(conversationId, content.toString()));
    }

    private ChatClient.ChatClientRequestSpec requestSpec(ChatClient chatClient, AgentTurn turn, String conversationId) {
        var spec = chatClient.prompt()
                .advisors(advisor -> advisor.param(ChatMemory.CONVERSATION_ID, conversationId))
                .user(user -> {
                    user.text(turn.prompt());
                    for (Path image : turn.images()) {
                        FileSystemResource resource = new FileSystemResource(image);
                        MediaType mediaType = MediaTypeFactory.getMediaType(resource)
                                .orElse(MediaType.APPLICATION_OCTET_STREAM);
                        user.media(mediaType, resource);
                    }
                });
        if (StringUtils.hasText(turn.model())) {
            spec = spec.options(OpenAiChatOptions.builder().model(turn.model()).build());
        }
        return spec;
    }
}
