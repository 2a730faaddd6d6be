package com.shepherd.ai.impl;

import com.shepherd.ai.AbstractTextAnalysisClient;
import com.shepherd.error.AnalysisServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/** Analysis through a Spring AI {@link ChatModel}: persona as system message, task as user message. */
@Slf4j
public class ChatModelAnalysisClient extends AbstractTextAnalysisClient {

    private final ChatModel chatModel;

    public ChatModelAnalysisClient(ChatModel chatModel, boolean reformatMalformed, boolean verbose) {
        super(reformatMalformed, verbose);
        this.chatModel = chatModel;
    }

    @Override
    protected String backendName() {
        return "ChatModel";
    }

    @Override
    protected Mono<String> complete(String persona, String prompt) {
        return Mono.fromCallable(() -> {
                    Prompt p = new Prompt(List.of(new SystemMessage(persona), new UserMessage(prompt)));
                    ChatResponse resp = chatModel.call(p);
                    if (resp == null || resp.getResult() == null || resp.getResult().getOutput() == null) {
                        throw new AnalysisServiceException("Chat model returned no result");
                    }
                    String text = resp.getResult().getOutput().getText();
                    log.debug("[ChatModel] answer ({} chars)", text == null ? 0 : text.length());
                    return text == null ? "" : text.strip();
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
