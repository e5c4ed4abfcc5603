package com.adlanda.citedsearch.service.generation;

import com.adlanda.citedsearch.exception.GenerationException;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * {@link GenerationClient} backed by Spring AI's streaming {@link ChatModel}.
 */
@Service
public class SpringAiGenerationClient implements GenerationClient {

    private final ChatModel chatModel;

    public SpringAiGenerationClient(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public Flux<String> generate(String prompt) {
        return Flux.defer(() -> chatModel.stream(new Prompt(prompt)))
                .mapNotNull(SpringAiGenerationClient::deltaText)
                .onErrorMap(e -> !(e instanceof GenerationException),
                        e -> new GenerationException("Generation failed: " + e.getMessage(), e));
    }

    private static String deltaText(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return null;
        }
        return response.getResult().getOutput().getText();
    }
}
