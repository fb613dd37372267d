package com.example.PolicyDesk.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class AiConfig {

    private static final Logger log = LoggerFactory.getLogger(AiConfig.class);

    /**
     * Builds one ChatClient per available ChatModel.
     * DeepSeek is the default; OpenAI is the alternative.
     * A missing API key in some envs only removes that model from the registry,
     * the app still starts and answers with the apology message.
     */
    @Bean
    public ChatClientRegistry chatClientRegistry(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        Map<String, ChatClient> clients = new LinkedHashMap<>();
        deepSeekProvider.ifAvailable(model -> clients.put("deepseek", ChatClient.builder(model).build()));
        openAiProvider.ifAvailable(model -> clients.put("openai", ChatClient.builder(model).build()));

        if (clients.isEmpty()) {
            log.warn("No ChatModel beans are available; every question will be answered with the apology message");
        } else {
            log.info("Registered chat clients: {}", clients.keySet());
        }
        return new ChatClientRegistry(clients);
    }
}
