package com.jguard.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SecretsConfig {

    @Value("${vcap.services.jguard-secrets.credentials.discord-bot-token:}")
    private String discordBotToken;

    public String getDiscordBotToken() { return discordBotToken; }
}
