package com.scholary.video.transcriber.config;

import com.scholary.video.transcriber.google.GoogleSpeechProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Google Speech-to-Text client.
 *
 * <p>Enables the GoogleSpeechProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(GoogleSpeechProperties.class)
public class GoogleSpeechConfig {}
