package com.scholary.video.transcriber.config;

import com.scholary.video.transcriber.whisper.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for Whisper client.
 *
 * <p>Enables the WhisperProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(WhisperProperties.class)
public class WhisperConfig {}
