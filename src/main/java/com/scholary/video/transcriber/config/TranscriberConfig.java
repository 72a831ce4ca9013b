package com.scholary.video.transcriber.config;

import com.scholary.video.transcriber.download.DownloaderProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for job processing beans.
 *
 * <p>Enables the TranscriberProperties and DownloaderProperties to be loaded from
 * application.yml.
 */
@Configuration
@EnableConfigurationProperties({TranscriberProperties.class, DownloaderProperties.class})
public class TranscriberConfig {}
