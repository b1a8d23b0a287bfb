package io.github.samzhu.tokenboard.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link TokenboardProperties} 的型別安全配置綁定，
 * 並提供 UTC {@link Clock}，讓「今天」的判斷可在測試中固定。
 *
 * @see TokenboardProperties
 */
@Configuration
@EnableConfigurationProperties(TokenboardProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
