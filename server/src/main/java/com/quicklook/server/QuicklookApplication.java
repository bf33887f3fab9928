package com.quicklook.server;

import com.quicklook.server.config.ConfigResolver;
import com.quicklook.server.config.QuicklookConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class QuicklookApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuicklookApplication.class, args);
    }

    @Bean
    public QuicklookConfig quicklookConfig() {
        return ConfigResolver.resolve();
    }
}
