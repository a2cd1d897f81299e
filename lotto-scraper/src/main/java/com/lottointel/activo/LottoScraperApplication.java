package com.lottointel.activo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class LottoScraperApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(LottoScraperApplication.class, args)));
    }
}
