package com.cardvault;

import com.cardvault.common.config.PhotoProperties;
import com.cardvault.common.config.StoreProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({StoreProperties.class, PhotoProperties.class})
public class CardVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(CardVaultApplication.class, args);
    }
}
