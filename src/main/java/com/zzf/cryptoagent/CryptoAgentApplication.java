package com.zzf.cryptoagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CryptoAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(CryptoAgentApplication.class, args);
    }
}
