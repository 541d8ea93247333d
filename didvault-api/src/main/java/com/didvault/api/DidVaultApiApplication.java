package com.didvault.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * DIDVault API Application
 *
 * Decentralized identity registry with credential vault and two-step
 * ownership transfer.
 */
@SpringBootApplication(scanBasePackages = "com.didvault")
public class DidVaultApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(DidVaultApiApplication.class, args);
    }
}
