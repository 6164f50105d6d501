package com.wpanther.credentialregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CredentialRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(CredentialRegistryApplication.class, args);
    }
}
