package com.williamcallahan.setforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SetForgeApplication {

    public static void main(String[] args) {
        // Disable Netty native OpenSSL (tcnative) to avoid Alpine musl segfaults
        System.setProperty("io.netty.handler.ssl.noOpenSsl", "true");
        SpringApplication.run(SetForgeApplication.class, args);
    }
}
