package com.sporty.qcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QCacheApplication {
    public static void main(final String[] args) {
        SpringApplication.run(QCacheApplication.class, args);
    }
}
