package com.monadarena;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MonadArenaApplication {
    public static void main(String[] args) {
        SpringApplication.run(MonadArenaApplication.class, args);
    }
}
