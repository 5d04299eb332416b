package com.bbthechange.moments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MomentsUploadApplication {

    public static void main(String[] args) {
        SpringApplication.run(MomentsUploadApplication.class, args);
    }
}
