package com.survey.codeframe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeframeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeframeApplication.class, args);
    }
}
