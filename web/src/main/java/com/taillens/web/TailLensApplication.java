/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.taillens")
public class TailLensApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(TailLensApplication.class);
        app.setRegisterShutdownHook(true); // ContextClosedEvent must fire on JVM shutdown to stop the tailer
        app.run(args);
    }
}
