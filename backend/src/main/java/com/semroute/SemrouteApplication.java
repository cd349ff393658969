/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SemrouteApplication {
    public static void main(String[] args) {
        SpringApplication.run(SemrouteApplication.class, args);
    }
}
