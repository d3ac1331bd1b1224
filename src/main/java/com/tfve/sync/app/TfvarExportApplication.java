package com.tfve.sync.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command line entry point. The process exit code comes from {@link ExportRunner}.
 */
@SpringBootApplication(scanBasePackages = "com.tfve.sync")
public class TfvarExportApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TfvarExportApplication.class, args)));
    }
}
