package com.notevault.backup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Backup and restore service for NoteVault workspaces.
 *
 * To run:
 *   NOTEVAULT_DB_URL=jdbc:postgresql://localhost:5432/notevault \
 *   NOTEVAULT_UPLOAD_PATH=/var/lib/notevault/uploads mvn spring-boot:run
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BackupApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackupApplication.class, args);
    }
}
