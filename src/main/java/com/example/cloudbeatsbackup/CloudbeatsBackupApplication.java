package com.example.cloudbeatsbackup;

import com.example.cloudbeatsbackup.common.config.AppCacheProperties;
import com.example.cloudbeatsbackup.common.config.AppDropboxProperties;
import com.example.cloudbeatsbackup.common.config.AppRunProperties;
import com.example.cloudbeatsbackup.common.config.AppScanProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AppRunProperties.class,
        AppDropboxProperties.class,
        AppScanProperties.class,
        AppCacheProperties.class
})
public class CloudbeatsBackupApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CloudbeatsBackupApplication.class, args)));
    }
}
