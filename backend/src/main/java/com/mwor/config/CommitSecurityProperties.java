package com.mwor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Keys for the at-rest envelope of committed round seeds.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "mwor.commit")
public class CommitSecurityProperties {

    public static final String DEFAULT_LOCAL_DEV_KEY_ID = "local-dev-v1";
    public static final String DEFAULT_LOCAL_DEV_KEY_BASE64 = "bXdvci1sb2NhbC1kZXYtc2VlZC1lbnZlbG9wZS1rZXk=";

    private String activeStorageKeyId = DEFAULT_LOCAL_DEV_KEY_ID;

    private Map<String, String> storageKeys = new HashMap<>(Map.of(
            DEFAULT_LOCAL_DEV_KEY_ID, DEFAULT_LOCAL_DEV_KEY_BASE64
    ));

    private long retentionHours = 48;
}
