package com.naag.docsync.config;

import com.naag.docsync.source.AccessTokenProvider;
import com.naag.docsync.source.ClientCredentialsTokenProvider;
import com.naag.docsync.source.GraphDriveClient;
import com.naag.docsync.source.RemoteSourceClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RemoteSourceConfig {

    @Bean
    public AccessTokenProvider graphTokenProvider(DocSyncProperties properties) {
        DocSyncProperties.SourceConfig source = properties.getSource();
        return new ClientCredentialsTokenProvider(source.getAuthorityUrl(), source.getTenantId(),
                source.getClientId(), source.getClientSecret());
    }

    @Bean
    public RemoteSourceClient remoteSourceClient(DocSyncProperties properties, AccessTokenProvider graphTokenProvider) {
        DocSyncProperties.SourceConfig source = properties.getSource();
        return new GraphDriveClient(source.getGraphBaseUrl(), source.getDriveId(), source.getPageSize(),
                source.getRequestTimeout(), graphTokenProvider);
    }
}
