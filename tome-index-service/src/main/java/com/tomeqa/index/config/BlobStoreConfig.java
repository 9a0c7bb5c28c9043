package com.tomeqa.index.config;

import com.tomeqa.index.blob.BlobStore;
import com.tomeqa.index.blob.FileSystemBlobStore;
import com.tomeqa.index.blob.InMemoryBlobStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class BlobStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "tomeqa.index.blob.type", havingValue = "filesystem", matchIfMissing = true)
    public BlobStore fileSystemBlobStore(@Value("${tomeqa.index.blob.root:./data/blobs}") String root) {
        return new FileSystemBlobStore(Path.of(root));
    }

    @Bean
    @ConditionalOnProperty(name = "tomeqa.index.blob.type", havingValue = "memory")
    public BlobStore inMemoryBlobStore() {
        return new InMemoryBlobStore();
    }
}
