package com.autonomous.tasks.config;

import com.autonomous.tasks.store.DynamoDbTaskStore;
import com.autonomous.tasks.store.InMemoryTaskStore;
import com.autonomous.tasks.store.TaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;

@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(name = "tareas.store.type", havingValue = "memory", matchIfMissing = true)
    public TaskStore inMemoryTaskStore() {
        log.info("Usando almacenamiento de tareas en memoria");
        return new InMemoryTaskStore();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "tareas.store.type", havingValue = "dynamodb")
    public DynamoDbClient dynamoDbClient(
            @Value("${tareas.dynamodb.region:us-east-1}") String region,
            @Value("${tareas.dynamodb.endpoint:}") String endpoint) {
        DynamoDbClientBuilder builder = DynamoDbClient.builder().region(Region.of(region));
        if (!endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "tareas.store.type", havingValue = "dynamodb")
    public TaskStore dynamoDbTaskStore(
            DynamoDbClient dynamoDbClient,
            @Value("${tareas.dynamodb.table:tareas}") String tableName) {
        log.info("Usando la tabla DynamoDB '{}'", tableName);
        return new DynamoDbTaskStore(dynamoDbClient, tableName);
    }
}
