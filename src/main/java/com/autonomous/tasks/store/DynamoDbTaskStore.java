package com.autonomous.tasks.store;

import com.autonomous.tasks.model.Task;
import com.autonomous.tasks.model.TaskAttributes;
import com.autonomous.tasks.model.TaskChanges;
import com.autonomous.tasks.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class DynamoDbTaskStore implements TaskStore {

    private final DynamoDbClient dynamoDb;
    private final String tableName;

    public DynamoDbTaskStore(DynamoDbClient dynamoDb, String tableName) {
        this.dynamoDb = dynamoDb;
        this.tableName = tableName;
    }

    @Override
    public Optional<Task> findById(String id) {
        try {
            GetItemResponse response = dynamoDb.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(TaskItemMapper.key(id))
                .consistentRead(true)
                .build());
            if (!response.hasItem() || response.item().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(TaskItemMapper.fromItem(response.item()));
        } catch (SdkException e) {
            throw failure("Error al obtener tarea " + id, e);
        }
    }

    @Override
    public Task insert(Task task) {
        try {
            dynamoDb.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(TaskItemMapper.toItem(task))
                .build());
            return task;
        } catch (SdkException e) {
            throw failure("Error al insertar tarea " + task.getId(), e);
        }
    }

    @Override
    public Optional<Task> mergeUpdate(String id, TaskChanges changes, String updatedAt) {
        Map<String, String> names = new HashMap<>();
        Map<String, AttributeValue> values = new HashMap<>();
        StringBuilder expression = new StringBuilder("SET #actualizado_en = :actualizado_en");
        names.put("#" + TaskAttributes.ACTUALIZADO_EN, TaskAttributes.ACTUALIZADO_EN);
        values.put(":" + TaskAttributes.ACTUALIZADO_EN, TaskItemMapper.string(updatedAt));

        changes.toAttributes().forEach((attribute, value) -> {
            expression.append(", #").append(attribute).append(" = :").append(attribute);
            names.put("#" + attribute, attribute);
            values.put(":" + attribute, TaskItemMapper.string(value));
        });
        names.put("#" + TaskAttributes.ID, TaskAttributes.ID);

        try {
            UpdateItemResponse response = dynamoDb.updateItem(UpdateItemRequest.builder()
                .tableName(tableName)
                .key(TaskItemMapper.key(id))
                .updateExpression(expression.toString())
                .conditionExpression("attribute_exists(#id)")
                .expressionAttributeNames(names)
                .expressionAttributeValues(values)
                .returnValues(ReturnValue.ALL_NEW)
                .build());
            return Optional.of(TaskItemMapper.fromItem(response.attributes()));
        } catch (ConditionalCheckFailedException e) {
            log.info("La tarea {} fue eliminada antes de poder actualizarla", id);
            return Optional.empty();
        } catch (SdkException e) {
            throw failure("Error al actualizar tarea " + id, e);
        }
    }

    @Override
    public void deleteById(String id) {
        try {
            dynamoDb.deleteItem(DeleteItemRequest.builder()
                .tableName(tableName)
                .key(TaskItemMapper.key(id))
                .build());
        } catch (SdkException e) {
            throw failure("Error al eliminar tarea " + id, e);
        }
    }

    @Override
    public List<Task> scan(Integer limit) {
        return scanPages(ScanRequest.builder().tableName(tableName), limit);
    }

    @Override
    public List<Task> scanByStatus(TaskStatus status, Integer limit) {
        ScanRequest.Builder request = ScanRequest.builder()
            .tableName(tableName)
            .filterExpression("#estado = :estado")
            .expressionAttributeNames(Map.of("#estado", TaskAttributes.ESTADO))
            .expressionAttributeValues(Map.of(":estado", TaskItemMapper.string(status.name())));
        return scanPages(request, limit);
    }

    // a filtered page can hold fewer items than its Limit, so keep paging
    private List<Task> scanPages(ScanRequest.Builder request, Integer limit) {
        boolean capped = limit != null && limit > 0;
        if (capped) {
            request.limit(limit);
        }

        List<Task> tasks = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        try {
            do {
                if (startKey != null) {
                    request.exclusiveStartKey(startKey);
                }
                ScanResponse page = dynamoDb.scan(request.build());
                for (Map<String, AttributeValue> item : page.items()) {
                    if (capped && tasks.size() >= limit) {
                        return tasks;
                    }
                    tasks.add(TaskItemMapper.fromItem(item));
                }
                startKey = page.hasLastEvaluatedKey() && !page.lastEvaluatedKey().isEmpty()
                    ? page.lastEvaluatedKey()
                    : null;
            } while (startKey != null && !(capped && tasks.size() >= limit));
        } catch (SdkException e) {
            throw failure("Error al obtener tareas", e);
        }
        return tasks;
    }

    private TaskStoreException failure(String message, SdkException cause) {
        return new TaskStoreException(message + " en la tabla " + tableName, cause);
    }
}
