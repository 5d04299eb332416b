package com.bbthechange.moments.config;

import com.bbthechange.moments.repository.impl.MomentDraftRepositoryImpl;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Reports the moments table as UP only while it is ACTIVE.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;

    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient) {
        this.dynamoDbClient = dynamoDbClient;
    }

    @Override
    public Health health() {
        try {
            TableStatus status = dynamoDbClient.describeTable(DescribeTableRequest.builder()
                    .tableName(MomentDraftRepositoryImpl.TABLE_NAME)
                    .build()).table().tableStatus();

            if (status == TableStatus.ACTIVE) {
                return Health.up()
                        .withDetail("momentsTable", status.toString())
                        .build();
            }
            return Health.down()
                    .withDetail("momentsTable", String.valueOf(status))
                    .withDetail("reason", "MomentsTable not active")
                    .build();
        } catch (SdkException e) {
            return Health.down()
                    .withDetail("error", "DynamoDB connection failed")
                    .withDetail("message", e.getMessage())
                    .build();
        }
    }
}
