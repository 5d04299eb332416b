package com.bbthechange.moments.repository.impl;

import com.bbthechange.moments.exception.RepositoryException;
import com.bbthechange.moments.model.MomentDraft;
import com.bbthechange.moments.repository.MomentDraftRepository;
import com.bbthechange.moments.util.MomentsKeyFactory;
import com.bbthechange.moments.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.*;

/**
 * Implementation of MomentDraftRepository using DynamoDB direct client.
 */
@Repository
public class MomentDraftRepositoryImpl implements MomentDraftRepository {

    private static final Logger logger = LoggerFactory.getLogger(MomentDraftRepositoryImpl.class);
    public static final String TABLE_NAME = "MomentsTable";

    // DynamoDB caps the operands of an IN comparison at 100
    private static final int MAX_IN_OPERANDS = 100;

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<MomentDraft> draftSchema;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public MomentDraftRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.draftSchema = TableSchema.fromBean(MomentDraft.class);
    }

    @Override
    public Set<String> findExistingContentHashes(String eventId, Collection<String> contentHashes) {
        if (contentHashes == null || contentHashes.isEmpty()) {
            return Collections.emptySet();
        }
        String eventPk = MomentsKeyFactory.getEventPk(eventId);
        List<String> hashes = new ArrayList<>(new LinkedHashSet<>(contentHashes));
        Set<String> existing = new HashSet<>();
        for (int from = 0; from < hashes.size(); from += MAX_IN_OPERANDS) {
            List<String> chunk = hashes.subList(from, Math.min(hashes.size(), from + MAX_IN_OPERANDS));
            existing.addAll(queryTracker.trackQuery("Query", TABLE_NAME, () -> queryHashes(eventPk, chunk)));
        }
        return existing;
    }

    private Set<String> queryHashes(String eventPk, List<String> hashes) {
        try {
            Map<String, AttributeValue> values = new HashMap<>();
            values.put(":pk", AttributeValue.builder().s(eventPk).build());
            values.put(":sk_prefix", AttributeValue.builder().s(MomentsKeyFactory.getMomentSkPrefix()).build());
            StringJoiner placeholders = new StringJoiner(", ");
            for (int i = 0; i < hashes.size(); i++) {
                String placeholder = ":h" + i;
                placeholders.add(placeholder);
                values.put(placeholder, AttributeValue.builder().s(hashes.get(i)).build());
            }

            Set<String> found = new HashSet<>();
            Map<String, AttributeValue> startKey = null;
            do {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .keyConditionExpression("pk = :pk AND begins_with(sk, :sk_prefix)")
                    .filterExpression("contentHash IN (" + placeholders + ")")
                    .projectionExpression("contentHash")
                    .expressionAttributeValues(values)
                    .exclusiveStartKey(startKey)
                    .build();

                QueryResponse response = dynamoDbClient.query(request);
                for (Map<String, AttributeValue> item : response.items()) {
                    AttributeValue hash = item.get("contentHash");
                    if (hash != null && hash.s() != null) {
                        found.add(hash.s());
                    }
                }
                startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                    ? response.lastEvaluatedKey()
                    : null;
            } while (startKey != null);

            return found;

        } catch (DynamoDbException e) {
            logger.error("Failed to look up content hashes for {}", eventPk, e);
            throw new RepositoryException("Failed to check for duplicate media", e);
        }
    }

    @Override
    public MomentDraft save(MomentDraft draft) {
        return queryTracker.trackQuery("PutItem", TABLE_NAME, () -> {
            try {
                draft.touch();
                Map<String, AttributeValue> itemMap = draftSchema.itemToMap(draft, true);

                PutItemRequest request = PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(itemMap)
                    .conditionExpression("attribute_not_exists(pk)")
                    .build();

                dynamoDbClient.putItem(request);
                logger.info("Saved draft moment {} for event {}", draft.getMomentId(), draft.getEventId());
                return draft;

            } catch (ConditionalCheckFailedException e) {
                logger.error("Moment {} already exists for event {}", draft.getMomentId(), draft.getEventId());
                throw new RepositoryException("Moment already exists: " + draft.getMomentId(), e);
            } catch (DynamoDbException e) {
                logger.error("Failed to save draft moment {}", draft.getMomentId(), e);
                throw new RepositoryException("Failed to save draft moment", e);
            }
        });
    }

    @Override
    public int publishDrafts(String eventId, String userId) {
        String eventPk = MomentsKeyFactory.getEventPk(eventId);
        List<Map<String, AttributeValue>> drafts = queryTracker.trackQuery("Query", TABLE_NAME,
            () -> findDraftKeys(eventPk, userId));

        int published = 0;
        for (Map<String, AttributeValue> key : drafts) {
            if (publishOne(key)) {
                published++;
            }
        }
        logger.info("Published {} draft moments of user {} for event {}", published, userId, eventId);
        return published;
    }

    private List<Map<String, AttributeValue>> findDraftKeys(String eventPk, String userId) {
        try {
            List<Map<String, AttributeValue>> keys = new ArrayList<>();
            Map<String, AttributeValue> startKey = null;
            do {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .keyConditionExpression("pk = :pk AND begins_with(sk, :sk_prefix)")
                    .filterExpression("userId = :userId AND #status = :draft")
                    .projectionExpression("pk, sk")
                    .expressionAttributeNames(Map.of("#status", "status"))
                    .expressionAttributeValues(Map.of(
                        ":pk", AttributeValue.builder().s(eventPk).build(),
                        ":sk_prefix", AttributeValue.builder().s(MomentsKeyFactory.getMomentSkPrefix()).build(),
                        ":userId", AttributeValue.builder().s(userId).build(),
                        ":draft", AttributeValue.builder().s(MomentsKeyFactory.STATUS_DRAFT).build()
                    ))
                    .exclusiveStartKey(startKey)
                    .build();

                QueryResponse response = dynamoDbClient.query(request);
                for (Map<String, AttributeValue> item : response.items()) {
                    keys.add(Map.of("pk", item.get("pk"), "sk", item.get("sk")));
                }
                startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                    ? response.lastEvaluatedKey()
                    : null;
            } while (startKey != null);

            return keys;

        } catch (DynamoDbException e) {
            logger.error("Failed to find drafts of user {} in {}", userId, eventPk, e);
            throw new RepositoryException("Failed to retrieve draft moments", e);
        }
    }

    private boolean publishOne(Map<String, AttributeValue> key) {
        return queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                String now = Instant.now().toString();
                UpdateItemRequest request = UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(key)
                    .updateExpression("SET #status = :published, publishedAt = :now, updatedAt = :now")
                    .conditionExpression("#status = :draft")
                    .expressionAttributeNames(Map.of("#status", "status"))
                    .expressionAttributeValues(Map.of(
                        ":published", AttributeValue.builder().s(MomentsKeyFactory.STATUS_PUBLISHED).build(),
                        ":draft", AttributeValue.builder().s(MomentsKeyFactory.STATUS_DRAFT).build(),
                        ":now", AttributeValue.builder().s(now).build()
                    ))
                    .build();

                dynamoDbClient.updateItem(request);
                return true;

            } catch (ConditionalCheckFailedException e) {
                // Published concurrently by another call
                logger.debug("Moment {} was no longer a draft", key.get("sk").s());
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to publish moment {}", key.get("sk").s(), e);
                throw new RepositoryException("Failed to publish draft moments", e);
            }
        });
    }

    @Override
    public void delete(String eventId, String momentId) {
        queryTracker.trackQuery("DeleteItem", TABLE_NAME, () -> {
            try {
                DeleteItemRequest request = DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(Map.of(
                        "pk", AttributeValue.builder().s(MomentsKeyFactory.getEventPk(eventId)).build(),
                        "sk", AttributeValue.builder().s(MomentsKeyFactory.getMomentSk(momentId)).build()
                    ))
                    .build();

                dynamoDbClient.deleteItem(request);
                logger.info("Deleted moment {} of event {}", momentId, eventId);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete moment {} of event {}", momentId, eventId, e);
                throw new RepositoryException("Failed to delete moment", e);
            }
        });
    }
}
