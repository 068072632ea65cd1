package com.ospicorp.locationtracker.store;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.awscore.retry.AwsRetryStrategy;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.waiters.WaiterOverrideConfiguration;
import software.amazon.awssdk.core.waiters.WaiterResponse;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.retries.api.BackoffStrategy;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ListTablesRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

/**
 * {@link CoordinateStore} backed by the AWS SDK v2 synchronous DynamoDB client.
 */
public class DynamoDbCoordinateStore implements CoordinateStore, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(DynamoDbCoordinateStore.class);

  private static final String ACCESS_DENIED = "AccessDeniedException";
  private static final String RESOURCE_NOT_FOUND = "ResourceNotFoundException";
  private static final String RESOURCE_IN_USE = "ResourceInUseException";

  private final DynamoDbClient client;
  private final Duration listTimeout;

  public DynamoDbCoordinateStore(DynamoDbClient client, Duration listTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.listTimeout = Objects.requireNonNull(listTimeout, "listTimeout");
  }

  public static DynamoDbCoordinateStore create(String region, String accessKeyId,
      String secretAccessKey, URI endpoint, Duration listTimeout) {
    DynamoDbClientBuilder builder = DynamoDbClient.builder()
        .region(Region.of(region))
        .credentialsProvider(StaticCredentialsProvider.create(
            AwsBasicCredentials.create(accessKeyId, secretAccessKey)))
        .httpClientBuilder(ApacheHttpClient.builder())
        .overrideConfiguration(o -> o.retryStrategy(AwsRetryStrategy.doNotRetry()));
    if (endpoint != null && !endpoint.toString().isBlank()) {
      builder.endpointOverride(endpoint);
    }
    return new DynamoDbCoordinateStore(builder.build(), listTimeout);
  }

  @Override
  public List<Map<String, AttributeValue>> scan(String collection, List<String> fields) {
    Map<String, String> names = new LinkedHashMap<>();
    List<String> placeholders = new ArrayList<>(fields.size());
    for (int i = 0; i < fields.size(); i++) {
      String placeholder = "#f" + i;
      names.put(placeholder, fields.get(i));
      placeholders.add(placeholder);
    }
    ScanRequest.Builder request = ScanRequest.builder().tableName(collection);
    if (!fields.isEmpty()) {
      request.projectionExpression(String.join(", ", placeholders))
          .expressionAttributeNames(names);
    }
    try {
      List<Map<String, AttributeValue>> items = new ArrayList<>();
      client.scanPaginator(request.build()).items().forEach(items::add);
      log.debug("Scanned {} items from table {}", items.size(), collection);
      return items;
    } catch (SdkException ex) {
      throw translate(collection, ex);
    }
  }

  @Override
  public void put(String collection, Map<String, AttributeValue> item) {
    try {
      client.putItem(PutItemRequest.builder().tableName(collection).item(item).build());
    } catch (SdkException ex) {
      throw translate(collection, ex);
    }
  }

  @Override
  public void createCollection(String name, String keyAttribute) {
    CreateTableRequest request = CreateTableRequest.builder()
        .tableName(name)
        .keySchema(KeySchemaElement.builder()
            .attributeName(keyAttribute)
            .keyType(KeyType.HASH)
            .build())
        .attributeDefinitions(AttributeDefinition.builder()
            .attributeName(keyAttribute)
            .attributeType(ScalarAttributeType.S)
            .build())
        .billingMode(BillingMode.PAY_PER_REQUEST)
        .build();
    try {
      client.createTable(request);
      log.info("Requested creation of table {}", name);
    } catch (SdkException ex) {
      throw translate(name, ex);
    }
  }

  @Override
  public void waitUntilExists(String name, Duration pollInterval, int maxAttempts) {
    WaiterOverrideConfiguration waiterConfig = WaiterOverrideConfiguration.builder()
        .maxAttempts(maxAttempts)
        .backoffStrategyV2(BackoffStrategy.fixedDelayWithoutJitter(pollInterval))
        .build();
    try (DynamoDbWaiter waiter = DynamoDbWaiter.builder()
        .client(client)
        .overrideConfiguration(waiterConfig)
        .build()) {
      WaiterResponse<DescribeTableResponse> response =
          waiter.waitUntilTableExists(DescribeTableRequest.builder().tableName(name).build());
      response.matched().exception().ifPresent(ex -> {
        throw new StoreException("Table '" + name + "' did not become available: "
            + ex.getMessage(), null, ex);
      });
      log.info("Table {} is available after {} attempt(s)", name, response.attemptsExecuted());
    } catch (SdkException ex) {
      // the waiter wraps errors no acceptor matched; the cause is the real DescribeTable failure
      if (ex.getCause() instanceof SdkException cause) {
        throw translate(name, cause);
      }
      throw new StoreException("Table '" + name + "' did not become available within "
          + maxAttempts + " attempts: " + ex.getMessage(), null, ex);
    }
  }

  @Override
  public List<String> listCollections(int limit) {
    ListTablesRequest request = ListTablesRequest.builder()
        .limit(limit)
        .overrideConfiguration(o -> o.apiCallTimeout(listTimeout))
        .build();
    try {
      return client.listTables(request).tableNames();
    } catch (SdkException ex) {
      throw translate(null, ex);
    }
  }

  @Override
  public void close() {
    client.close();
  }

  static StoreException translate(String collection, SdkException ex) {
    String code = errorCode(ex);
    String message = errorMessage(ex);
    if (ex instanceof ResourceNotFoundException || RESOURCE_NOT_FOUND.equals(code)) {
      return new CollectionNotFoundException("Table '" + collection + "' not found: " + message, ex);
    }
    if (ex instanceof ResourceInUseException || RESOURCE_IN_USE.equals(code)) {
      return new CollectionAlreadyExistsException(
          "Table '" + collection + "' already exists: " + message, ex);
    }
    if (ACCESS_DENIED.equals(code)) {
      return new StoreAccessDeniedException(
          "Access denied. Please check AWS credentials and permissions.", ex);
    }
    return new StoreException("DynamoDB error: " + message, code, ex);
  }

  private static String errorCode(SdkException ex) {
    if (ex instanceof AwsServiceException service) {
      AwsErrorDetails details = service.awsErrorDetails();
      return details != null ? details.errorCode() : null;
    }
    return null;
  }

  private static String errorMessage(SdkException ex) {
    if (ex instanceof AwsServiceException service) {
      AwsErrorDetails details = service.awsErrorDetails();
      if (details != null && details.errorMessage() != null) {
        return details.errorMessage();
      }
    }
    return ex.getMessage();
  }
}
